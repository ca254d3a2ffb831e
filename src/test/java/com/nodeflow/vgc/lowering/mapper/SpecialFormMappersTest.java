package com.nodeflow.vgc.lowering.mapper;

import com.nodeflow.vgc.api.NodeKind;
import com.nodeflow.vgc.api.VisualNode;
import com.nodeflow.vgc.ast.Expr;
import com.nodeflow.vgc.ast.FunctionDef;
import com.nodeflow.vgc.codegen.CodeValidator;
import com.nodeflow.vgc.codegen.PythonUnparser;
import com.nodeflow.vgc.lowering.ConnectionContext;
import com.nodeflow.vgc.lowering.NodeMapper;
import org.junit.Test;

import static org.junit.Assert.*;

/** Decorator, async, generator and metaclass lowering. */
public class SpecialFormMappersTest {
    private final PythonUnparser unparser = new PythonUnparser();

    private String lower(NodeMapper mapper, NodeKind kind, String... params) {
        VisualNode.VisualNodeBuilder b = VisualNode.builder().kind(kind);
        for (int i = 0; i < params.length; i += 2)
            b.parameter(params[i], params[i + 1]);
        return unparser.render(mapper.lower(b.build(), ConnectionContext.EMPTY));
    }

    @Test
    public void testDecoratorReference() {
        DecoratorMapper m = new DecoratorMapper();
        assertEquals("decorator", lower(m, NodeKind.DECORATOR));
        assertEquals("property.setter", lower(m, NodeKind.DECORATOR, "decorator_name", "property.setter"));
        assertTrue(m.lower(VisualNode.of(NodeKind.DECORATOR), ConnectionContext.EMPTY) instanceof Expr);
    }

    @Test
    public void testDecoratedFunction() {
        assertEquals("@staticmethod\ndef handle():\n    pass", lower(new DecoratorMapper(), NodeKind.DECORATOR,
                "decorator_type", "decorated_function", "decorator_name", "staticmethod", "function_name", "handle"));
    }

    @Test
    public void testDecoratorDefinition() {
        assertEquals("def timer(func):\n"
                + "    def wrapper(*args, **kwargs):\n"
                + "        return func(*args, **kwargs)\n"
                + "    return wrapper",
                lower(new DecoratorMapper(), NodeKind.DECORATOR,
                        "decorator_type", "decorator_definition", "decorator_name", "timer"));
    }

    @Test
    public void testDottedDecoratorDefinitionUsesLastSegment() {
        String code = lower(new DecoratorMapper(), NodeKind.DECORATOR,
                "decorator_type", "decorator_definition", "decorator_name", "cache.timed");
        assertTrue(code.startsWith("def timed(func):\n"));
        assertTrue(new CodeValidator().validate(code).valid());
    }

    @Test
    public void testAsyncForms() {
        AsyncMapper m = new AsyncMapper();
        assertEquals("await async_function()", lower(m, NodeKind.ASYNC));
        assertEquals("async def fetch():\n    pass",
                lower(m, NodeKind.ASYNC, "async_type", "async_function", "function_name", "fetch"));
        assertEquals("async for item in async_iterable:\n    pass", lower(m, NodeKind.ASYNC, "async_type", "async_for"));
        assertEquals("async with async_context_manager as ctx:\n    pass",
                lower(m, NodeKind.ASYNC, "async_type", "async_with"));
        assertEquals("pass", lower(m, NodeKind.ASYNC, "async_type", "other"));

        FunctionDef f = (FunctionDef) m.lower(VisualNode.builder().kind(NodeKind.ASYNC)
                .parameter("async_type", "async_function").build(), ConnectionContext.EMPTY);
        assertEquals("AsyncFunctionDef", f.kind());
    }

    @Test
    public void testGeneratorForms() {
        GeneratorMapper m = new GeneratorMapper();
        assertEquals("yield None", lower(m, NodeKind.GENERATOR));
        assertEquals("yield from iterable", lower(m, NodeKind.GENERATOR, "generator_type", "yield_from"));
        assertEquals("def gen():\n    yield 1",
                lower(m, NodeKind.GENERATOR, "generator_type", "generator_function", "function_name", "gen"));
        assertEquals("[x for x in iterable]", lower(m, NodeKind.GENERATOR, "generator_type", "list_comprehension"));
        assertEquals("class Counter:\n"
                + "    def __iter__(self):\n"
                + "        return self\n"
                + "\n"
                + "    def __next__(self):\n"
                + "        raise StopIteration()",
                lower(m, NodeKind.GENERATOR, "generator_type", "iterator_protocol", "class_name", "Counter"));
    }

    @Test
    public void testMetaclassForms() {
        MetaclassMapper m = new MetaclassMapper();
        assertEquals("class Model(metaclass=ModelMeta):\n    pass", lower(m, NodeKind.METACLASS,
                "class_name", "Model", "metaclass_name", "ModelMeta"));
        assertEquals("class Registry(type):\n"
                + "    def __new__(cls, name, bases, attrs):\n"
                + "        return super().__new__(cls, name, bases, attrs)",
                lower(m, NodeKind.METACLASS, "metaclass_type", "metaclass_definition", "metaclass_name", "Registry"));
        assertEquals("pass", lower(m, NodeKind.METACLASS, "metaclass_type", "other"));
    }
}
