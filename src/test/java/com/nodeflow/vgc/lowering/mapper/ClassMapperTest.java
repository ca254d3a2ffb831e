package com.nodeflow.vgc.lowering.mapper;

import com.nodeflow.vgc.api.NodeKind;
import com.nodeflow.vgc.api.VisualNode;
import com.nodeflow.vgc.ast.ClassDef;
import com.nodeflow.vgc.codegen.PythonUnparser;
import com.nodeflow.vgc.lowering.ConnectionContext;
import org.junit.Test;

import java.util.List;
import java.util.Map;

import static org.junit.Assert.*;

public class ClassMapperTest {
    private final ClassMapper mapper = new ClassMapper();
    private final PythonUnparser unparser = new PythonUnparser();

    private String lower(VisualNode node) {
        return unparser.render(mapper.lower(node, ConnectionContext.EMPTY));
    }

    @Test
    public void testBasicClassWithBases() {
        VisualNode node = VisualNode.builder().kind(NodeKind.CLASS)
                .parameter("class_name", "Dog")
                .parameter("base_classes", List.of("Animal", "Mixin"))
                .build();

        assertEquals("class Dog(Animal, Mixin):\n    pass", lower(node));
    }

    @Test
    public void testDefaults() {
        assertEquals("class UnnamedClass:\n    pass", lower(VisualNode.of(NodeKind.CLASS)));
    }

    @Test
    public void testAbstractAddsAbcOnce() {
        VisualNode node = VisualNode.builder().kind(NodeKind.CLASS)
                .parameter("class_name", "Shape")
                .parameter("class_type", "abstract")
                .parameter("base_classes", List.of("ABC"))
                .build();

        ClassDef def = (ClassDef) mapper.lower(node, ConnectionContext.EMPTY);
        assertEquals(1, def.bases().size());
        assertEquals("class Shape(ABC):\n"
                + "    @abstractmethod\n"
                + "    def abstract_method(self):\n"
                + "        pass", lower(node));
    }

    @Test
    public void testDataclassFields() {
        VisualNode node = VisualNode.builder().kind(NodeKind.CLASS)
                .parameter("class_name", "Point")
                .parameter("class_type", "dataclass")
                .parameter("fields", List.of(Map.of("name", "x", "type", "int"), Map.of("name", "label")))
                .build();

        assertEquals("@dataclass\nclass Point:\n    x: int\n    label: Any", lower(node));
    }

    @Test
    public void testDataclassWithoutFields() {
        VisualNode node = VisualNode.builder().kind(NodeKind.CLASS)
                .parameter("class_name", "Empty")
                .parameter("class_type", "dataclass")
                .build();

        assertEquals("@dataclass\nclass Empty:\n    pass", lower(node));
    }

    @Test
    public void testSingleton() {
        VisualNode node = VisualNode.builder().kind(NodeKind.CLASS)
                .parameter("class_name", "Config")
                .parameter("class_type", "singleton")
                .build();

        assertEquals("class Config:\n"
                + "    def __new__(cls):\n"
                + "        if not hasattr(cls, '_instance'):\n"
                + "            cls._instance = super().__new__(cls)\n"
                + "        return cls._instance", lower(node));
    }
}
