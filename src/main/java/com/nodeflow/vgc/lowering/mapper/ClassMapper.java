package com.nodeflow.vgc.lowering.mapper;

import com.nodeflow.vgc.api.VisualNode;
import com.nodeflow.vgc.ast.AnnAssign;
import com.nodeflow.vgc.ast.Arguments;
import com.nodeflow.vgc.ast.Assign;
import com.nodeflow.vgc.ast.AstNode;
import com.nodeflow.vgc.ast.Attribute;
import com.nodeflow.vgc.ast.Call;
import com.nodeflow.vgc.ast.ClassDef;
import com.nodeflow.vgc.ast.Constant;
import com.nodeflow.vgc.ast.Expr;
import com.nodeflow.vgc.ast.FunctionDef;
import com.nodeflow.vgc.ast.If;
import com.nodeflow.vgc.ast.Name;
import com.nodeflow.vgc.ast.Pass;
import com.nodeflow.vgc.ast.Return;
import com.nodeflow.vgc.ast.Stmt;
import com.nodeflow.vgc.ast.UnaryOp;
import com.nodeflow.vgc.lowering.ConnectionContext;
import com.nodeflow.vgc.lowering.Literals;
import com.nodeflow.vgc.lowering.NodeMapper;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Lowers a class node. {@code class_type} selects the shape:
 * <ul>
 * <li>{@code basic} - empty body.</li>
 * <li>{@code abstract} - adds base {@code ABC} and one
 * {@code @abstractmethod}.</li>
 * <li>{@code dataclass} - {@code @dataclass} with one annotated field per
 * entry of {@code fields}.</li>
 * <li>{@code singleton} - a {@code __new__} that creates the instance
 * once.</li>
 * </ul>
 */
public final class ClassMapper implements NodeMapper {

    @Override
    public AstNode lower(VisualNode node, ConnectionContext context) {
        String className = node.stringParameter("class_name", "UnnamedClass");
        List<Expr> bases = new ArrayList<>();
        for (String base : Literals.stringList(node.parameter("base_classes")))
            bases.add(new Name(base));

        switch (node.stringParameter("class_type", "basic")) {
            case "abstract":
                return abstractClass(className, bases);
            case "dataclass":
                return dataclass(className, bases, node.parameter("fields"));
            case "singleton":
                return singleton(className, bases);
            default:
                return ClassDef.of(className, bases, Pass.INSTANCE);
        }
    }

    private static ClassDef abstractClass(String className, List<Expr> bases) {
        boolean hasAbc = bases.stream().anyMatch(b -> b instanceof Name n && n.id().equals("ABC"));
        if (!hasAbc)
            bases.add(new Name("ABC"));
        FunctionDef method = FunctionDef.of("abstract_method", Arguments.of("self"), Pass.INSTANCE)
                .withDecorators(List.of(new Name("abstractmethod")));
        return ClassDef.of(className, bases, method);
    }

    private static ClassDef dataclass(String className, List<Expr> bases, Object fields) {
        List<Stmt> body = new ArrayList<>();
        if (fields instanceof List<?> list) {
            for (Object f : list) {
                Map<?, ?> field = f instanceof Map<?, ?> m ? m : Map.of();
                body.add(new AnnAssign(new Name(string(field.get("name"), "field")),
                        new Name(string(field.get("type"), "Any")), null));
            }
        }
        if (body.isEmpty())
            body.add(Pass.INSTANCE);
        return new ClassDef(className, bases, List.of(), body, List.of(new Name("dataclass")));
    }

    private static ClassDef singleton(String className, List<Expr> bases) {
        Expr instance = new Attribute(new Name("cls"), "_instance");
        Stmt guard = new If(UnaryOp.not(Call.of("hasattr", new Name("cls"), Constant.of("_instance"))),
                List.of(new Assign(List.of(instance),
                        Call.of(new Attribute(Call.of("super"), "__new__"), new Name("cls")))),
                List.of());
        FunctionDef factory = FunctionDef.of("__new__", Arguments.of("cls"), guard, new Return(instance));
        return ClassDef.of(className, bases, factory);
    }

    private static String string(Object value, String fallback) {
        return value != null ? value.toString() : fallback;
    }
}
