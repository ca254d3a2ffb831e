package com.nodeflow.vgc.lowering.mapper;

import com.nodeflow.vgc.api.VisualNode;
import com.nodeflow.vgc.ast.Arguments;
import com.nodeflow.vgc.ast.AstNode;
import com.nodeflow.vgc.ast.Attribute;
import com.nodeflow.vgc.ast.Call;
import com.nodeflow.vgc.ast.ClassDef;
import com.nodeflow.vgc.ast.FunctionDef;
import com.nodeflow.vgc.ast.Keyword;
import com.nodeflow.vgc.ast.Name;
import com.nodeflow.vgc.ast.Pass;
import com.nodeflow.vgc.ast.Return;
import com.nodeflow.vgc.lowering.ConnectionContext;
import com.nodeflow.vgc.lowering.NodeMapper;

import java.util.List;

/**
 * Lowers a metaclass node: either a class declared with a metaclass, or the
 * definition of a metaclass deriving from {@code type}.
 */
public final class MetaclassMapper implements NodeMapper {

    @Override
    public AstNode lower(VisualNode node, ConnectionContext context) {
        switch (node.stringParameter("metaclass_type", "class_with_metaclass")) {
            case "class_with_metaclass":
                return new ClassDef(node.stringParameter("class_name", "MetaClass"), List.of(),
                        List.of(new Keyword("metaclass", new Name(node.stringParameter("metaclass_name", "type")))),
                        List.of(Pass.INSTANCE), List.of());
            case "metaclass_definition":
                return metaclassDefinition(node.stringParameter("metaclass_name", "CustomMeta"));
            default:
                return Pass.INSTANCE;
        }
    }

    private static ClassDef metaclassDefinition(String name) {
        Call create = Call.of(new Attribute(Call.of("super"), "__new__"),
                new Name("cls"), new Name("name"), new Name("bases"), new Name("attrs"));
        FunctionDef newMethod = FunctionDef.of("__new__", Arguments.of("cls", "name", "bases", "attrs"),
                new Return(create));
        return ClassDef.of(name, List.of(new Name("type")), newMethod);
    }
}
