package com.nodeflow.vgc.lowering;

import com.nodeflow.vgc.api.NodeKind;
import com.nodeflow.vgc.lowering.mapper.AsyncMapper;
import com.nodeflow.vgc.lowering.mapper.ClassMapper;
import com.nodeflow.vgc.lowering.mapper.ControlFlowMapper;
import com.nodeflow.vgc.lowering.mapper.DecoratorMapper;
import com.nodeflow.vgc.lowering.mapper.FunctionMapper;
import com.nodeflow.vgc.lowering.mapper.GeneratorMapper;
import com.nodeflow.vgc.lowering.mapper.MetaclassMapper;
import com.nodeflow.vgc.lowering.mapper.VariableMapper;

import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Registry mapping {@link NodeKind}s to their lowering strategies.
 *
 * <p>
 * Built-in mappers are registered at construction. Callers may add mappers
 * for the remaining kinds or replace a built-in one. The registry is
 * read-mostly: do not register while a lowering is in flight.
 */
public final class MapperRegistry {
    private final Map<NodeKind, NodeMapper> mappers = new EnumMap<>(NodeKind.class);

    public MapperRegistry() {
        registerBuiltIns();
    }

    /** Registers or replaces the mapper for {@code kind}. */
    public MapperRegistry register(NodeKind kind, NodeMapper mapper) {
        mappers.put(Objects.requireNonNull(kind, "kind"), Objects.requireNonNull(mapper, "mapper"));
        return this;
    }

    public Optional<NodeMapper> mapperFor(NodeKind kind) {
        return Optional.ofNullable(mappers.get(kind));
    }

    public boolean isRegistered(NodeKind kind) {
        return mappers.containsKey(kind);
    }

    // ── Built-in Mappers ───────────────────────────────────────────

    private void registerBuiltIns() {
        register(NodeKind.FUNCTION, new FunctionMapper());
        register(NodeKind.VARIABLE, new VariableMapper());
        register(NodeKind.CLASS, new ClassMapper());
        register(NodeKind.CONTROL_FLOW, new ControlFlowMapper());
        register(NodeKind.DECORATOR, new DecoratorMapper());
        register(NodeKind.ASYNC, new AsyncMapper());
        register(NodeKind.GENERATOR, new GeneratorMapper());
        register(NodeKind.METACLASS, new MetaclassMapper());
    }
}
