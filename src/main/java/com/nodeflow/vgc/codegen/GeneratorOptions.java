package com.nodeflow.vgc.codegen;

import java.util.Map;

import lombok.Builder;
import lombok.Value;

/**
 * Switches for the optional generation passes. Every pass is on by default.
 */
@Value
@Builder(toBuilder = true)
public class GeneratorOptions {
    public static final GeneratorOptions DEFAULTS = builder().build();

    @Builder.Default
    boolean addTypeHints = true;
    @Builder.Default
    boolean addDocstrings = true;
    @Builder.Default
    boolean preserveComments = true;
    @Builder.Default
    boolean formatCode = true;
    @Builder.Default
    boolean optimizeCode = true;

    /**
     * Reads options from a snake_case map ({@code add_type_hints},
     * {@code add_docstrings}, {@code preserve_comments}, {@code format_code},
     * {@code optimize_code}). Missing keys keep their default; values are
     * interpreted with {@link Boolean#parseBoolean} unless already boolean.
     */
    public static GeneratorOptions fromMap(Map<String, ?> map) {
        if (map == null)
            return DEFAULTS;
        return builder()
                .addTypeHints(flag(map, "add_type_hints"))
                .addDocstrings(flag(map, "add_docstrings"))
                .preserveComments(flag(map, "preserve_comments"))
                .formatCode(flag(map, "format_code"))
                .optimizeCode(flag(map, "optimize_code"))
                .build();
    }

    private static boolean flag(Map<String, ?> map, String key) {
        Object v = map.get(key);
        if (v == null)
            return true;
        if (v instanceof Boolean b)
            return b;
        return Boolean.parseBoolean(v.toString());
    }
}
