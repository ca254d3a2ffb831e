package com.nodeflow.vgc.codegen;

import org.junit.Test;

import java.util.HashMap;
import java.util.Map;

import static org.junit.Assert.*;

public class GeneratorOptionsTest {

    @Test
    public void testDefaultsAllOn() {
        GeneratorOptions o = GeneratorOptions.DEFAULTS;
        assertTrue(o.isAddTypeHints());
        assertTrue(o.isAddDocstrings());
        assertTrue(o.isPreserveComments());
        assertTrue(o.isFormatCode());
        assertTrue(o.isOptimizeCode());
    }

    @Test
    public void testFromMap() {
        Map<String, Object> map = new HashMap<>();
        map.put("add_type_hints", false);
        map.put("format_code", "false");
        map.put("optimize_code", null);

        GeneratorOptions o = GeneratorOptions.fromMap(map);

        assertFalse(o.isAddTypeHints());
        assertFalse(o.isFormatCode());
        assertTrue(o.isOptimizeCode());
        assertTrue(o.isAddDocstrings());
        assertEquals(GeneratorOptions.DEFAULTS, GeneratorOptions.fromMap(null));
        assertEquals(GeneratorOptions.DEFAULTS, GeneratorOptions.fromMap(Map.of()));
    }

    @Test
    public void testToBuilder() {
        GeneratorOptions o = GeneratorOptions.DEFAULTS.toBuilder().addDocstrings(false).build();
        assertFalse(o.isAddDocstrings());
        assertTrue(o.isAddTypeHints());
    }
}
