package com.nodeflow.vgc.codegen;

import org.junit.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.junit.Assert.*;

public class HeaderInjectorTest {
    private final HeaderInjector injector =
            new HeaderInjector(Clock.fixed(Instant.parse("2024-01-02T03:04:05Z"), ZoneOffset.UTC));

    @Test
    public void testFullHeader() {
        Map<String, Object> meta = Map.of("version", "1.0", "author", "Ada", "description", "Demo", "name", "g");

        assertEquals(List.of("# Demo", "# Author: Ada", "# Version: 1.0", "# Generated on: 2024-01-02 03:04:05"),
                injector.header(meta));
    }

    @Test
    public void testTimestampOnly() {
        assertEquals("# Generated on: 2024-01-02 03:04:05\n\nx = 1", injector.inject("x = 1", Map.of()));
    }

    @Test
    public void testNullValuesAreSkipped() {
        Map<String, Object> meta = new HashMap<>();
        meta.put("description", null);
        meta.put("author", "Ada");
        meta.put("version", null);
        assertEquals(List.of("# Author: Ada", "# Generated on: 2024-01-02 03:04:05"), injector.header(meta));
    }
}
