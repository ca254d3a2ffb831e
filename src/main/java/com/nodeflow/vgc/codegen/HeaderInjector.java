package com.nodeflow.vgc.codegen;

import java.time.Clock;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Prepends comment lines built from graph metadata ({@code description},
 * {@code author}, {@code version}) and a generation timestamp.
 */
public final class HeaderInjector {
    private static final DateTimeFormatter TIMESTAMP = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");

    private final Clock clock;

    public HeaderInjector(Clock clock) {
        this.clock = clock;
    }

    public List<String> header(Map<String, Object> metadata) {
        List<String> lines = new ArrayList<>();
        if (metadata.get("description") != null)
            lines.add("# " + metadata.get("description"));
        if (metadata.get("author") != null)
            lines.add("# Author: " + metadata.get("author"));
        if (metadata.get("version") != null)
            lines.add("# Version: " + metadata.get("version"));
        lines.add("# Generated on: " + LocalDateTime.now(clock).format(TIMESTAMP));
        return lines;
    }

    public String inject(String code, Map<String, Object> metadata) {
        return String.join("\n", header(metadata)) + "\n\n" + code;
    }
}
