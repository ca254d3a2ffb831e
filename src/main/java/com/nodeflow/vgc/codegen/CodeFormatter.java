package com.nodeflow.vgc.codegen;

import java.util.ArrayList;
import java.util.List;

/**
 * Line-based normalization. Not language aware: indentation is rounded down to
 * a multiple of four, trailing whitespace is stripped, and a blank line is put
 * in front of every {@code class}/{@code def}/{@code async def} line that
 * follows a non-blank line, decorators included.
 */
public final class CodeFormatter {
    private static final int INDENT_SIZE = 4;

    public String format(String code) {
        String[] lines = code.split("\n", -1);
        List<String> out = new ArrayList<>(lines.length + 8);
        String previous = "";
        for (String raw : lines) {
            String line = normalize(raw);
            String stripped = line.strip();
            if (startsDefinition(stripped) && !previous.isEmpty())
                out.add("");
            out.add(line);
            previous = stripped;
        }
        return String.join("\n", out);
    }

    static String normalize(String raw) {
        String line = raw.stripTrailing();
        if (line.isEmpty())
            return "";
        String body = line.stripLeading();
        int leading = line.length() - body.length();
        return " ".repeat(leading / INDENT_SIZE * INDENT_SIZE) + body;
    }

    private static boolean startsDefinition(String stripped) {
        return stripped.startsWith("class ") || stripped.startsWith("def ") || stripped.startsWith("async def ");
    }
}
