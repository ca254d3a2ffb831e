package com.nodeflow.vgc.codegen;

import java.util.ArrayList;
import java.util.List;
import java.util.TreeSet;
import java.util.regex.Pattern;

/**
 * Hoists every import statement, sorted and deduplicated, above the rest of
 * the code and collapses runs of blank lines to a single one.
 *
 * <p>
 * Indented imports are moved too, dedented. A block left with no statements
 * gets a {@code pass} in their place.
 */
public final class ImportOptimizer {
    private static final Pattern IMPORT = Pattern.compile("^\\s*(import\\s+\\S|from\\s+\\S+\\s+import\\s).*");

    public String optimize(String code) {
        String[] lines = code.split("\n", -1);
        TreeSet<String> imports = new TreeSet<>();
        List<String> rest = new ArrayList<>(lines.length);
        // position in rest and indent of each removed indented import
        List<int[]> removed = new ArrayList<>();
        for (String line : lines) {
            if (IMPORT.matcher(line).matches()) {
                String body = line.strip();
                imports.add(body);
                int indent = indentOf(line);
                if (indent > 0)
                    removed.add(new int[] { rest.size(), indent });
            } else {
                rest.add(line);
            }
        }
        for (int i = removed.size() - 1; i >= 0; i--) {
            int at = removed.get(i)[0];
            int indent = removed.get(i)[1];
            if (leavesEmptyBlock(rest, at, indent))
                rest.add(at, " ".repeat(indent) + "pass");
        }

        List<String> out = new ArrayList<>(imports.size() + rest.size() + 1);
        out.addAll(imports);
        boolean hasCode = rest.stream().anyMatch(l -> !l.isBlank());
        if (!imports.isEmpty() && hasCode)
            out.add("");
        if (hasCode || imports.isEmpty())
            out.addAll(rest);
        return collapseBlankLines(out);
    }

    /**
     * True when the nearest non-blank line before {@code at} opens a block
     * shallower than {@code indent} and nothing at {@code indent} or deeper
     * follows it.
     */
    private static boolean leavesEmptyBlock(List<String> lines, int at, int indent) {
        int before = at - 1;
        while (before >= 0 && lines.get(before).isBlank())
            before--;
        if (before < 0)
            return false;
        String header = lines.get(before).strip();
        if (indentOf(lines.get(before)) >= indent || header.startsWith("#") || !header.endsWith(":"))
            return false;
        int after = at;
        while (after < lines.size() && lines.get(after).isBlank())
            after++;
        return after == lines.size() || indentOf(lines.get(after)) < indent;
    }

    private static int indentOf(String line) {
        int i = 0;
        while (i < line.length() && line.charAt(i) == ' ')
            i++;
        return i;
    }

    static String collapseBlankLines(List<String> lines) {
        List<String> out = new ArrayList<>(lines.size());
        boolean previousBlank = false;
        for (String line : lines) {
            String stripped = line.stripTrailing();
            boolean blank = stripped.isEmpty();
            if (blank && previousBlank)
                continue;
            out.add(stripped);
            previousBlank = blank;
        }
        return String.join("\n", out);
    }
}
