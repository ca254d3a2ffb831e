package com.nodeflow.vgc.codegen;

/**
 * Line statistics of a piece of source text. Lines are separated by
 * {@code \n}; a trailing newline yields a final empty line.
 */
public record CodeMetrics(int totalLines, int nonEmptyLines, int commentLines, int maxLineLength,
        double avgLineLength) {

    public static CodeMetrics of(String code) {
        String[] lines = code.split("\n", -1);
        int nonEmpty = 0;
        int comments = 0;
        int max = 0;
        long sum = 0;
        for (String line : lines) {
            String stripped = line.strip();
            if (!stripped.isEmpty())
                nonEmpty++;
            if (stripped.startsWith("#"))
                comments++;
            max = Math.max(max, line.length());
            sum += line.length();
        }
        return new CodeMetrics(lines.length, nonEmpty, comments, max, (double) sum / lines.length);
    }
}
