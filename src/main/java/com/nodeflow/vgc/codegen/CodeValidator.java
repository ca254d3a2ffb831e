package com.nodeflow.vgc.codegen;

import java.util.ArrayList;
import java.util.List;

import com.nodeflow.vgc.parse.PythonParser;
import com.nodeflow.vgc.parse.SourceParseException;

/**
 * Post-generation checks: the text must parse, and style issues are reported
 * as warnings. Never throws.
 */
public final class CodeValidator {
    public static final int MAX_LINE_LENGTH = 88;

    public record Result(boolean valid, List<String> errors, List<String> warnings) {
        public Result {
            errors = List.copyOf(errors);
            warnings = List.copyOf(warnings);
        }
    }

    public Result validate(String code) {
        List<String> errors = new ArrayList<>();
        List<String> warnings = new ArrayList<>();
        boolean valid = false;
        try {
            PythonParser.parse(code);
            valid = true;
        } catch (SourceParseException e) {
            errors.add("Syntax error: " + e.getMessage());
        } catch (RuntimeException e) {
            errors.add("Parse error: " + e);
        }

        String[] lines = code.split("\n", -1);
        for (int i = 0; i < lines.length; i++) {
            String line = lines[i];
            if (line.length() > MAX_LINE_LENGTH)
                warnings.add("Line " + (i + 1) + " exceeds maximum length");
            if (line.endsWith(" ") || line.endsWith("\t"))
                warnings.add("Line " + (i + 1) + " has trailing whitespace");
        }
        return new Result(valid, errors, warnings);
    }
}
