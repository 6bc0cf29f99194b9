package org.pragmatica.devcmd.error;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.TreeMap;

/**
 * Compiler-style rendering of parse errors.
 *
 * <p>Example output:
 * <pre>
 *    3 | build echo hello
 *        ^~~~~
 *      3:1: error: expected ':' after command name
 *      note: add ':' after 'build'
 *      help: Commands need a colon: 'build: echo hello'
 * </pre>
 */
public final class ErrorFormatter {
    private static final String GUTTER = " ".repeat(7);
    private static final String INDENT = " ".repeat(5);
    private static final int MAX_SUGGESTIONS = 3;

    private ErrorFormatter() {}

    /**
     * Render errors grouped by source line, ascending, each group headed by the offending line.
     */
    public static String format(List<ParseError> errors, List<String> sourceLines) {
        if (errors.isEmpty()) {
            return "";
        }
        var byLine = new TreeMap<Integer, List<ParseError>>();
        for (var error : errors) {
            byLine.computeIfAbsent(error.line(), line -> new ArrayList<>()).add(error);
        }
        var sb = new StringBuilder();
        byLine.forEach((lineNumber, lineErrors) -> {
            if (lineNumber > 0 && lineNumber <= sourceLines.size()) {
                var sourceLine = sourceLines.get(lineNumber - 1);
                sb.append('\n')
                  .append(String.format("%4d | %s", lineNumber, sourceLine))
                  .append('\n');
                for (var error : lineErrors) {
                    sb.append(indicator(error, sourceLine));
                }
            }
            for (var error : lineErrors) {
                sb.append(describe(error, true)).append('\n');
            }
        });
        return sb.toString();
    }

    /**
     * One entry per error, without source context.
     */
    public static String formatSimple(List<ParseError> errors) {
        var sb = new StringBuilder();
        for (var error : errors) {
            if (sb.length() > 0) {
                sb.append('\n');
            }
            sb.append(describe(error, false));
        }
        return sb.toString();
    }

    /**
     * Summary header, grouped listing and up to three distinct fix suggestions.
     */
    public static String formatReport(List<ParseError> errors, List<String> sourceLines) {
        if (errors.isEmpty()) {
            return "No parse errors found";
        }
        var sb = new StringBuilder();
        sb.append("error: found ").append(errors.size()).append(" error(s)\n");
        sb.append(format(errors, sourceLines));

        var suggestions = new LinkedHashSet<String>();
        errors.forEach(error -> ErrorHints.suggestionFor(error).ifPresent(suggestions::add));
        if (!suggestions.isEmpty()) {
            sb.append("\nhelp: common fixes:\n");
            suggestions.stream()
                       .limit(MAX_SUGGESTIONS)
                       .forEach(suggestion -> sb.append("  - ").append(suggestion).append('\n'));
        }
        return sb.toString();
    }

    static String describe(ParseError error, boolean withHelp) {
        var sb = new StringBuilder();
        sb.append(INDENT)
          .append(error.line()).append(':').append(error.column())
          .append(": error: ")
          .append(error.message());
        if (error.hasHint()) {
            sb.append('\n').append(INDENT).append("note: ").append(error.hint());
        }
        if (withHelp) {
            ErrorHints.helpFor(error)
                      .ifPresent(help -> sb.append('\n').append(INDENT).append("help: ").append(help));
        }
        return sb.toString();
    }

    static String indicator(ParseError error, String sourceLine) {
        int column = error.column();
        if (column <= 0 || column > sourceLine.length() + 1) {
            return "";
        }
        var sb = new StringBuilder(GUTTER);
        for (int i = 1; i < column; i++) {
            sb.append(sourceLine.charAt(i - 1) == '\t' ? '\t' : ' ');
        }
        sb.append(error.kind() == ErrorKind.SEMANTIC ? '~' : '^');
        int length = error.token().raw().length();
        if (length > 1) {
            sb.append("~".repeat(length - 1));
        }
        return sb.append('\n').toString();
    }
}
