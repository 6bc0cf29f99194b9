package org.pragmatica.devcmd.error;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Mechanical textual fix for a common mistake.
 *
 * @param description what the fix does
 * @param line        1-based line the fix applies to
 * @param oldText     text to replace
 * @param newText     replacement text
 * @param confidence  0.0 to 1.0
 */
public record QuickFix(String description, int line, String oldText, String newText, double confidence) {

    public static List<QuickFix> generate(List<ParseError> errors, List<String> sourceLines) {
        var fixes = new ArrayList<QuickFix>();
        for (var error : errors) {
            if (error.line() <= 0 || error.line() > sourceLines.size()) {
                continue;
            }
            forError(error, sourceLines.get(error.line() - 1)).ifPresent(fixes::add);
        }
        return List.copyOf(fixes);
    }

    /**
     * Apply the fix to its line, replacing the first occurrence of {@code oldText}.
     */
    public String applyTo(String sourceLine) {
        int at = sourceLine.indexOf(oldText);
        if (at < 0) {
            return sourceLine;
        }
        return sourceLine.substring(0, at) + newText + sourceLine.substring(at + oldText.length());
    }

    static Optional<QuickFix> forError(ParseError error, String sourceLine) {
        var message = error.message().toLowerCase(Locale.ROOT);
        var words = sourceLine.trim().split("\\s+");

        if (message.contains("expected ':'") && !words[0].isEmpty() && !words[0].endsWith(":")) {
            int nameAt = words[0].equals("watch") || words[0].equals("stop") ? 1 : 0;
            if (nameAt < words.length) {
                var name = words[nameAt];
                return Optional.of(new QuickFix("Add missing colon after command name",
                                                error.line(), name, name + ":", 0.9));
            }
        }
        if (message.contains("expected '='") && words.length >= 3 && words[0].equals("var")) {
            return Optional.of(new QuickFix("Add missing equals sign in variable declaration",
                                            error.line(),
                                            "var " + words[1] + " " + words[2],
                                            "var " + words[1] + " = " + words[2],
                                            0.8));
        }
        if (message.contains("unclosed") && (message.contains("paren") || message.contains("argument"))
            && count(sourceLine, '(') > count(sourceLine, ')')) {
            return Optional.of(new QuickFix("Add missing closing parenthesis",
                                            error.line(), sourceLine, sourceLine + ")", 0.7));
        }
        return Optional.empty();
    }

    private static long count(String text, char c) {
        return text.chars().filter(ch -> ch == c).count();
    }
}
