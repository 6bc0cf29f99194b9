package org.pragmatica.devcmd.parser;

import org.pragmatica.devcmd.ast.Program;
import org.pragmatica.devcmd.error.ErrorFormatter;
import org.pragmatica.devcmd.error.ErrorKind;
import org.pragmatica.devcmd.error.ParseError;
import org.pragmatica.devcmd.error.QuickFix;

import java.util.List;
import java.util.Optional;

/**
 * Outcome of a parse: the tree built from everything that could be understood, plus every error
 * collected on the way. The program is always present; with errors it holds the well-formed
 * declarations only.
 *
 * @param program the parsed program
 * @param errors  collected errors, in discovery order (empty on full success)
 * @param source  the source text, when parsing started from text
 */
public record ParseResult(Program program, List<ParseError> errors, Optional<String> source) {

    public ParseResult {
        errors = List.copyOf(errors);
    }

    public boolean isSuccess() {
        return errors.isEmpty();
    }

    public boolean hasErrors() {
        return !errors.isEmpty();
    }

    public int errorCount() {
        return errors.size();
    }

    public List<ParseError> errorsOf(ErrorKind kind) {
        return errors.stream().filter(error -> error.kind() == kind).toList();
    }

    /**
     * Errors rendered against their source lines, or one line each when no source is available.
     */
    public String formatErrors() {
        return source.map(text -> ErrorFormatter.format(errors, lines(text)))
                     .orElseGet(() -> ErrorFormatter.formatSimple(errors));
    }

    public String formatReport() {
        return ErrorFormatter.formatReport(errors, source.map(ParseResult::lines).orElse(List.of()));
    }

    public List<QuickFix> quickFixes() {
        return QuickFix.generate(errors, source.map(ParseResult::lines).orElse(List.of()));
    }

    private static List<String> lines(String text) {
        return List.of(text.split("\r?\n", -1));
    }
}
