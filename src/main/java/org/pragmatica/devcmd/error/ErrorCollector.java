package org.pragmatica.devcmd.error;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Accumulates errors up to a fixed budget. Once the budget is spent further errors are dropped,
 * everything collected so far is kept.
 */
public final class ErrorCollector {
    private static final Logger log = LoggerFactory.getLogger(ErrorCollector.class);

    private final int maxErrors;
    private final List<ParseError> errors = new ArrayList<>();
    private boolean exhaustedLogged;

    public ErrorCollector(int maxErrors) {
        if (maxErrors < 1) {
            throw new IllegalArgumentException("maxErrors must be positive, got " + maxErrors);
        }
        this.maxErrors = maxErrors;
    }

    /**
     * @return {@code true} if the error was recorded, {@code false} if the budget was already spent
     */
    public boolean add(ParseError error) {
        if (isFull()) {
            if (!exhaustedLogged) {
                exhaustedLogged = true;
                log.debug("Error budget of {} exhausted, dropping further errors", maxErrors);
            }
            return false;
        }
        errors.add(error);
        return true;
    }

    public boolean isFull() {
        return errors.size() >= maxErrors;
    }

    public int size() {
        return errors.size();
    }

    public int maxErrors() {
        return maxErrors;
    }

    public List<ParseError> errors() {
        return List.copyOf(errors);
    }
}
