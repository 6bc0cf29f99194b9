package org.pragmatica.devcmd.error;

/**
 * Error taxonomy.
 */
public enum ErrorKind {
    SYNTAX("syntax"),
    SEMANTIC("semantic"),
    DUPLICATE("duplicate"),
    REFERENCE("reference");

    private final String display;

    ErrorKind(String display) {
        this.display = display;
    }

    public String display() {
        return display;
    }
}
