package org.pragmatica.devcmd.tree;

/**
 * A position in source text (line and column, both 1-based, plus byte offset).
 */
public record SourceLocation(int line, int column, int offset) {

    public static final SourceLocation START = new SourceLocation(1, 1, 0);

    public static SourceLocation at(int line, int column, int offset) {
        return new SourceLocation(line, column, offset);
    }

    /**
     * Same line, {@code columns} characters and {@code bytes} UTF-8 bytes further on.
     */
    public SourceLocation shift(int columns, int bytes) {
        return new SourceLocation(line, column + columns, offset + bytes);
    }

    @Override
    public String toString() {
        return line + ":" + column;
    }
}
