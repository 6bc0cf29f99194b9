package org.pragmatica.devcmd.tree;

/**
 * Source range, start inclusive and end exclusive.
 */
public record SourceSpan(SourceLocation start, SourceLocation end) {

    public static SourceSpan of(SourceLocation start, SourceLocation end) {
        return new SourceSpan(start, end);
    }

    /**
     * Zero-width span, used for positions such as the end of input or an empty body.
     */
    public static SourceSpan at(SourceLocation location) {
        return new SourceSpan(location, location);
    }

    public boolean isEmpty() {
        return start.offset() == end.offset();
    }

    public boolean contains(SourceLocation location) {
        return location.offset() >= start.offset() && location.offset() < end.offset();
    }

    @Override
    public String toString() {
        return start + "-" + end;
    }
}
