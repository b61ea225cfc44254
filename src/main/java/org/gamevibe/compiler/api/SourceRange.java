package org.gamevibe.compiler.api;

/**
 * A span of source code between two positions. Attached to every AST node and,
 * where available, to every diagnostic.
 *
 * @param start The position where the range begins.
 * @param end The position where the range ends.
 */
public record SourceRange(SourcePosition start, SourcePosition end) {

    /**
     * Creates a zero-width range at a single position.
     * @param position The position.
     * @return A range starting and ending at {@code position}.
     */
    public static SourceRange at(SourcePosition position) {
        return new SourceRange(position, position);
    }

    /**
     * Creates a range covering both given ranges.
     * @param first The range that starts the span.
     * @param last The range that ends the span.
     * @return A range from the start of {@code first} to the end of {@code last}.
     */
    public static SourceRange span(SourceRange first, SourceRange last) {
        return new SourceRange(first.start(), last.end());
    }

    @Override
    public String toString() {
        return start.equals(end) ? start.toString() : start + "-" + end;
    }
}
