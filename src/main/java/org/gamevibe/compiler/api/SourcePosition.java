package org.gamevibe.compiler.api;

/**
 * A pure data class representing a single position in the source code.
 * It is part of the public compiler API and free of implementation details.
 *
 * @param line The 1-based line number.
 * @param column The 1-based column number.
 * @param offset The 0-based character offset from the start of the source.
 */
public record SourcePosition(int line, int column, int offset) {

    /** The position of the very first character of a source. */
    public static final SourcePosition START = new SourcePosition(1, 1, 0);

    @Override
    public String toString() {
        return line + ":" + column;
    }
}
