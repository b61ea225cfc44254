package org.gamevibe.compiler.frontend.lexer;

import org.gamevibe.compiler.api.SourcePosition;
import org.gamevibe.compiler.api.SourceRange;

/**
 * Represents a single token extracted from the source code by the {@link Lexer}.
 *
 * @param type The type of the token (e.g., Keyword, Number, String).
 * @param text The literal text of the token. For strings this is the content with escapes resolved.
 * @param position The position of the first character of the token.
 * @param end The position just after the last character of the token.
 */
public record Token(
        TokenType type,
        String text,
        SourcePosition position,
        SourcePosition end
) {

    /**
     * Creates a zero-width token, as used for the end-of-file marker.
     * @param type The token type.
     * @param text The token text.
     * @param position The position of the token.
     */
    public Token(TokenType type, String text, SourcePosition position) {
        this(type, text, position, position);
    }

    /**
     * Returns the source range covered by this token.
     * @return The range from the first character to just after the last.
     */
    public SourceRange range() {
        return new SourceRange(position, end);
    }

    public int line() {
        return position.line();
    }

    public int column() {
        return position.column();
    }

    /**
     * Checks type and text at once.
     * @param type The expected type.
     * @param text The expected text.
     * @return true if both match.
     */
    public boolean is(TokenType type, String text) {
        return this.type == type && this.text.equals(text);
    }

    /**
     * Checks whether this is a punctuation token with the given text.
     * @param text The punctuation text, e.g. "{".
     * @return true if the token is that punctuation.
     */
    public boolean isPunctuation(String text) {
        return is(TokenType.PUNCTUATION, text);
    }

    /**
     * Checks whether this is the given keyword.
     * @param keyword The keyword text.
     * @return true if the token is that keyword.
     */
    public boolean isKeyword(String keyword) {
        return is(TokenType.KEYWORD, keyword);
    }
}
