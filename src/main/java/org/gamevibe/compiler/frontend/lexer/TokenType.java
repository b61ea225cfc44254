package org.gamevibe.compiler.frontend.lexer;

/**
 * Defines the different types of tokens that the {@link Lexer} can recognize.
 */
public enum TokenType {
    // Literals.
    /** An identifier, such as an entity or property name. */
    IDENTIFIER,
    /** A string literal; the token text is the unescaped content. */
    STRING,
    /** A numeric literal, possibly negative, fractional or with an exponent. */
    NUMBER,
    /** The literal {@code true} or {@code false}. */
    BOOLEAN,

    // Keywords & symbols.
    /** A reserved word, such as {@code entity} or {@code spawn}. */
    KEYWORD,
    /** An operator, such as {@code +} or {@code >=}. */
    OPERATOR,
    /** One of {@code { } ( ) [ ] , : ;} or any character the lexer does not recognize. */
    PUNCTUATION,

    // Miscellaneous.
    /** Represents the end of the source text. */
    END_OF_FILE;

    /**
     * Returns a lower-case description for use in diagnostics, e.g. {@code "end of file"}.
     * @return The description.
     */
    public String description() {
        return name().toLowerCase().replace('_', ' ');
    }
}
