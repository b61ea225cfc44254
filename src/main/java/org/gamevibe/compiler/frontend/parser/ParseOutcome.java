package org.gamevibe.compiler.frontend.parser;

import org.gamevibe.compiler.frontend.lexer.Token;

/**
 * The explicit result of a parsing helper: either a parsed value or a syntax error
 * together with the token at which it was detected.
 * <p>
 * Expected syntax errors travel as values up to the declaration loop of the {@link Parser},
 * which records them and resynchronizes.
 *
 * @param <T> The type of the parsed value.
 */
public sealed interface ParseOutcome<T> {

    /**
     * A successfully parsed value.
     * @param value The value.
     * @param <T> The value type.
     */
    record Success<T>(T value) implements ParseOutcome<T> {}

    /**
     * A syntax error.
     * @param message The error message.
     * @param token The offending token.
     * @param <T> The value type that could not be produced.
     */
    record Failure<T>(String message, Token token) implements ParseOutcome<T> {}

    static <T> ParseOutcome<T> success(T value) {
        return new Success<>(value);
    }

    static <T> ParseOutcome<T> failure(String message, Token token) {
        return new Failure<>(message, token);
    }

    /**
     * @return true if this outcome is a syntax error.
     */
    default boolean failed() {
        return this instanceof Failure;
    }

    /**
     * Returns the parsed value.
     * @return The value.
     * @throws IllegalStateException if this outcome is a failure.
     */
    default T value() {
        if (this instanceof Success<T> success) {
            return success.value();
        }
        throw new IllegalStateException("No value available: " + this);
    }

    /**
     * Re-types a failure so that it can be returned from a helper producing a different value type.
     * @param <U> The target value type.
     * @return The same failure with the new type.
     * @throws IllegalStateException if this outcome is a success.
     */
    default <U> ParseOutcome<U> propagate() {
        if (this instanceof Failure<T> failure) {
            return new Failure<>(failure.message(), failure.token());
        }
        throw new IllegalStateException("Only failures can be propagated: " + this);
    }
}
