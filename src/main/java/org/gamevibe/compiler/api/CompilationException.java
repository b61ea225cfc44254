package org.gamevibe.compiler.api;

/**
 * An exception that is thrown when a compilation request cannot be carried out at all,
 * for example because the source file cannot be read.
 * <p>
 * Errors in the compiled source itself are never thrown; they are returned as
 * diagnostics in a {@link CompilationResult}.
 */
public class CompilationException extends Exception {

    /**
     * Constructs a new compilation exception with the specified detail message.
     * @param message The detail message.
     */
    public CompilationException(String message) {
        super(message, null);
    }

    /**
     * Constructs a new compilation exception with the specified detail message and cause.
     * @param message The detail message.
     * @param cause The cause.
     */
    public CompilationException(String message, Throwable cause) {
        super(message, cause);
    }
}
