package org.gamevibe.compiler.diagnostics;

import org.gamevibe.compiler.api.CompilerErrorCode;
import org.gamevibe.compiler.api.SourceRange;

import java.util.List;

/**
 * Represents a single diagnostic message (error or warning)
 * that occurs during the compilation process.
 *
 * @param type The type of the diagnostic (e.g., ERROR, WARNING).
 * @param message The diagnostic message.
 * @param range The source range the diagnostic refers to, or null if it has none.
 * @param code The machine-readable code, or null if none applies.
 * @param suggestions Possible fixes, e.g. similarly named declarations. Never null.
 */
public record Diagnostic(
        Type type,
        String message,
        SourceRange range,
        CompilerErrorCode code,
        List<String> suggestions
) {
    /**
     * The type of a diagnostic message.
     */
    public enum Type {
        /** An error that prevents compilation. */
        ERROR,
        /** A warning that does not prevent compilation. */
        WARNING
    }

    public Diagnostic {
        suggestions = suggestions == null ? List.of() : List.copyOf(suggestions);
    }

    /**
     * Creates an error diagnostic.
     * @param message The message.
     * @param range The source range, or null.
     * @param code The code, or null.
     * @return The diagnostic.
     */
    public static Diagnostic error(String message, SourceRange range, CompilerErrorCode code) {
        return new Diagnostic(Type.ERROR, message, range, code, List.of());
    }

    public boolean isError() {
        return type == Type.ERROR;
    }

    @Override
    public String toString() {
        String where = range != null ? range.start().toString() : "?";
        return String.format("[%s] %s: %s", type, where, message);
    }
}
