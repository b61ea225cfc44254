package org.gamevibe.compiler.diagnostics;

import org.gamevibe.compiler.api.CompilerErrorCode;
import org.gamevibe.compiler.api.SourceRange;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

/**
 * An engine for collecting and managing diagnostic messages (errors, warnings)
 * that occur during one compilation phase.
 * <p>
 * This decouples error reporting from the actual compiler logic (parser, analyzer).
 * Diagnostics are kept in the order they were reported.
 */
public class DiagnosticsEngine {

    private final List<Diagnostic> diagnostics = new ArrayList<>();

    /**
     * Reports an error.
     *
     * @param message     The error message.
     * @param range       The source range of the error.
     * @param code        The machine-readable code.
     * @param suggestions Possible fixes, may be empty.
     */
    public void reportError(String message, SourceRange range, CompilerErrorCode code, List<String> suggestions) {
        diagnostics.add(new Diagnostic(Diagnostic.Type.ERROR, message, range, code, suggestions));
    }

    /**
     * Reports an error without suggestions.
     *
     * @param message The error message.
     * @param range   The source range of the error.
     * @param code    The machine-readable code.
     */
    public void reportError(String message, SourceRange range, CompilerErrorCode code) {
        reportError(message, range, code, List.of());
    }

    /**
     * Reports a warning.
     *
     * @param message The warning message.
     * @param range   The source range of the warning.
     * @param code    The machine-readable code.
     */
    public void reportWarning(String message, SourceRange range, CompilerErrorCode code) {
        diagnostics.add(new Diagnostic(Diagnostic.Type.WARNING, message, range, code, List.of()));
    }

    /**
     * Checks if errors have been reported.
     *
     * @return {@code true} if at least one error exists, otherwise {@code false}.
     */
    public boolean hasErrors() {
        return diagnostics.stream().anyMatch(Diagnostic::isError);
    }

    /**
     * Returns an unmodifiable list of all collected diagnostics.
     *
     * @return An unmodifiable list of diagnostics.
     */
    public List<Diagnostic> getDiagnostics() {
        return Collections.unmodifiableList(diagnostics);
    }

    /**
     * Returns the collected errors in reporting order.
     *
     * @return A copy of the error diagnostics.
     */
    public List<Diagnostic> errors() {
        return diagnostics.stream().filter(Diagnostic::isError).toList();
    }

    /**
     * Returns the collected warnings in reporting order.
     *
     * @return A copy of the warning diagnostics.
     */
    public List<Diagnostic> warnings() {
        return diagnostics.stream().filter(d -> !d.isError()).toList();
    }

    /**
     * Returns all collected diagnostics as a single, formatted string.
     *
     * @return A formatted string summary of all diagnostics.
     */
    public String summary() {
        return diagnostics.stream()
                .map(Diagnostic::toString)
                .collect(Collectors.joining("\n"));
    }
}
