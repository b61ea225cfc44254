package org.gamevibe.compiler.api;

import org.gamevibe.compiler.diagnostics.Diagnostic;

import java.util.List;

/**
 * The outcome of {@link ICompiler#validate}: a syntax-only check.
 *
 * @param valid true if the source parsed without errors.
 * @param errors The syntax errors.
 * @param warnings The warnings; syntax checking currently produces none.
 */
public record ValidationResult(boolean valid, List<Diagnostic> errors, List<Diagnostic> warnings) {

    public ValidationResult {
        errors = List.copyOf(errors);
        warnings = List.copyOf(warnings);
    }
}
