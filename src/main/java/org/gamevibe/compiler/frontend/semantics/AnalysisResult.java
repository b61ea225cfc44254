package org.gamevibe.compiler.frontend.semantics;

import org.gamevibe.compiler.diagnostics.Diagnostic;

import java.util.List;

/**
 * The verdict of {@link SemanticAnalyzer#analyze}.
 *
 * @param valid true if no errors were found. Warnings do not affect validity.
 * @param errors The errors, in pass order and source order within a pass.
 * @param warnings The warnings, in the same order.
 */
public record AnalysisResult(boolean valid, List<Diagnostic> errors, List<Diagnostic> warnings) {

    public AnalysisResult {
        errors = List.copyOf(errors);
        warnings = List.copyOf(warnings);
    }
}
