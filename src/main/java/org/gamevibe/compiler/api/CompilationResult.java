package org.gamevibe.compiler.api;

import org.gamevibe.compiler.diagnostics.Diagnostic;
import org.gamevibe.compiler.frontend.parser.ast.Program;

import java.util.List;

/**
 * The outcome of {@link ICompiler#compile}.
 *
 * @param success true if code was generated.
 * @param code The generated TypeScript module, or null if compilation failed.
 * @param ast The parsed program, present whenever parsing produced one (also on failure), otherwise null.
 * @param errors The errors of the stage that stopped the compilation.
 * @param warnings The warnings found by semantic analysis.
 * @param metadata The declared names and referenced assets.
 * @param sourceMap The source map; empty unless requested and successful.
 * @param elapsedMillis The wall-clock duration of the request in milliseconds.
 */
public record CompilationResult(
        boolean success,
        String code,
        Program ast,
        List<Diagnostic> errors,
        List<Diagnostic> warnings,
        CompilationMetadata metadata,
        List<SourceMapping> sourceMap,
        double elapsedMillis
) {
    public CompilationResult {
        errors = List.copyOf(errors);
        warnings = List.copyOf(warnings);
        sourceMap = List.copyOf(sourceMap);
    }

    /**
     * Creates the result of a failed compilation.
     * @param ast The best-effort program, or null.
     * @param errors The errors.
     * @param warnings The warnings.
     * @param metadata The metadata of the best-effort program.
     * @param elapsedMillis The elapsed time.
     * @return The result.
     */
    public static CompilationResult failure(Program ast, List<Diagnostic> errors, List<Diagnostic> warnings,
                                            CompilationMetadata metadata, double elapsedMillis) {
        return new CompilationResult(false, null, ast, errors, warnings, metadata, List.of(), elapsedMillis);
    }
}
