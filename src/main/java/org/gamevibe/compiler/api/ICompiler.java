package org.gamevibe.compiler.api;

import java.util.concurrent.CompletableFuture;

/**
 * Defines the public interface for the GDL compiler.
 * <p>
 * Problems in the compiled source are reported as diagnostics in the returned results;
 * none of these methods throws because of malformed input.
 */
public interface ICompiler {

    /**
     * Compiles the given source code.
     *
     * @param source The complete GDL source text.
     * @param options The options for this request.
     * @return The result, carrying generated code on success and diagnostics otherwise.
     */
    CompilationResult compile(String source, CompilerOptions options);

    /**
     * Compiles the given source code with the configured default options.
     * @param source The complete GDL source text.
     * @return The result.
     */
    default CompilationResult compile(String source) {
        return compile(source, CompilerOptions.defaults());
    }

    /**
     * Compiles the given source code and returns the result as a future.
     * Compilation itself is synchronous.
     *
     * @param source The complete GDL source text.
     * @param options The options for this request.
     * @return A future that is already completed with the result.
     */
    CompletableFuture<CompilationResult> compileAsync(String source, CompilerOptions options);

    /**
     * Checks the syntax of the given source without semantic analysis or code generation.
     *
     * @param source The complete GDL source text.
     * @return The validation verdict.
     */
    ValidationResult validate(String source);
}
