package org.gamevibe.compiler.frontend.semantics.analysis;

import org.gamevibe.compiler.frontend.parser.ast.Program;

/**
 * One ordered pass of semantic analysis over the top-level declarations.
 * Passes report through the diagnostics engine they were created with and never modify the AST.
 */
@FunctionalInterface
public interface IAnalysisPass {
    /**
     * Runs the pass.
     * @param program The program to analyze.
     */
    void run(Program program);
}
