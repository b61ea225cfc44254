package org.gamevibe.compiler.frontend.semantics;

import org.gamevibe.compiler.diagnostics.DiagnosticsEngine;
import org.gamevibe.compiler.frontend.parser.ast.Program;
import org.gamevibe.compiler.frontend.semantics.analysis.DeclarationCollectionPass;
import org.gamevibe.compiler.frontend.semantics.analysis.IAnalysisPass;
import org.gamevibe.compiler.frontend.semantics.analysis.PropertySchemaPass;
import org.gamevibe.compiler.frontend.semantics.analysis.ReferenceValidationPass;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Performs semantic analysis on the AST: symbol collection, cross-reference validation and
 * per-property schema checks. The AST is never modified.
 * <p>
 * Each call to {@link #analyze(Program)} uses a fresh symbol table and diagnostics engine,
 * so an analyzer can be reused and results never leak between programs.
 */
public class SemanticAnalyzer {

    private static final Logger LOG = LoggerFactory.getLogger(SemanticAnalyzer.class);

    /**
     * Analyzes the given program.
     * It performs three passes: one to collect declarations, one to validate references
     * between them, and one to check property values.
     * @param program The program to analyze.
     * @return The verdict with all errors and warnings.
     */
    public AnalysisResult analyze(Program program) {
        DiagnosticsEngine diagnostics = new DiagnosticsEngine();
        SymbolTable symbolTable = new SymbolTable(diagnostics);
        List<IAnalysisPass> passes = List.of(
                new DeclarationCollectionPass(symbolTable, diagnostics),
                new ReferenceValidationPass(symbolTable, diagnostics),
                new PropertySchemaPass(symbolTable, diagnostics));
        for (IAnalysisPass pass : passes) {
            pass.run(program);
        }
        LOG.debug("Semantic analysis of {} declarations: {}", program.body().size(), diagnostics.summary());
        return new AnalysisResult(!diagnostics.hasErrors(), diagnostics.errors(), diagnostics.warnings());
    }
}
