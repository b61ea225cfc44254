package org.gamevibe.compiler.frontend.semantics.analysis;

import org.gamevibe.compiler.diagnostics.DiagnosticsEngine;
import org.gamevibe.compiler.frontend.parser.ast.Declaration;
import org.gamevibe.compiler.frontend.parser.ast.DeclarationVisitor;
import org.gamevibe.compiler.frontend.parser.ast.Program;
import org.gamevibe.compiler.frontend.semantics.SymbolTable;

/**
 * Base class for passes that visit each top-level declaration once, in source order.
 */
public abstract class DeclarationPass implements IAnalysisPass, DeclarationVisitor<Void> {

    protected final SymbolTable symbolTable;
    protected final DiagnosticsEngine diagnostics;

    protected DeclarationPass(SymbolTable symbolTable, DiagnosticsEngine diagnostics) {
        this.symbolTable = symbolTable;
        this.diagnostics = diagnostics;
    }

    @Override
    public void run(Program program) {
        for (Declaration declaration : program.body()) {
            declaration.accept(this);
        }
    }
}
