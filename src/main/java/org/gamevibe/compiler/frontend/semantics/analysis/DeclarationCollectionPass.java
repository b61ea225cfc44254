package org.gamevibe.compiler.frontend.semantics.analysis;

import org.gamevibe.compiler.api.CompilerErrorCode;
import org.gamevibe.compiler.diagnostics.DiagnosticsEngine;
import org.gamevibe.compiler.frontend.parser.ast.BehaviorNode;
import org.gamevibe.compiler.frontend.parser.ast.EntityNode;
import org.gamevibe.compiler.frontend.parser.ast.GameNode;
import org.gamevibe.compiler.frontend.parser.ast.SceneNode;
import org.gamevibe.compiler.frontend.semantics.Symbol;
import org.gamevibe.compiler.frontend.semantics.SymbolTable;

/**
 * First pass: enters every entity, behavior and scene into the symbol table so that
 * later passes can resolve forward references.
 */
public class DeclarationCollectionPass extends DeclarationPass {

    public DeclarationCollectionPass(SymbolTable symbolTable, DiagnosticsEngine diagnostics) {
        super(symbolTable, diagnostics);
    }

    @Override
    public Void visitGame(GameNode game) {
        if (!symbolTable.defineGame(game)) {
            diagnostics.reportWarning("Multiple game declarations; only the first one is used",
                    game.range(), CompilerErrorCode.MULTIPLE_GAME_DECLARATIONS);
        }
        return null;
    }

    @Override
    public Void visitEntity(EntityNode entity) {
        symbolTable.define(new Symbol(entity.name(), Symbol.Type.ENTITY, entity));
        return null;
    }

    @Override
    public Void visitBehavior(BehaviorNode behavior) {
        symbolTable.define(new Symbol(behavior.name(), Symbol.Type.BEHAVIOR, behavior));
        return null;
    }

    @Override
    public Void visitScene(SceneNode scene) {
        symbolTable.define(new Symbol(scene.name(), Symbol.Type.SCENE, scene));
        return null;
    }
}
