package org.gamevibe.compiler.frontend.semantics.analysis;

import org.gamevibe.compiler.api.CompilerErrorCode;
import org.gamevibe.compiler.api.SourceRange;
import org.gamevibe.compiler.diagnostics.DiagnosticsEngine;
import org.gamevibe.compiler.frontend.parser.ast.BehaviorNode;
import org.gamevibe.compiler.frontend.parser.ast.EntityNode;
import org.gamevibe.compiler.frontend.parser.ast.GameNode;
import org.gamevibe.compiler.frontend.parser.ast.IdentifierNode;
import org.gamevibe.compiler.frontend.parser.ast.PropertyNode;
import org.gamevibe.compiler.frontend.parser.ast.SceneNode;
import org.gamevibe.compiler.frontend.parser.ast.SpawnNode;
import org.gamevibe.compiler.frontend.parser.ast.StringLiteralNode;
import org.gamevibe.compiler.frontend.parser.ast.ValueNode;
import org.gamevibe.compiler.frontend.semantics.NameSuggestions;
import org.gamevibe.compiler.frontend.semantics.Symbol;
import org.gamevibe.compiler.frontend.semantics.SymbolTable;

import java.util.Optional;

/**
 * Second pass: checks that behavior references, spawned entity types and the default scene
 * refer to declarations collected by {@link DeclarationCollectionPass}.
 */
public class ReferenceValidationPass extends DeclarationPass {

    static final String DEFAULT_SCENE_PROPERTY = "defaultScene";

    public ReferenceValidationPass(SymbolTable symbolTable, DiagnosticsEngine diagnostics) {
        super(symbolTable, diagnostics);
    }

    @Override
    public Void visitGame(GameNode game) {
        Optional<PropertyNode> defaultScene = game.property(DEFAULT_SCENE_PROPERTY);
        if (defaultScene.isEmpty()) {
            if (!symbolTable.names(Symbol.Type.SCENE).isEmpty()) {
                diagnostics.reportWarning("No defaultScene specified; no scene is loaded at startup",
                        game.range(), CompilerErrorCode.MISSING_DEFAULT_SCENE);
            }
            return null;
        }
        if (defaultScene.get().value() instanceof IdentifierNode scene) {
            requireDefined(scene.name(), Symbol.Type.SCENE, "Default scene '" + scene.name() + "' is not defined",
                    defaultScene.get().range(), CompilerErrorCode.UNDEFINED_SCENE);
        }
        return null;
    }

    @Override
    public Void visitEntity(EntityNode entity) {
        for (ValueNode reference : entity.behaviorReferences()) {
            if (reference instanceof IdentifierNode behavior) {
                requireDefined(behavior.name(), Symbol.Type.BEHAVIOR, "Behavior '" + behavior.name() + "' is not defined",
                        behavior.range(), CompilerErrorCode.UNDEFINED_BEHAVIOR);
            } else if (reference instanceof StringLiteralNode text) {
                diagnostics.reportWarning("Behavior reference \"" + text.value() + "\" is a string; use an identifier",
                        text.range(), CompilerErrorCode.STRING_BEHAVIOR_REFERENCE);
            }
        }
        return null;
    }

    @Override
    public Void visitBehavior(BehaviorNode behavior) {
        return null;
    }

    @Override
    public Void visitScene(SceneNode scene) {
        for (SpawnNode spawn : scene.spawns()) {
            requireDefined(spawn.entityType(), Symbol.Type.ENTITY, "Entity '" + spawn.entityType() + "' is not defined",
                    spawn.range(), CompilerErrorCode.UNDEFINED_ENTITY);
        }
        return null;
    }

    private void requireDefined(String name, Symbol.Type type, String message, SourceRange range, CompilerErrorCode code) {
        if (symbolTable.resolve(name, type).isEmpty()) {
            diagnostics.reportError(message, range, code, NameSuggestions.closest(name, symbolTable.names(type)));
        }
    }
}
