package org.gamevibe.compiler.frontend.semantics.analysis;

import org.gamevibe.compiler.api.CompilerErrorCode;
import org.gamevibe.compiler.diagnostics.DiagnosticsEngine;
import org.gamevibe.compiler.frontend.parser.ast.ArrayLiteralNode;
import org.gamevibe.compiler.frontend.parser.ast.BehaviorNode;
import org.gamevibe.compiler.frontend.parser.ast.BooleanLiteralNode;
import org.gamevibe.compiler.frontend.parser.ast.EntityNode;
import org.gamevibe.compiler.frontend.parser.ast.GameNode;
import org.gamevibe.compiler.frontend.parser.ast.IdentifierNode;
import org.gamevibe.compiler.frontend.parser.ast.PropertyNode;
import org.gamevibe.compiler.frontend.parser.ast.SceneNode;
import org.gamevibe.compiler.frontend.parser.ast.StringLiteralNode;
import org.gamevibe.compiler.frontend.parser.ast.ValueNode;
import org.gamevibe.compiler.frontend.semantics.NameSuggestions;
import org.gamevibe.compiler.frontend.semantics.SymbolTable;

import java.util.List;

/**
 * Third pass: checks well-known properties against their fixed schema.
 * Unknown properties are accepted as they are.
 */
public class PropertySchemaPass extends DeclarationPass {

    static final List<String> PHYSICS_MODES = List.of("static", "dynamic", "kinematic", "platformer", "topdown");
    static final List<String> SCALE_MODES = List.of("fit", "exact", "zoom");
    static final List<String> PHYSICS_ENGINES = List.of("arcade", "matter");

    public PropertySchemaPass(SymbolTable symbolTable, DiagnosticsEngine diagnostics) {
        super(symbolTable, diagnostics);
    }

    @Override
    public Void visitGame(GameNode game) {
        for (PropertyNode property : game.properties()) {
            switch (property.name()) {
                case "size" -> checkSize(property);
                case "scale" -> checkOneOf(property, SCALE_MODES, "Invalid scale mode", CompilerErrorCode.INVALID_SCALE_MODE);
                case "physics" -> checkOneOf(property, PHYSICS_ENGINES, "Invalid physics engine", CompilerErrorCode.INVALID_PHYSICS_ENGINE);
                case "pixelArt" -> {
                    if (!(property.value() instanceof BooleanLiteralNode)) {
                        diagnostics.reportError("pixelArt must be a boolean (true or false)",
                                property.range(), CompilerErrorCode.INVALID_PIXEL_ART);
                    }
                }
                default -> { }
            }
        }
        return null;
    }

    @Override
    public Void visitEntity(EntityNode entity) {
        for (PropertyNode property : entity.properties()) {
            switch (property.name()) {
                case "size" -> checkSize(property);
                case "physics" -> checkOneOf(property, PHYSICS_MODES, "Invalid physics mode", CompilerErrorCode.INVALID_PHYSICS_MODE);
                default -> { }
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
        for (PropertyNode property : scene.properties()) {
            if (property.name().equals("size")) {
                checkSize(property);
            }
        }
        return null;
    }

    private void checkSize(PropertyNode property) {
        if (!(property.value() instanceof ArrayLiteralNode array) || array.elements().size() != 2) {
            diagnostics.reportError("Size must be an array with 2 elements [width, height]",
                    property.range(), CompilerErrorCode.INVALID_SIZE);
        }
    }

    private void checkOneOf(PropertyNode property, List<String> allowed, String prefix, CompilerErrorCode code) {
        ValueNode value = property.value();
        String name = ValueText.of(value);
        boolean byName = value instanceof IdentifierNode || value instanceof StringLiteralNode;
        if (byName && allowed.contains(name)) {
            return;
        }
        List<String> suggestions = NameSuggestions.closest(name, allowed);
        diagnostics.reportError(
                prefix + " '" + name + "'. Expected one of: " + String.join(", ", allowed),
                property.range(), code, suggestions.isEmpty() ? allowed : suggestions);
    }
}
