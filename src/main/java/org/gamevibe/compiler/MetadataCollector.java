package org.gamevibe.compiler;

import org.gamevibe.compiler.api.CompilationMetadata;
import org.gamevibe.compiler.frontend.parser.ast.AstNode;
import org.gamevibe.compiler.frontend.parser.ast.BehaviorNode;
import org.gamevibe.compiler.frontend.parser.ast.Declaration;
import org.gamevibe.compiler.frontend.parser.ast.EntityNode;
import org.gamevibe.compiler.frontend.parser.ast.Program;
import org.gamevibe.compiler.frontend.parser.ast.PropertyNode;
import org.gamevibe.compiler.frontend.parser.ast.SceneNode;
import org.gamevibe.compiler.frontend.parser.ast.StringLiteralNode;

import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Extracts {@link CompilationMetadata} from a program. Works on any parsed program,
 * including ones that failed semantic analysis.
 */
final class MetadataCollector {

    private MetadataCollector() {}

    /**
     * Collects declared names and referenced assets.
     * @param program The program.
     * @param assetProperties The property names whose string values are assets.
     * @return The metadata.
     */
    static CompilationMetadata collect(Program program, Collection<String> assetProperties) {
        Set<String> entities = new LinkedHashSet<>();
        Set<String> behaviors = new LinkedHashSet<>();
        Set<String> scenes = new LinkedHashSet<>();
        for (Declaration declaration : program.body()) {
            if (declaration instanceof EntityNode entity) {
                entities.add(entity.name());
            } else if (declaration instanceof BehaviorNode behavior) {
                behaviors.add(behavior.name());
            } else if (declaration instanceof SceneNode scene) {
                scenes.add(scene.name());
            }
        }
        Set<String> assets = new LinkedHashSet<>();
        collectAssets(program, Set.copyOf(assetProperties), assets);
        return new CompilationMetadata(List.copyOf(entities), List.copyOf(behaviors), List.copyOf(scenes), List.copyOf(assets));
    }

    private static void collectAssets(AstNode node, Set<String> assetProperties, Set<String> assets) {
        if (node instanceof PropertyNode property && assetProperties.contains(property.name())) {
            collectStrings(property.value(), assets);
            return;
        }
        for (AstNode child : node.getChildren()) {
            collectAssets(child, assetProperties, assets);
        }
    }

    private static void collectStrings(AstNode node, Set<String> assets) {
        if (node instanceof StringLiteralNode string) {
            assets.add(string.value());
            return;
        }
        for (AstNode child : node.getChildren()) {
            collectStrings(child, assets);
        }
    }
}
