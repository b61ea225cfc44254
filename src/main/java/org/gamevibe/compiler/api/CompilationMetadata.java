package org.gamevibe.compiler.api;

import java.util.List;

/**
 * Summary of what a GDL program declares, for tooling that must not parse generated code
 * (e.g. populating a level editor's entity palette).
 *
 * @param entities The declared entity names, in source order.
 * @param behaviors The declared behavior names, in source order.
 * @param scenes The declared scene names, in source order.
 * @param assets The distinct asset paths referenced by asset properties, in source order.
 */
public record CompilationMetadata(
        List<String> entities,
        List<String> behaviors,
        List<String> scenes,
        List<String> assets
) {
    public CompilationMetadata {
        entities = List.copyOf(entities);
        behaviors = List.copyOf(behaviors);
        scenes = List.copyOf(scenes);
        assets = List.copyOf(assets);
    }
}
