package org.gamevibe.compiler.backend.codegen;

import org.gamevibe.compiler.api.SourceMapping;

import java.util.List;

/**
 * The output of {@link CodeGenerator#generate}.
 *
 * @param code The generated TypeScript module.
 * @param sourceMap One entry per emitted declaration block; empty unless requested.
 */
public record GeneratedCode(String code, List<SourceMapping> sourceMap) {

    public GeneratedCode {
        sourceMap = List.copyOf(sourceMap);
    }
}
