package org.gamevibe.compiler.frontend.parser.ast;

import org.gamevibe.compiler.api.SourceRange;

import java.util.List;

/**
 * The root of the AST: the top-level declarations of one GDL source, in source order.
 *
 * @param body The declarations.
 * @param range The source range covering all declarations.
 */
public record Program(List<Declaration> body, SourceRange range) implements AstNode {

    public Program {
        body = List.copyOf(body);
    }

    @Override
    public List<AstNode> getChildren() {
        return List.copyOf(body);
    }
}
