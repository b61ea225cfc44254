package org.gamevibe.compiler.frontend.parser.ast;

import org.gamevibe.compiler.api.SourceRange;

import java.util.List;

/**
 * An AST node that represents the global game configuration ({@code game { ... }}).
 *
 * @param properties The configuration properties.
 * @param range The source range of the declaration.
 */
public record GameNode(List<PropertyNode> properties, SourceRange range) implements Declaration {

    public GameNode {
        properties = List.copyOf(properties);
    }

    @Override
    public String keyword() {
        return "game";
    }

    @Override
    public <R> R accept(DeclarationVisitor<R> visitor) {
        return visitor.visitGame(this);
    }
}
