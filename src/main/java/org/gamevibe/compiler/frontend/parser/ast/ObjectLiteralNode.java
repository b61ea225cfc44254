package org.gamevibe.compiler.frontend.parser.ast;

import org.gamevibe.compiler.api.SourceRange;

import java.util.List;

/**
 * An object literal {@code { key: value, ... }}.
 *
 * @param properties The entries in source order.
 * @param range The source range including the braces.
 */
public record ObjectLiteralNode(List<PropertyNode> properties, SourceRange range) implements ValueNode {

    public ObjectLiteralNode {
        properties = List.copyOf(properties);
    }

    @Override
    public <R> R accept(ValueVisitor<R> visitor) {
        return visitor.visitObject(this);
    }

    @Override
    public List<AstNode> getChildren() {
        return List.copyOf(properties);
    }
}
