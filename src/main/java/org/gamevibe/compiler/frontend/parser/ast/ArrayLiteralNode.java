package org.gamevibe.compiler.frontend.parser.ast;

import org.gamevibe.compiler.api.SourceRange;

import java.util.List;

/**
 * An array literal {@code [a, b, ...]} (or the parenthesised form {@code (a, b)}).
 *
 * @param elements The elements in source order.
 * @param range The source range including the brackets.
 */
public record ArrayLiteralNode(List<ValueNode> elements, SourceRange range) implements ValueNode {

    public ArrayLiteralNode {
        elements = List.copyOf(elements);
    }

    @Override
    public <R> R accept(ValueVisitor<R> visitor) {
        return visitor.visitArray(this);
    }

    @Override
    public List<AstNode> getChildren() {
        return List.copyOf(elements);
    }
}
