package org.gamevibe.compiler.frontend.parser.ast;

import org.gamevibe.compiler.api.SourceRange;

/**
 * A {@code true} or {@code false} literal.
 *
 * @param value The boolean value.
 * @param range The source range of the literal.
 */
public record BooleanLiteralNode(boolean value, SourceRange range) implements ValueNode, ExpressionNode {

    @Override
    public <R> R accept(ValueVisitor<R> visitor) {
        return visitor.visitBoolean(this);
    }

    @Override
    public <R> R accept(ExpressionVisitor<R> visitor) {
        return visitor.visitBoolean(this);
    }
}
