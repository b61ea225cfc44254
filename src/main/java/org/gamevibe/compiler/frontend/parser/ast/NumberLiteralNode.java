package org.gamevibe.compiler.frontend.parser.ast;

import org.gamevibe.compiler.api.SourceRange;

/**
 * A numeric literal. The source text is kept so that generated code reproduces it exactly.
 *
 * @param text The literal as written, e.g. {@code "-2.50"}.
 * @param value The parsed value.
 * @param range The source range of the literal.
 */
public record NumberLiteralNode(String text, double value, SourceRange range) implements ValueNode, ExpressionNode {

    @Override
    public <R> R accept(ValueVisitor<R> visitor) {
        return visitor.visitNumber(this);
    }

    @Override
    public <R> R accept(ExpressionVisitor<R> visitor) {
        return visitor.visitNumber(this);
    }
}
