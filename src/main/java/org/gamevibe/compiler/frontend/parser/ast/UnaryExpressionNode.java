package org.gamevibe.compiler.frontend.parser.ast;

import org.gamevibe.compiler.api.SourceRange;

import java.util.List;

/**
 * A prefix expression such as {@code -offset} or {@code !flag}.
 *
 * @param operator Either {@code -} or {@code !}.
 * @param operand The operand.
 * @param range The source range of the expression.
 */
public record UnaryExpressionNode(String operator, ExpressionNode operand, SourceRange range) implements ExpressionNode {

    @Override
    public <R> R accept(ExpressionVisitor<R> visitor) {
        return visitor.visitUnary(this);
    }

    @Override
    public List<AstNode> getChildren() {
        return List.of(operand);
    }
}
