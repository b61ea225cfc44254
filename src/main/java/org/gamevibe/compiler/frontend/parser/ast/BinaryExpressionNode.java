package org.gamevibe.compiler.frontend.parser.ast;

import org.gamevibe.compiler.api.SourceRange;

import java.util.List;

/**
 * A binary arithmetic expression such as {@code x + 10}.
 *
 * @param operator One of {@code + - * /}.
 * @param left The left operand.
 * @param right The right operand.
 * @param range The source range of the expression.
 */
public record BinaryExpressionNode(String operator, ExpressionNode left, ExpressionNode right, SourceRange range)
        implements ExpressionNode {

    @Override
    public <R> R accept(ExpressionVisitor<R> visitor) {
        return visitor.visitBinary(this);
    }

    @Override
    public List<AstNode> getChildren() {
        return List.of(left, right);
    }
}
