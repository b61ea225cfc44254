package org.gamevibe.compiler.frontend.parser.ast;

/**
 * A visitor over the closed set of {@link ExpressionNode} kinds.
 *
 * @param <R> The result type of the visit methods.
 */
public interface ExpressionVisitor<R> {
    R visitIdentifier(IdentifierNode node);
    R visitNumber(NumberLiteralNode node);
    R visitString(StringLiteralNode node);
    R visitBoolean(BooleanLiteralNode node);
    R visitCall(CallExpressionNode node);
    R visitMember(MemberExpressionNode node);
    R visitBinary(BinaryExpressionNode node);
    R visitUnary(UnaryExpressionNode node);
}
