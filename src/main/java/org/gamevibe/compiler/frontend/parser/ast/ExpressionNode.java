package org.gamevibe.compiler.frontend.parser.ast;

/**
 * An expression in a spawn position. Identifiers and scalar literals are both values and operands.
 */
public sealed interface ExpressionNode extends AstNode
        permits IdentifierNode, NumberLiteralNode, StringLiteralNode, BooleanLiteralNode,
                CallExpressionNode, MemberExpressionNode, BinaryExpressionNode, UnaryExpressionNode {

    /**
     * Dispatches to the visitor method for this expression kind.
     * @param visitor The visitor.
     * @param <R> The result type.
     * @return The visitor's result.
     */
    <R> R accept(ExpressionVisitor<R> visitor);
}
