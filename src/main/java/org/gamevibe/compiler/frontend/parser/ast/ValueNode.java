package org.gamevibe.compiler.frontend.parser.ast;

/**
 * A property value: a literal, an array, an object or a bare identifier.
 */
public sealed interface ValueNode extends AstNode
        permits StringLiteralNode, NumberLiteralNode, BooleanLiteralNode,
                ArrayLiteralNode, ObjectLiteralNode, IdentifierNode {

    /**
     * Dispatches to the visitor method for this value kind.
     * @param visitor The visitor.
     * @param <R> The result type.
     * @return The visitor's result.
     */
    <R> R accept(ValueVisitor<R> visitor);
}
