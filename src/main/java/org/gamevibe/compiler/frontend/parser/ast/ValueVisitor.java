package org.gamevibe.compiler.frontend.parser.ast;

/**
 * A visitor over the closed set of {@link ValueNode} kinds.
 *
 * @param <R> The result type of the visit methods.
 */
public interface ValueVisitor<R> {
    R visitString(StringLiteralNode node);
    R visitNumber(NumberLiteralNode node);
    R visitBoolean(BooleanLiteralNode node);
    R visitArray(ArrayLiteralNode node);
    R visitObject(ObjectLiteralNode node);
    R visitIdentifier(IdentifierNode node);
}
