package org.gamevibe.compiler.frontend.parser.ast;

import org.gamevibe.compiler.api.SourceRange;

/**
 * A bare name, used both as a value (e.g. a behavior reference or an enum-like setting)
 * and as an operand in position expressions.
 *
 * @param name The identifier text.
 * @param range The source range of the identifier.
 */
public record IdentifierNode(String name, SourceRange range) implements ValueNode, ExpressionNode {

    @Override
    public <R> R accept(ValueVisitor<R> visitor) {
        return visitor.visitIdentifier(this);
    }

    @Override
    public <R> R accept(ExpressionVisitor<R> visitor) {
        return visitor.visitIdentifier(this);
    }
}
