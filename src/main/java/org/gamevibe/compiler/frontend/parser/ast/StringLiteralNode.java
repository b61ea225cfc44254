package org.gamevibe.compiler.frontend.parser.ast;

import org.gamevibe.compiler.api.SourceRange;

/**
 * A string literal with its escapes already resolved.
 *
 * @param value The unescaped string content.
 * @param range The source range including the quotes.
 */
public record StringLiteralNode(String value, SourceRange range) implements ValueNode, ExpressionNode {

    @Override
    public <R> R accept(ValueVisitor<R> visitor) {
        return visitor.visitString(this);
    }

    @Override
    public <R> R accept(ExpressionVisitor<R> visitor) {
        return visitor.visitString(this);
    }
}
