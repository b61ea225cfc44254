package org.gamevibe.compiler.frontend.parser.ast;

import org.gamevibe.compiler.api.SourceRange;

import java.util.List;

/**
 * A member access {@code object.property}.
 *
 * @param object The accessed expression.
 * @param property The member name.
 * @param range The source range of the access.
 */
public record MemberExpressionNode(ExpressionNode object, String property, SourceRange range) implements ExpressionNode {

    @Override
    public <R> R accept(ExpressionVisitor<R> visitor) {
        return visitor.visitMember(this);
    }

    @Override
    public List<AstNode> getChildren() {
        return List.of(object);
    }
}
