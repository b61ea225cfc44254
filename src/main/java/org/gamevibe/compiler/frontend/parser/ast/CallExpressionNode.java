package org.gamevibe.compiler.frontend.parser.ast;

import org.gamevibe.compiler.api.SourceRange;

import java.util.ArrayList;
import java.util.List;

/**
 * A call {@code callee(arg, ...)}. Bracketed positions such as {@code [100, 200]}
 * are represented as a call to {@code Vector2}.
 *
 * @param callee The called expression.
 * @param arguments The arguments in source order.
 * @param range The source range of the call.
 */
public record CallExpressionNode(ExpressionNode callee, List<ExpressionNode> arguments, SourceRange range)
        implements ExpressionNode {

    /** The callee used for bracketed coordinate pairs. */
    public static final String VECTOR_CONSTRUCTOR = "Vector2";

    public CallExpressionNode {
        arguments = List.copyOf(arguments);
    }

    @Override
    public <R> R accept(ExpressionVisitor<R> visitor) {
        return visitor.visitCall(this);
    }

    @Override
    public List<AstNode> getChildren() {
        List<AstNode> children = new ArrayList<>();
        children.add(callee);
        children.addAll(arguments);
        return children;
    }
}
