package org.gamevibe.compiler.backend.codegen;

import org.gamevibe.compiler.frontend.parser.ast.BinaryExpressionNode;
import org.gamevibe.compiler.frontend.parser.ast.BooleanLiteralNode;
import org.gamevibe.compiler.frontend.parser.ast.CallExpressionNode;
import org.gamevibe.compiler.frontend.parser.ast.ExpressionNode;
import org.gamevibe.compiler.frontend.parser.ast.ExpressionVisitor;
import org.gamevibe.compiler.frontend.parser.ast.IdentifierNode;
import org.gamevibe.compiler.frontend.parser.ast.MemberExpressionNode;
import org.gamevibe.compiler.frontend.parser.ast.NumberLiteralNode;
import org.gamevibe.compiler.frontend.parser.ast.StringLiteralNode;
import org.gamevibe.compiler.frontend.parser.ast.UnaryExpressionNode;

import java.util.stream.Collectors;

/**
 * Renders spawn position expressions as TypeScript. Coordinate pairs become
 * {@code new Vector2(x, y)}; anything else is emitted as written.
 */
final class ExpressionRenderer implements ExpressionVisitor<String> {

    static final String ORIGIN = "new Vector2(0, 0)";

    private static final ExpressionRenderer INSTANCE = new ExpressionRenderer();

    private ExpressionRenderer() {}

    static String render(ExpressionNode expression) {
        return expression.accept(INSTANCE);
    }

    @Override
    public String visitIdentifier(IdentifierNode node) {
        return node.name();
    }

    @Override
    public String visitNumber(NumberLiteralNode node) {
        return node.text();
    }

    @Override
    public String visitString(StringLiteralNode node) {
        return ValueSerializer.quote(node.value());
    }

    @Override
    public String visitBoolean(BooleanLiteralNode node) {
        return String.valueOf(node.value());
    }

    @Override
    public String visitCall(CallExpressionNode node) {
        String arguments = node.arguments().stream().map(ExpressionRenderer::render).collect(Collectors.joining(", "));
        if (node.callee() instanceof IdentifierNode callee
                && callee.name().equals(CallExpressionNode.VECTOR_CONSTRUCTOR)) {
            return node.arguments().size() == 2 ? "new Vector2(" + arguments + ")" : ORIGIN;
        }
        return render(node.callee()) + "(" + arguments + ")";
    }

    @Override
    public String visitMember(MemberExpressionNode node) {
        return operand(node.object()) + "." + node.property();
    }

    @Override
    public String visitBinary(BinaryExpressionNode node) {
        return operand(node.left()) + " " + node.operator() + " " + operand(node.right());
    }

    @Override
    public String visitUnary(UnaryExpressionNode node) {
        return node.operator() + operand(node.operand());
    }

    private static String operand(ExpressionNode expression) {
        String text = render(expression);
        return expression instanceof BinaryExpressionNode || expression instanceof UnaryExpressionNode
                ? "(" + text + ")"
                : text;
    }
}
