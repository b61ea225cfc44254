package org.gamevibe.compiler.frontend.semantics.analysis;

import org.gamevibe.compiler.frontend.parser.ast.ArrayLiteralNode;
import org.gamevibe.compiler.frontend.parser.ast.BooleanLiteralNode;
import org.gamevibe.compiler.frontend.parser.ast.IdentifierNode;
import org.gamevibe.compiler.frontend.parser.ast.NumberLiteralNode;
import org.gamevibe.compiler.frontend.parser.ast.ObjectLiteralNode;
import org.gamevibe.compiler.frontend.parser.ast.StringLiteralNode;
import org.gamevibe.compiler.frontend.parser.ast.ValueNode;
import org.gamevibe.compiler.frontend.parser.ast.ValueVisitor;

import java.util.stream.Collectors;

/**
 * Renders a value close to how it was written, for use inside diagnostic messages.
 * Strings and identifiers render as their bare text.
 */
final class ValueText implements ValueVisitor<String> {

    private static final ValueText INSTANCE = new ValueText();

    private ValueText() {}

    static String of(ValueNode value) {
        return value.accept(INSTANCE);
    }

    @Override
    public String visitString(StringLiteralNode node) {
        return node.value();
    }

    @Override
    public String visitNumber(NumberLiteralNode node) {
        return node.text();
    }

    @Override
    public String visitBoolean(BooleanLiteralNode node) {
        return String.valueOf(node.value());
    }

    @Override
    public String visitArray(ArrayLiteralNode node) {
        return node.elements().stream().map(ValueText::of).collect(Collectors.joining(", ", "[", "]"));
    }

    @Override
    public String visitObject(ObjectLiteralNode node) {
        return node.properties().stream()
                .map(p -> p.name() + ": " + of(p.value()))
                .collect(Collectors.joining(", ", "{", "}"));
    }

    @Override
    public String visitIdentifier(IdentifierNode node) {
        return node.name();
    }
}
