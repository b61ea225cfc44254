package org.gamevibe.compiler.backend.codegen;

import org.gamevibe.compiler.frontend.parser.ast.ArrayLiteralNode;
import org.gamevibe.compiler.frontend.parser.ast.BooleanLiteralNode;
import org.gamevibe.compiler.frontend.parser.ast.IdentifierNode;
import org.gamevibe.compiler.frontend.parser.ast.NumberLiteralNode;
import org.gamevibe.compiler.frontend.parser.ast.ObjectLiteralNode;
import org.gamevibe.compiler.frontend.parser.ast.StringLiteralNode;
import org.gamevibe.compiler.frontend.parser.ast.ValueNode;
import org.gamevibe.compiler.frontend.parser.ast.ValueVisitor;

import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Serializes property values as TypeScript literals. Identifiers become quoted names,
 * numbers keep their source text.
 */
final class ValueSerializer implements ValueVisitor<String> {

    private static final ValueSerializer INSTANCE = new ValueSerializer();
    private static final Pattern PLAIN_KEY = Pattern.compile("[A-Za-z_$][A-Za-z0-9_$]*");

    private ValueSerializer() {}

    static String serialize(ValueNode value) {
        return value.accept(INSTANCE);
    }

    /**
     * Quotes a string as a double-quoted TypeScript literal.
     */
    static String quote(String text) {
        StringBuilder sb = new StringBuilder(text.length() + 2).append('"');
        for (char c : text.toCharArray()) {
            switch (c) {
                case '"' -> sb.append("\\\"");
                case '\\' -> sb.append("\\\\");
                case '\n' -> sb.append("\\n");
                case '\r' -> sb.append("\\r");
                case '\t' -> sb.append("\\t");
                default -> sb.append(c);
            }
        }
        return sb.append('"').toString();
    }

    /**
     * Renders an object key, quoting it unless it is a plain identifier.
     */
    static String key(String name) {
        return PLAIN_KEY.matcher(name).matches() ? name : quote(name);
    }

    @Override
    public String visitString(StringLiteralNode node) {
        return quote(node.value());
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
        return node.elements().stream().map(ValueSerializer::serialize).collect(Collectors.joining(", ", "[", "]"));
    }

    @Override
    public String visitObject(ObjectLiteralNode node) {
        if (node.properties().isEmpty()) return "{}";
        return node.properties().stream()
                .map(p -> key(p.name()) + ": " + serialize(p.value()))
                .collect(Collectors.joining(", ", "{ ", " }"));
    }

    @Override
    public String visitIdentifier(IdentifierNode node) {
        return quote(node.name());
    }
}
