package org.gamevibe.compiler.backend.codegen;

import org.gamevibe.compiler.frontend.parser.ast.ArrayLiteralNode;
import org.gamevibe.compiler.frontend.parser.ast.BooleanLiteralNode;
import org.gamevibe.compiler.frontend.parser.ast.IdentifierNode;
import org.gamevibe.compiler.frontend.parser.ast.NumberLiteralNode;
import org.gamevibe.compiler.frontend.parser.ast.ObjectLiteralNode;
import org.gamevibe.compiler.frontend.parser.ast.StringLiteralNode;
import org.gamevibe.compiler.frontend.parser.ast.ValueNode;
import org.gamevibe.compiler.frontend.parser.ast.ValueVisitor;

/**
 * Derives the TypeScript field type of a behavior property from its initial value.
 */
final class TypeScriptType implements ValueVisitor<String> {

    private static final TypeScriptType INSTANCE = new TypeScriptType();

    private TypeScriptType() {}

    static String of(ValueNode value) {
        return value.accept(INSTANCE);
    }

    @Override
    public String visitString(StringLiteralNode node) {
        return "string";
    }

    @Override
    public String visitNumber(NumberLiteralNode node) {
        return "number";
    }

    @Override
    public String visitBoolean(BooleanLiteralNode node) {
        return "boolean";
    }

    @Override
    public String visitArray(ArrayLiteralNode node) {
        if (node.elements().isEmpty()) return "any[]";
        return of(node.elements().get(0)) + "[]";
    }

    @Override
    public String visitObject(ObjectLiteralNode node) {
        return "Record<string, any>";
    }

    @Override
    public String visitIdentifier(IdentifierNode node) {
        return "string";
    }
}
