package org.gamevibe.compiler.frontend.parser.ast;

import org.gamevibe.compiler.api.SourceRange;

import java.util.List;

/**
 * A {@code name: value} pair inside a declaration body or an object literal.
 *
 * @param name The property name.
 * @param value The property value.
 * @param range The source range from the name to the end of the value.
 */
public record PropertyNode(String name, ValueNode value, SourceRange range) implements AstNode {

    @Override
    public List<AstNode> getChildren() {
        return List.of(value);
    }
}
