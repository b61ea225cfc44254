package org.gamevibe.compiler.frontend.parser.ast;

import org.gamevibe.compiler.api.SourceRange;

import java.util.List;

/**
 * An AST node that represents a reusable behavior ({@code behavior Name { ... }}).
 * The {@code properties}, {@code methods} and {@code update} entries are ordinary properties.
 *
 * @param name The behavior name.
 * @param properties The behavior properties.
 * @param range The source range of the declaration.
 */
public record BehaviorNode(String name, List<PropertyNode> properties, SourceRange range) implements Declaration {

    public BehaviorNode {
        properties = List.copyOf(properties);
    }

    @Override
    public String keyword() {
        return "behavior";
    }

    @Override
    public String describe() {
        return "behavior " + name;
    }

    @Override
    public <R> R accept(DeclarationVisitor<R> visitor) {
        return visitor.visitBehavior(this);
    }
}
