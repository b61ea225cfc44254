package org.gamevibe.compiler.frontend.parser.ast;

import org.gamevibe.compiler.api.SourceRange;

import java.util.List;

/**
 * An AST node that represents an entity template ({@code entity Name { ... }}).
 *
 * @param name The entity name.
 * @param properties The entity properties.
 * @param range The source range of the declaration.
 */
public record EntityNode(String name, List<PropertyNode> properties, SourceRange range) implements Declaration {

    /** The property listing the behaviors applied to the entity. */
    public static final String BEHAVIORS_PROPERTY = "behaviors";

    public EntityNode {
        properties = List.copyOf(properties);
    }

    /**
     * Returns every element of the {@code behaviors} array, whatever its kind.
     * @return The raw behavior references, empty if there is no {@code behaviors} array.
     */
    public List<ValueNode> behaviorReferences() {
        return property(BEHAVIORS_PROPERTY)
                .map(PropertyNode::value)
                .filter(ArrayLiteralNode.class::isInstance)
                .map(v -> ((ArrayLiteralNode) v).elements())
                .orElse(List.of());
    }

    /**
     * Returns the behaviors referenced by identifier, in declaration order.
     * @return The behavior names.
     */
    public List<String> behaviorNames() {
        return behaviorReferences().stream()
                .filter(IdentifierNode.class::isInstance)
                .map(v -> ((IdentifierNode) v).name())
                .toList();
    }

    @Override
    public String keyword() {
        return "entity";
    }

    @Override
    public String describe() {
        return "entity " + name;
    }

    @Override
    public <R> R accept(DeclarationVisitor<R> visitor) {
        return visitor.visitEntity(this);
    }
}
