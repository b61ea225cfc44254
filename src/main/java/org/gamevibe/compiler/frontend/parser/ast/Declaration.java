package org.gamevibe.compiler.frontend.parser.ast;

import java.util.List;
import java.util.Optional;

/**
 * A top-level declaration: {@code game}, {@code entity}, {@code behavior} or {@code scene}.
 */
public sealed interface Declaration extends AstNode permits GameNode, EntityNode, BehaviorNode, SceneNode {

    /**
     * Returns the declared properties in source order.
     * @return The properties.
     */
    List<PropertyNode> properties();

    /**
     * Returns the keyword that introduces this declaration.
     * @return e.g. {@code "entity"}.
     */
    String keyword();

    /**
     * Dispatches to the visitor method for this declaration kind.
     * @param visitor The visitor.
     * @param <R> The result type.
     * @return The visitor's result.
     */
    <R> R accept(DeclarationVisitor<R> visitor);

    /**
     * Finds the first property with the given name.
     * @param name The property name.
     * @return The property, or empty if it is not declared.
     */
    default Optional<PropertyNode> property(String name) {
        return properties().stream().filter(p -> p.name().equals(name)).findFirst();
    }

    /**
     * Returns a readable label such as {@code entity Player} or {@code game}.
     * @return The label.
     */
    default String describe() {
        return keyword();
    }

    @Override
    default List<AstNode> getChildren() {
        return List.copyOf(properties());
    }
}
