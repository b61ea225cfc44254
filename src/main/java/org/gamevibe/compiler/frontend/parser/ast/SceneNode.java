package org.gamevibe.compiler.frontend.parser.ast;

import org.gamevibe.compiler.api.SourceRange;

import java.util.ArrayList;
import java.util.List;

/**
 * An AST node that represents a scene ({@code scene Name { ... }}) with its properties,
 * spawn statements and event statements.
 *
 * @param name The scene name.
 * @param properties The scene properties.
 * @param spawns The spawn statements in source order.
 * @param events The event statements in source order.
 * @param range The source range of the declaration.
 */
public record SceneNode(
        String name,
        List<PropertyNode> properties,
        List<SpawnNode> spawns,
        List<EventNode> events,
        SourceRange range
) implements Declaration {

    public SceneNode {
        properties = List.copyOf(properties);
        spawns = List.copyOf(spawns);
        events = List.copyOf(events);
    }

    @Override
    public String keyword() {
        return "scene";
    }

    @Override
    public String describe() {
        return "scene " + name;
    }

    @Override
    public <R> R accept(DeclarationVisitor<R> visitor) {
        return visitor.visitScene(this);
    }

    @Override
    public List<AstNode> getChildren() {
        List<AstNode> children = new ArrayList<>(properties);
        children.addAll(spawns);
        children.addAll(events);
        return children;
    }
}
