package org.gamevibe.compiler.frontend.parser.ast;

import org.gamevibe.compiler.api.SourceRange;

import java.util.List;

/**
 * A scene statement {@code spawn Type at <position> [as name]}.
 *
 * @param entityType The name of the entity to spawn.
 * @param position The position expression.
 * @param name The optional instance name given with {@code as}, or null.
 * @param range The source range of the statement.
 */
public record SpawnNode(String entityType, ExpressionNode position, String name, SourceRange range) implements AstNode {

    @Override
    public List<AstNode> getChildren() {
        return List.of(position);
    }
}
