package org.gamevibe.compiler.frontend.parser.ast;

/**
 * A visitor over the closed set of {@link Declaration} kinds.
 *
 * @param <R> The result type of the visit methods.
 */
public interface DeclarationVisitor<R> {
    R visitGame(GameNode game);
    R visitEntity(EntityNode entity);
    R visitBehavior(BehaviorNode behavior);
    R visitScene(SceneNode scene);
}
