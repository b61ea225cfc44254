package org.gamevibe.compiler.frontend.parser.ast;

import org.gamevibe.compiler.api.SourceRange;

import java.util.Collections;
import java.util.List;

/**
 * The base interface for all nodes in the Abstract Syntax Tree (AST).
 * <p>
 * The set of node kinds is closed: every phase dispatches over it through one of the
 * visitors ({@link DeclarationVisitor}, {@link ValueVisitor}, {@link ExpressionVisitor}),
 * so adding a node kind fails compilation wherever it is not handled.
 */
public sealed interface AstNode
        permits Program, Declaration, PropertyNode, SpawnNode, EventNode, ValueNode, ExpressionNode {

    /**
     * Returns the range of source text this node was parsed from.
     * @return The source range, never null.
     */
    SourceRange range();

    /**
     * Returns a list of the direct child nodes.
     * This allows generic traversals to walk the tree
     * without knowing the specific structure of each node.
     *
     * @return A list of child nodes. Returns an empty list if the node has no children.
     */
    default List<AstNode> getChildren() {
        return Collections.emptyList();
    }
}
