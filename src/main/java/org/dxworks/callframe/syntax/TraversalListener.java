package org.dxworks.callframe.syntax;

/**
 * Receives the depth-first enter/exit notifications of a syntax tree walk.
 * Every {@code enter} is followed by exactly one matching {@code exit} once all
 * notifications for the node's subtree have been delivered.
 */
public interface TraversalListener {

    void enter(ProductionKind kind, SyntaxNode node);

    void exit(ProductionKind kind, SyntaxNode node);
}
