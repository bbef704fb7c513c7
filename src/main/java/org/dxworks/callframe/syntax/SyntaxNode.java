package org.dxworks.callframe.syntax;

/**
 * Read-only view of one node of a concrete syntax tree.
 * <p>
 * The extraction code only ever looks at a node's kind, text, ordered children and
 * source position, so it can run against any front-end that can present its tree
 * this way (the ANTLR parser in production, hand-built trees in tests).
 */
public interface SyntaxNode {

    /**
     * Grammar rule name for rule nodes (e.g. {@code "classDeclaration"}), token
     * symbolic name for terminals (e.g. {@code "IDENTIFIER"}).
     */
    String getKind();

    /**
     * Concatenated text of all tokens below this node, without hidden-channel whitespace.
     */
    String getText();

    int getChildCount();

    SyntaxNode getChild(int index);

    /**
     * @return the parent node, or {@code null} for the root
     */
    SyntaxNode getParent();

    int getStartLine();

    int getStartColumn();

    int getStopLine();

    /**
     * Number of nodes from the root to this node, the root itself having depth 1.
     */
    int getDepth();

    default boolean isTerminal() {
        return getChildCount() == 0;
    }

    /**
     * Returns the first direct child of the given kind, or {@code null}.
     */
    default SyntaxNode findChild(String kind) {
        for (int i = 0; i < getChildCount(); i++) {
            SyntaxNode child = getChild(i);
            if (kind.equals(child.getKind())) {
                return child;
            }
        }
        return null;
    }

    /**
     * Walks {@code levels} parents up; {@code null} when the tree is not that deep.
     */
    default SyntaxNode getAncestor(int levels) {
        SyntaxNode node = this;
        for (int i = 0; i < levels && node != null; i++) {
            node = node.getParent();
        }
        return node;
    }
}
