package org.dxworks.celerrate.model;

/**
 * A node reached during traversal, with the path back to the root.
 */
public final class NodeVisit {
    private final AstNode node;
    private final NodeVisit parent;
    private final int depth;

    NodeVisit(AstNode node, NodeVisit parent) {
        this.node = node;
        this.parent = parent;
        this.depth = parent == null ? 0 : parent.depth + 1;
    }

    public AstNode getNode() {
        return node;
    }

    /**
     * Visit of the enclosing node, {@code null} for the root.
     */
    public NodeVisit getParent() {
        return parent;
    }

    public int getDepth() {
        return depth;
    }

    /**
     * Nearest enclosing node of the given type, not including this one.
     */
    public <T extends AstNode> T findAncestor(Class<T> type) {
        for (NodeVisit visit = parent; visit != null; visit = visit.parent) {
            if (type.isInstance(visit.node)) {
                return type.cast(visit.node);
            }
        }
        return null;
    }
}
