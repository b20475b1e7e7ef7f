package org.dxworks.celerrate.model;

import org.dxworks.celerrate.span.Span;

import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Root of the typed PHP node hierarchy.
 * <p>
 * Nodes are immutable and built bottom-up. Two nodes are {@link #equals equal} when their
 * kind, attributes and children are recursively equal; spans take no part in the comparison,
 * so formatting-only differences in the source do not break it.
 */
public abstract class AstNode {
    private final Span span;
    private volatile NodeShape shape;

    protected AstNode(Span span) {
        this.span = Objects.requireNonNull(span, "span");
    }

    public final Span getSpan() {
        return span;
    }

    public abstract NodeKind getKind();

    public final NodeCategory getCategory() {
        return getKind().getCategory();
    }

    /**
     * Declares attributes and child slots in source order.
     */
    protected abstract void describe(NodeShape shape);

    public final NodeShape getShape() {
        NodeShape result = shape;
        if (result == null) {
            result = new NodeShape();
            describe(result);
            shape = result;
        }
        return result;
    }

    public final Map<String, Object> getAttributes() {
        return getShape().getAttributes();
    }

    /**
     * Direct children in source order.
     */
    public final List<AstNode> getChildren() {
        return getShape().flatten();
    }

    public boolean isPlaceholder() {
        return false;
    }

    @Override
    public final boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof AstNode)) return false;
        AstNode other = (AstNode) o;
        if (getKind() != other.getKind()) return false;
        NodeShape mine = getShape();
        NodeShape theirs = other.getShape();
        return mine.getAttributes().equals(theirs.getAttributes())
                && mine.getSlots().equals(theirs.getSlots());
    }

    @Override
    public final int hashCode() {
        NodeShape mine = getShape();
        return Objects.hash(getKind(), mine.getAttributes(), mine.getSlots());
    }

    @Override
    public String toString() {
        return getKind().getTag() + getAttributes() + span;
    }
}
