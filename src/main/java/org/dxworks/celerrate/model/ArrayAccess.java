package org.dxworks.celerrate.model;

import org.dxworks.celerrate.span.Span;

/**
 * {@code $a[$i]}; the index is {@code null} for the append form {@code $a[]}.
 */
public final class ArrayAccess extends Expression {
    public final Expression target;
    public final Expression index;

    public ArrayAccess(Span span, Expression target, Expression index) {
        super(span);
        this.target = target;
        this.index = index;
    }

    @Override
    public NodeKind getKind() {
        return NodeKind.ARRAY_ACCESS;
    }

    @Override
    protected void describe(NodeShape shape) {
        shape.child("target", target);
        shape.child("index", index);
    }
}
