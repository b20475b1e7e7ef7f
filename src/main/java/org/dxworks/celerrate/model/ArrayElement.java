package org.dxworks.celerrate.model;

import org.dxworks.celerrate.span.Span;

public final class ArrayElement extends Clause {
    public final boolean byRef;
    public final boolean spread;
    public final Expression key;
    public final Expression value;

    public ArrayElement(Span span, boolean byRef, boolean spread, Expression key, Expression value) {
        super(span);
        this.byRef = byRef;
        this.spread = spread;
        this.key = key;
        this.value = value;
    }

    @Override
    public NodeKind getKind() {
        return NodeKind.ARRAY_ELEMENT;
    }

    @Override
    protected void describe(NodeShape shape) {
        shape.attribute("byRef", byRef);
        shape.attribute("spread", spread);
        shape.child("key", key);
        shape.child("value", value);
    }
}
