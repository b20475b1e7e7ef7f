package org.dxworks.celerrate.model;

import org.dxworks.celerrate.span.Span;

public final class YieldExpression extends Expression {
    public final boolean delegate;
    public final Expression key;
    public final Expression value;

    public YieldExpression(Span span, boolean delegate, Expression key, Expression value) {
        super(span);
        this.delegate = delegate;
        this.key = key;
        this.value = value;
    }

    @Override
    public NodeKind getKind() {
        return NodeKind.YIELD;
    }

    @Override
    protected void describe(NodeShape shape) {
        shape.attribute("delegate", delegate);
        shape.child("key", key);
        shape.child("value", value);
    }
}
