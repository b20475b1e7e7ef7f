package org.dxworks.celerrate.model;

import org.dxworks.celerrate.span.Span;

public final class ThrowExpression extends Expression {
    public final Expression value;

    public ThrowExpression(Span span, Expression value) {
        super(span);
        this.value = value;
    }

    @Override
    public NodeKind getKind() {
        return NodeKind.THROW;
    }

    @Override
    protected void describe(NodeShape shape) {
        shape.child("value", value);
    }
}
