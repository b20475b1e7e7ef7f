package org.dxworks.celerrate.model;

import org.dxworks.celerrate.span.Span;

public final class ReturnStatement extends Statement {
    public final Expression value;

    public ReturnStatement(Span span, Expression value) {
        super(span);
        this.value = value;
    }

    @Override
    public NodeKind getKind() {
        return NodeKind.RETURN;
    }

    @Override
    protected void describe(NodeShape shape) {
        shape.child("value", value);
    }
}
