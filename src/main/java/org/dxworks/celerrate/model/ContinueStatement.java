package org.dxworks.celerrate.model;

import org.dxworks.celerrate.span.Span;

public final class ContinueStatement extends Statement {
    public final Expression levels;

    public ContinueStatement(Span span, Expression levels) {
        super(span);
        this.levels = levels;
    }

    @Override
    public NodeKind getKind() {
        return NodeKind.CONTINUE;
    }

    @Override
    protected void describe(NodeShape shape) {
        shape.child("levels", levels);
    }
}
