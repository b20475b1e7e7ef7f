package org.dxworks.celerrate.model;

import org.dxworks.celerrate.span.Span;

public final class BreakStatement extends Statement {
    public final Expression levels;

    public BreakStatement(Span span, Expression levels) {
        super(span);
        this.levels = levels;
    }

    @Override
    public NodeKind getKind() {
        return NodeKind.BREAK;
    }

    @Override
    protected void describe(NodeShape shape) {
        shape.child("levels", levels);
    }
}
