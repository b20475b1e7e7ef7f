package org.dxworks.celerrate.model;

import org.dxworks.celerrate.span.Span;

public final class DoWhileStatement extends Statement {
    public final Block body;
    public final Expression condition;

    public DoWhileStatement(Span span, Block body, Expression condition) {
        super(span);
        this.body = body;
        this.condition = condition;
    }

    @Override
    public NodeKind getKind() {
        return NodeKind.DO_WHILE;
    }

    @Override
    protected void describe(NodeShape shape) {
        shape.child("body", body);
        shape.child("condition", condition);
    }
}
