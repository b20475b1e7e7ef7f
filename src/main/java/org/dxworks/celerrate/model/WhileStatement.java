package org.dxworks.celerrate.model;

import org.dxworks.celerrate.span.Span;

public final class WhileStatement extends Statement {
    public final Expression condition;
    public final Block body;

    public WhileStatement(Span span, Expression condition, Block body) {
        super(span);
        this.condition = condition;
        this.body = body;
    }

    @Override
    public NodeKind getKind() {
        return NodeKind.WHILE;
    }

    @Override
    protected void describe(NodeShape shape) {
        shape.child("condition", condition);
        shape.child("body", body);
    }
}
