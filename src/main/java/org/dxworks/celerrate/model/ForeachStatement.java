package org.dxworks.celerrate.model;

import org.dxworks.celerrate.span.Span;

public final class ForeachStatement extends Statement {
    public final boolean byRef;
    public final Expression subject;
    public final Expression key;
    public final Expression value;
    public final Block body;

    public ForeachStatement(Span span, boolean byRef, Expression subject, Expression key,
            Expression value, Block body) {
        super(span);
        this.byRef = byRef;
        this.subject = subject;
        this.key = key;
        this.value = value;
        this.body = body;
    }

    @Override
    public NodeKind getKind() {
        return NodeKind.FOREACH;
    }

    @Override
    protected void describe(NodeShape shape) {
        shape.attribute("byRef", byRef);
        shape.child("subject", subject);
        shape.child("key", key);
        shape.child("value", value);
        shape.child("body", body);
    }
}
