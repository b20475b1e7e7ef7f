package org.dxworks.celerrate.model;

import org.dxworks.celerrate.span.Span;

public final class NullLiteral extends Expression {
    public NullLiteral(Span span) {
        super(span);
    }

    @Override
    public NodeKind getKind() {
        return NodeKind.NULL;
    }

    @Override
    protected void describe(NodeShape shape) {
    }
}
