package org.dxworks.celerrate.model;

import org.dxworks.celerrate.span.Span;

public final class IntegerLiteral extends Expression {
    public final long value;

    public IntegerLiteral(Span span, long value) {
        super(span);
        this.value = value;
    }

    @Override
    public NodeKind getKind() {
        return NodeKind.INTEGER;
    }

    @Override
    protected void describe(NodeShape shape) {
        shape.attribute("value", value);
    }
}
