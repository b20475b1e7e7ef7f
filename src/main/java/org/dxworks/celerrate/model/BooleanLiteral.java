package org.dxworks.celerrate.model;

import org.dxworks.celerrate.span.Span;

public final class BooleanLiteral extends Expression {
    public final boolean value;

    public BooleanLiteral(Span span, boolean value) {
        super(span);
        this.value = value;
    }

    @Override
    public NodeKind getKind() {
        return NodeKind.BOOLEAN;
    }

    @Override
    protected void describe(NodeShape shape) {
        shape.attribute("value", value);
    }
}
