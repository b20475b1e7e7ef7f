package org.dxworks.celerrate.model;

import org.dxworks.celerrate.span.Span;

public final class FloatLiteral extends Expression {
    public final double value;

    public FloatLiteral(Span span, double value) {
        super(span);
        this.value = value;
    }

    @Override
    public NodeKind getKind() {
        return NodeKind.FLOAT;
    }

    @Override
    protected void describe(NodeShape shape) {
        shape.attribute("value", value);
    }
}
