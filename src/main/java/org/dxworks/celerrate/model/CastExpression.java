package org.dxworks.celerrate.model;

import org.dxworks.celerrate.span.Span;

public final class CastExpression extends Expression {
    public final String castType;
    public final Expression operand;

    public CastExpression(Span span, String castType, Expression operand) {
        super(span);
        this.castType = castType;
        this.operand = operand;
    }

    @Override
    public NodeKind getKind() {
        return NodeKind.CAST;
    }

    @Override
    protected void describe(NodeShape shape) {
        shape.attribute("castType", castType);
        shape.child("operand", operand);
    }
}
