package org.dxworks.celerrate.model;

import org.dxworks.celerrate.span.Span;

public final class UnaryOperation extends Expression {
    public final String operator;
    public final boolean postfix;
    public final Expression operand;

    public UnaryOperation(Span span, String operator, boolean postfix, Expression operand) {
        super(span);
        this.operator = operator;
        this.postfix = postfix;
        this.operand = operand;
    }

    @Override
    public NodeKind getKind() {
        return NodeKind.UNARY;
    }

    @Override
    protected void describe(NodeShape shape) {
        shape.attribute("operator", operator);
        shape.attribute("postfix", postfix);
        shape.child("operand", operand);
    }
}
