package org.dxworks.celerrate.model;

import org.dxworks.celerrate.span.Span;

public final class BinaryOperation extends Expression {
    public final String operator;
    public final Expression left;
    public final Expression right;

    public BinaryOperation(Span span, String operator, Expression left, Expression right) {
        super(span);
        this.operator = operator;
        this.left = left;
        this.right = right;
    }

    @Override
    public NodeKind getKind() {
        return NodeKind.BINARY;
    }

    @Override
    protected void describe(NodeShape shape) {
        shape.attribute("operator", operator);
        shape.child("left", left);
        shape.child("right", right);
    }
}
