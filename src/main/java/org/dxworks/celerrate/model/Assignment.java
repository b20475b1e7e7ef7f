package org.dxworks.celerrate.model;

import org.dxworks.celerrate.span.Span;

public final class Assignment extends Expression {
    public final String operator;
    public final boolean byRef;
    public final Expression target;
    public final Expression value;

    public Assignment(Span span, String operator, boolean byRef, Expression target, Expression value) {
        super(span);
        this.operator = operator;
        this.byRef = byRef;
        this.target = target;
        this.value = value;
    }

    @Override
    public NodeKind getKind() {
        return NodeKind.ASSIGNMENT;
    }

    @Override
    protected void describe(NodeShape shape) {
        shape.attribute("operator", operator);
        shape.attribute("byRef", byRef);
        shape.child("target", target);
        shape.child("value", value);
    }
}
