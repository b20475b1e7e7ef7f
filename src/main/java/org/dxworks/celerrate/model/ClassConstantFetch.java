package org.dxworks.celerrate.model;

import org.dxworks.celerrate.span.Span;

public final class ClassConstantFetch extends Expression {
    public final String name;
    public final Expression scope;
    public final Expression nameExpression;

    public ClassConstantFetch(Span span, String name, Expression scope, Expression nameExpression) {
        super(span);
        this.name = name;
        this.scope = scope;
        this.nameExpression = nameExpression;
    }

    @Override
    public NodeKind getKind() {
        return NodeKind.CLASS_CONSTANT_FETCH;
    }

    @Override
    protected void describe(NodeShape shape) {
        shape.attribute("name", name);
        shape.child("scope", scope);
        shape.child("nameExpression", nameExpression);
    }
}
