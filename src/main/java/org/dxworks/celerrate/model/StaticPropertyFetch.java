package org.dxworks.celerrate.model;

import org.dxworks.celerrate.span.Span;

public final class StaticPropertyFetch extends Expression {
    public final String name;
    public final Expression scope;
    public final Expression nameExpression;

    public StaticPropertyFetch(Span span, String name, Expression scope, Expression nameExpression) {
        super(span);
        this.name = name;
        this.scope = scope;
        this.nameExpression = nameExpression;
    }

    @Override
    public NodeKind getKind() {
        return NodeKind.STATIC_PROPERTY_FETCH;
    }

    @Override
    protected void describe(NodeShape shape) {
        shape.attribute("name", name);
        shape.child("scope", scope);
        shape.child("nameExpression", nameExpression);
    }
}
