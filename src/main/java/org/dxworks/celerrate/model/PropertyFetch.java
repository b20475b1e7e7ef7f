package org.dxworks.celerrate.model;

import org.dxworks.celerrate.span.Span;

public final class PropertyFetch extends Expression {
    public final String name;
    public final boolean nullsafe;
    public final Expression object;
    public final Expression nameExpression;

    public PropertyFetch(Span span, String name, boolean nullsafe, Expression object,
            Expression nameExpression) {
        super(span);
        this.name = name;
        this.nullsafe = nullsafe;
        this.object = object;
        this.nameExpression = nameExpression;
    }

    @Override
    public NodeKind getKind() {
        return NodeKind.PROPERTY_FETCH;
    }

    @Override
    protected void describe(NodeShape shape) {
        shape.attribute("name", name);
        shape.attribute("nullsafe", nullsafe);
        shape.child("object", object);
        shape.child("nameExpression", nameExpression);
    }
}
