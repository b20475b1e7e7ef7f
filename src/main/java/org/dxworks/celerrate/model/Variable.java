package org.dxworks.celerrate.model;

import org.dxworks.celerrate.span.Span;

/**
 * Variable reference. {@code name} excludes the dollar sign; variable variables carry a name expression instead.
 */
public final class Variable extends Expression {
    public final String name;
    public final Expression nameExpression;

    public Variable(Span span, String name, Expression nameExpression) {
        super(span);
        this.name = name;
        this.nameExpression = nameExpression;
    }

    @Override
    public NodeKind getKind() {
        return NodeKind.VARIABLE;
    }

    @Override
    protected void describe(NodeShape shape) {
        shape.attribute("name", name);
        shape.child("nameExpression", nameExpression);
    }
}
