package org.dxworks.celerrate.model;

import org.dxworks.celerrate.span.Span;

import java.util.List;

public final class MethodCall extends Expression {
    public final String name;
    public final boolean nullsafe;
    public final boolean firstClassCallable;
    public final Expression object;
    public final Expression nameExpression;
    public final List<Argument> arguments;

    public MethodCall(Span span, String name, boolean nullsafe, boolean firstClassCallable,
            Expression object, Expression nameExpression, List<Argument> arguments) {
        super(span);
        this.name = name;
        this.nullsafe = nullsafe;
        this.firstClassCallable = firstClassCallable;
        this.object = object;
        this.nameExpression = nameExpression;
        this.arguments = List.copyOf(arguments);
    }

    @Override
    public NodeKind getKind() {
        return NodeKind.METHOD_CALL;
    }

    @Override
    protected void describe(NodeShape shape) {
        shape.attribute("name", name);
        shape.attribute("nullsafe", nullsafe);
        shape.attribute("firstClassCallable", firstClassCallable);
        shape.child("object", object);
        shape.child("nameExpression", nameExpression);
        shape.children("arguments", arguments);
    }
}
