package org.dxworks.celerrate.model;

import org.dxworks.celerrate.span.Span;

import java.util.List;

public final class StaticCall extends Expression {
    public final String name;
    public final boolean firstClassCallable;
    public final Expression scope;
    public final Expression nameExpression;
    public final List<Argument> arguments;

    public StaticCall(Span span, String name, boolean firstClassCallable, Expression scope,
            Expression nameExpression, List<Argument> arguments) {
        super(span);
        this.name = name;
        this.firstClassCallable = firstClassCallable;
        this.scope = scope;
        this.nameExpression = nameExpression;
        this.arguments = List.copyOf(arguments);
    }

    @Override
    public NodeKind getKind() {
        return NodeKind.STATIC_CALL;
    }

    @Override
    protected void describe(NodeShape shape) {
        shape.attribute("name", name);
        shape.attribute("firstClassCallable", firstClassCallable);
        shape.child("scope", scope);
        shape.child("nameExpression", nameExpression);
        shape.children("arguments", arguments);
    }
}
