package org.dxworks.celerrate.model;

import org.dxworks.celerrate.span.Span;

import java.util.List;

public final class FunctionCall extends Expression {
    public final boolean firstClassCallable;
    public final Expression callee;
    public final List<Argument> arguments;

    public FunctionCall(Span span, boolean firstClassCallable, Expression callee, List<Argument> arguments) {
        super(span);
        this.firstClassCallable = firstClassCallable;
        this.callee = callee;
        this.arguments = List.copyOf(arguments);
    }

    @Override
    public NodeKind getKind() {
        return NodeKind.FUNCTION_CALL;
    }

    @Override
    protected void describe(NodeShape shape) {
        shape.attribute("firstClassCallable", firstClassCallable);
        shape.child("callee", callee);
        shape.children("arguments", arguments);
    }
}
