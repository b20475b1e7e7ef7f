package org.dxworks.celerrate.model;

import org.dxworks.celerrate.span.Span;

public final class StaticVariable extends Clause {
    public final String name;
    public final Expression initializer;

    public StaticVariable(Span span, String name, Expression initializer) {
        super(span);
        this.name = name;
        this.initializer = initializer;
    }

    @Override
    public NodeKind getKind() {
        return NodeKind.STATIC_VARIABLE;
    }

    @Override
    protected void describe(NodeShape shape) {
        shape.attribute("name", name);
        shape.child("initializer", initializer);
    }
}
