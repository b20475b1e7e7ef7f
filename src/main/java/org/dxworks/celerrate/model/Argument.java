package org.dxworks.celerrate.model;

import org.dxworks.celerrate.span.Span;

public final class Argument extends Clause {
    public final String name;
    public final boolean spread;
    public final boolean byRef;
    public final Expression value;

    public Argument(Span span, String name, boolean spread, boolean byRef, Expression value) {
        super(span);
        this.name = name;
        this.spread = spread;
        this.byRef = byRef;
        this.value = value;
    }

    @Override
    public NodeKind getKind() {
        return NodeKind.ARGUMENT;
    }

    @Override
    protected void describe(NodeShape shape) {
        shape.attribute("name", name);
        shape.attribute("spread", spread);
        shape.attribute("byRef", byRef);
        shape.child("value", value);
    }
}
