package org.dxworks.celerrate.model;

import org.dxworks.celerrate.span.Span;

public final class ClosureUse extends Clause {
    public final String name;
    public final boolean byRef;

    public ClosureUse(Span span, String name, boolean byRef) {
        super(span);
        this.name = name;
        this.byRef = byRef;
    }

    @Override
    public NodeKind getKind() {
        return NodeKind.CLOSURE_USE;
    }

    @Override
    protected void describe(NodeShape shape) {
        shape.attribute("name", name);
        shape.attribute("byRef", byRef);
    }
}
