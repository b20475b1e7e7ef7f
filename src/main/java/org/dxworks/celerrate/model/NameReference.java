package org.dxworks.celerrate.model;

import org.dxworks.celerrate.span.Span;

/**
 * Bare or qualified name used as a constant, callee or class reference.
 */
public final class NameReference extends Expression {
    public final String name;

    public NameReference(Span span, String name) {
        super(span);
        this.name = name;
    }

    @Override
    public NodeKind getKind() {
        return NodeKind.NAME;
    }

    @Override
    protected void describe(NodeShape shape) {
        shape.attribute("name", name);
    }
}
