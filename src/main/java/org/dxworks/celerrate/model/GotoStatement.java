package org.dxworks.celerrate.model;

import org.dxworks.celerrate.span.Span;

public final class GotoStatement extends Statement {
    public final String label;

    public GotoStatement(Span span, String label) {
        super(span);
        this.label = label;
    }

    @Override
    public NodeKind getKind() {
        return NodeKind.GOTO;
    }

    @Override
    protected void describe(NodeShape shape) {
        shape.attribute("label", label);
    }
}
