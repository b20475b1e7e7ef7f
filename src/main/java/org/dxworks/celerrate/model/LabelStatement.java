package org.dxworks.celerrate.model;

import org.dxworks.celerrate.span.Span;

public final class LabelStatement extends Statement {
    public final String label;

    public LabelStatement(Span span, String label) {
        super(span);
        this.label = label;
    }

    @Override
    public NodeKind getKind() {
        return NodeKind.LABEL;
    }

    @Override
    protected void describe(NodeShape shape) {
        shape.attribute("label", label);
    }
}
