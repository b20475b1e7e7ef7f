package org.dxworks.celerrate.model;

import org.dxworks.celerrate.span.Span;

public final class UnknownDeclaration extends Declaration implements Placeholder {
    private final String concreteKind;
    private final String reason;

    public UnknownDeclaration(Span span, String concreteKind, String reason) {
        super(span);
        this.concreteKind = concreteKind;
        this.reason = reason;
    }

    @Override
    public String getConcreteKind() {
        return concreteKind;
    }

    @Override
    public String getReason() {
        return reason;
    }

    @Override
    public boolean isPlaceholder() {
        return true;
    }

    @Override
    public NodeKind getKind() {
        return NodeKind.UNKNOWN_DECLARATION;
    }

    @Override
    protected void describe(NodeShape shape) {
        shape.attribute("concreteKind", concreteKind);
    }
}
