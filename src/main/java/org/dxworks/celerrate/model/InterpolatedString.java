package org.dxworks.celerrate.model;

import org.dxworks.celerrate.span.Span;

import java.util.List;

public final class InterpolatedString extends Expression {
    public final List<Expression> parts;

    public InterpolatedString(Span span, List<Expression> parts) {
        super(span);
        this.parts = List.copyOf(parts);
    }

    @Override
    public NodeKind getKind() {
        return NodeKind.INTERPOLATED_STRING;
    }

    @Override
    protected void describe(NodeShape shape) {
        shape.children("parts", parts);
    }
}
