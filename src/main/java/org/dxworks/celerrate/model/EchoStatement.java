package org.dxworks.celerrate.model;

import org.dxworks.celerrate.span.Span;

import java.util.List;

public final class EchoStatement extends Statement {
    public final List<Expression> values;

    public EchoStatement(Span span, List<Expression> values) {
        super(span);
        this.values = List.copyOf(values);
    }

    @Override
    public NodeKind getKind() {
        return NodeKind.ECHO;
    }

    @Override
    protected void describe(NodeShape shape) {
        shape.children("values", values);
    }
}
