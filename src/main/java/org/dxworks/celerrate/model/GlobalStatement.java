package org.dxworks.celerrate.model;

import org.dxworks.celerrate.span.Span;

import java.util.List;

public final class GlobalStatement extends Statement {
    public final List<Expression> variables;

    public GlobalStatement(Span span, List<Expression> variables) {
        super(span);
        this.variables = List.copyOf(variables);
    }

    @Override
    public NodeKind getKind() {
        return NodeKind.GLOBAL;
    }

    @Override
    protected void describe(NodeShape shape) {
        shape.children("variables", variables);
    }
}
