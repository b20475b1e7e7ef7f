package org.dxworks.celerrate.model;

import org.dxworks.celerrate.span.Span;

import java.util.List;

public final class UnsetStatement extends Statement {
    public final List<Expression> targets;

    public UnsetStatement(Span span, List<Expression> targets) {
        super(span);
        this.targets = List.copyOf(targets);
    }

    @Override
    public NodeKind getKind() {
        return NodeKind.UNSET;
    }

    @Override
    protected void describe(NodeShape shape) {
        shape.children("targets", targets);
    }
}
