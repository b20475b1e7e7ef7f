package org.dxworks.celerrate.model;

import org.dxworks.celerrate.span.Span;

import java.util.List;

public final class ForStatement extends Statement {
    public final List<Expression> initializers;
    public final List<Expression> conditions;
    public final List<Expression> updates;
    public final Block body;

    public ForStatement(Span span, List<Expression> initializers, List<Expression> conditions,
            List<Expression> updates, Block body) {
        super(span);
        this.initializers = List.copyOf(initializers);
        this.conditions = List.copyOf(conditions);
        this.updates = List.copyOf(updates);
        this.body = body;
    }

    @Override
    public NodeKind getKind() {
        return NodeKind.FOR;
    }

    @Override
    protected void describe(NodeShape shape) {
        shape.children("initializers", initializers);
        shape.children("conditions", conditions);
        shape.children("updates", updates);
        shape.child("body", body);
    }
}
