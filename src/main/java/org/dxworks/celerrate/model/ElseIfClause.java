package org.dxworks.celerrate.model;

import org.dxworks.celerrate.span.Span;

/**
 * Written either as {@code elseif} or as {@code else if}.
 */
public final class ElseIfClause extends Clause {
    public final Expression condition;
    public final Block body;

    public ElseIfClause(Span span, Expression condition, Block body) {
        super(span);
        this.condition = condition;
        this.body = body;
    }

    @Override
    public NodeKind getKind() {
        return NodeKind.ELSE_IF;
    }

    @Override
    protected void describe(NodeShape shape) {
        shape.child("condition", condition);
        shape.child("body", body);
    }
}
