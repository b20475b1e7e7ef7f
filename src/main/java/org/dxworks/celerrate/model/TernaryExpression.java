package org.dxworks.celerrate.model;

import org.dxworks.celerrate.span.Span;

/**
 * Conditional expression; the short form {@code a ?: b} has no then-value.
 */
public final class TernaryExpression extends Expression {
    public final Expression condition;
    public final Expression thenValue;
    public final Expression elseValue;

    public TernaryExpression(Span span, Expression condition, Expression thenValue, Expression elseValue) {
        super(span);
        this.condition = condition;
        this.thenValue = thenValue;
        this.elseValue = elseValue;
    }

    @Override
    public NodeKind getKind() {
        return NodeKind.TERNARY;
    }

    @Override
    protected void describe(NodeShape shape) {
        shape.child("condition", condition);
        shape.child("then", thenValue);
        shape.child("else", elseValue);
    }
}
