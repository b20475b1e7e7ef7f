package org.dxworks.celerrate.model;

import org.dxworks.celerrate.span.Span;

public final class ExpressionStatement extends Statement {
    public final Expression expression;

    public ExpressionStatement(Span span, Expression expression) {
        super(span);
        this.expression = expression;
    }

    @Override
    public NodeKind getKind() {
        return NodeKind.EXPRESSION_STATEMENT;
    }

    @Override
    protected void describe(NodeShape shape) {
        shape.child("expression", expression);
    }
}
