package org.dxworks.celerrate.model;

import org.dxworks.celerrate.span.Span;

import java.util.List;

/**
 * A {@code case}, or the {@code default} arm when the test is {@code null}.
 */
public final class SwitchCase extends Clause {
    public final Expression test;
    public final List<AstNode> statements;

    public SwitchCase(Span span, Expression test, List<AstNode> statements) {
        super(span);
        this.test = test;
        this.statements = List.copyOf(statements);
    }

    @Override
    public NodeKind getKind() {
        return NodeKind.SWITCH_CASE;
    }

    @Override
    protected void describe(NodeShape shape) {
        shape.child("test", test);
        shape.children("statements", statements);
    }
}
