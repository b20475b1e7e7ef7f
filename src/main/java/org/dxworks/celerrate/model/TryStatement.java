package org.dxworks.celerrate.model;

import org.dxworks.celerrate.span.Span;

import java.util.List;

public final class TryStatement extends Statement {
    public final Block body;
    public final List<CatchClause> catches;
    public final Block finallyBlock;

    public TryStatement(Span span, Block body, List<CatchClause> catches, Block finallyBlock) {
        super(span);
        this.body = body;
        this.catches = List.copyOf(catches);
        this.finallyBlock = finallyBlock;
    }

    @Override
    public NodeKind getKind() {
        return NodeKind.TRY;
    }

    @Override
    protected void describe(NodeShape shape) {
        shape.child("body", body);
        shape.children("catches", catches);
        shape.child("finally", finallyBlock);
    }
}
