package org.dxworks.celerrate.model;

import org.dxworks.celerrate.span.Span;

import java.util.List;

public final class IfStatement extends Statement {
    public final Expression condition;
    public final Block thenBlock;
    public final List<ElseIfClause> elseIfs;
    public final Block elseBlock;

    public IfStatement(Span span, Expression condition, Block thenBlock, List<ElseIfClause> elseIfs,
            Block elseBlock) {
        super(span);
        this.condition = condition;
        this.thenBlock = thenBlock;
        this.elseIfs = List.copyOf(elseIfs);
        this.elseBlock = elseBlock;
    }

    @Override
    public NodeKind getKind() {
        return NodeKind.IF;
    }

    @Override
    protected void describe(NodeShape shape) {
        shape.child("condition", condition);
        shape.child("then", thenBlock);
        shape.children("elseIfs", elseIfs);
        shape.child("else", elseBlock);
    }
}
