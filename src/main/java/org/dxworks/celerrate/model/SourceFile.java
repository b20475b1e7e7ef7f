package org.dxworks.celerrate.model;

import org.dxworks.celerrate.span.Span;

import java.util.List;

/**
 * Root of every mapped file. Spans the whole source buffer.
 */
public final class SourceFile extends AstNode {
    public final List<AstNode> statements;

    public SourceFile(Span span, List<AstNode> statements) {
        super(span);
        this.statements = List.copyOf(statements);
    }

    @Override
    public NodeKind getKind() {
        return NodeKind.SOURCE_FILE;
    }

    @Override
    protected void describe(NodeShape shape) {
        shape.children("statements", statements);
    }
}
