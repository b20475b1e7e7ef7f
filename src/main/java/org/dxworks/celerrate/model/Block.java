package org.dxworks.celerrate.model;

import org.dxworks.celerrate.span.Span;

import java.util.List;

/**
 * Canonical statement list. Braces, alternative syntax and single-statement bodies all map here.
 */
public final class Block extends Statement {
    public final List<AstNode> statements;
    /**
     * Source spelling kept when bodies are read as written:
     * {@code "braces"}, {@code "colon"} or {@code "statement"}. {@code null} under the canonical reading.
     */
    public final String spelling;

    public Block(Span span, List<AstNode> statements) {
        this(span, statements, null);
    }

    public Block(Span span, List<AstNode> statements, String spelling) {
        super(span);
        this.statements = List.copyOf(statements);
        this.spelling = spelling;
    }

    @Override
    public NodeKind getKind() {
        return NodeKind.BLOCK;
    }

    @Override
    protected void describe(NodeShape shape) {
        shape.attribute("spelling", spelling);
        shape.children("statements", statements);
    }
}
