package org.dxworks.celerrate.model;

import org.dxworks.celerrate.span.Span;

/**
 * Text outside the PHP tags.
 */
public final class InlineHtml extends Statement {
    public final String content;

    public InlineHtml(Span span, String content) {
        super(span);
        this.content = content;
    }

    @Override
    public NodeKind getKind() {
        return NodeKind.INLINE_HTML;
    }

    @Override
    protected void describe(NodeShape shape) {
        shape.attribute("content", content);
    }
}
