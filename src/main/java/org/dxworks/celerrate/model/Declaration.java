package org.dxworks.celerrate.model;

import org.dxworks.celerrate.span.Span;

public abstract class Declaration extends AstNode {

    protected Declaration(Span span) {
        super(span);
    }
}
