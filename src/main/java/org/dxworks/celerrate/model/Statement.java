package org.dxworks.celerrate.model;

import org.dxworks.celerrate.span.Span;

public abstract class Statement extends AstNode {

    protected Statement(Span span) {
        super(span);
    }
}
