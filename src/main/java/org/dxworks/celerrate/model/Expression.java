package org.dxworks.celerrate.model;

import org.dxworks.celerrate.span.Span;

public abstract class Expression extends AstNode {

    protected Expression(Span span) {
        super(span);
    }
}
