package org.dxworks.celerrate.model;

import org.dxworks.celerrate.span.Span;

public abstract class Clause extends AstNode {

    protected Clause(Span span) {
        super(span);
    }
}
