package org.dxworks.celerrate.model;

import org.dxworks.celerrate.span.Span;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

public final class DeclareStatement extends Statement {
    public final Map<String, String> directives;
    public final Block body;

    public DeclareStatement(Span span, Map<String, String> directives, Block body) {
        super(span);
        this.directives = Collections.unmodifiableMap(new LinkedHashMap<>(directives));
        this.body = body;
    }

    @Override
    public NodeKind getKind() {
        return NodeKind.DECLARE;
    }

    @Override
    protected void describe(NodeShape shape) {
        shape.attribute("directives", directives);
        shape.child("body", body);
    }
}
