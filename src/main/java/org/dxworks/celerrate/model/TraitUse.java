package org.dxworks.celerrate.model;

import org.dxworks.celerrate.span.Span;

import java.util.List;

public final class TraitUse extends Declaration {
    public final List<String> traits;

    public TraitUse(Span span, List<String> traits) {
        super(span);
        this.traits = List.copyOf(traits);
    }

    @Override
    public NodeKind getKind() {
        return NodeKind.TRAIT_USE;
    }

    @Override
    protected void describe(NodeShape shape) {
        shape.attribute("traits", traits);
    }
}
