package org.dxworks.celerrate.model;

import org.dxworks.celerrate.span.Span;

/**
 * One imported name. Group imports are flattened to fully spelled names.
 */
public final class UseItem extends Clause {
    public final String name;
    public final String alias;

    public UseItem(Span span, String name, String alias) {
        super(span);
        this.name = name;
        this.alias = alias;
    }

    @Override
    public NodeKind getKind() {
        return NodeKind.USE_ITEM;
    }

    @Override
    protected void describe(NodeShape shape) {
        shape.attribute("name", name);
        shape.attribute("alias", alias);
    }
}
