package org.dxworks.celerrate.model;

import org.dxworks.celerrate.span.Span;

import java.util.List;

public final class UseDeclaration extends Declaration {
    public final String importKind;
    public final List<UseItem> items;

    public UseDeclaration(Span span, String importKind, List<UseItem> items) {
        super(span);
        this.importKind = importKind;
        this.items = List.copyOf(items);
    }

    @Override
    public NodeKind getKind() {
        return NodeKind.USE_DECLARATION;
    }

    @Override
    protected void describe(NodeShape shape) {
        shape.attribute("importKind", importKind);
        shape.children("items", items);
    }
}
