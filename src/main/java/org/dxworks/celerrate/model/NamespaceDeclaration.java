package org.dxworks.celerrate.model;

import org.dxworks.celerrate.span.Span;

import java.util.List;

/**
 * Namespace with the statements it scopes. The unbraced form scopes every statement up to the next
 * namespace, so both spellings produce the same node.
 */
public final class NamespaceDeclaration extends Declaration {
    public final String name;
    public final List<AstNode> statements;

    public NamespaceDeclaration(Span span, String name, List<AstNode> statements) {
        super(span);
        this.name = name;
        this.statements = List.copyOf(statements);
    }

    @Override
    public NodeKind getKind() {
        return NodeKind.NAMESPACE;
    }

    @Override
    protected void describe(NodeShape shape) {
        shape.attribute("name", name);
        shape.children("statements", statements);
    }
}
