package org.dxworks.celerrate.model;

import org.dxworks.celerrate.span.Span;

import java.util.List;

public final class Closure extends Expression {
    public final boolean isStatic;
    public final boolean byRef;
    public final TypeHint returnType;
    public final List<Declaration> parameters;
    public final List<ClosureUse> uses;
    public final Block body;

    public Closure(Span span, boolean isStatic, boolean byRef, TypeHint returnType,
            List<Declaration> parameters, List<ClosureUse> uses, Block body) {
        super(span);
        this.isStatic = isStatic;
        this.byRef = byRef;
        this.returnType = returnType;
        this.parameters = List.copyOf(parameters);
        this.uses = List.copyOf(uses);
        this.body = body;
    }

    @Override
    public NodeKind getKind() {
        return NodeKind.CLOSURE;
    }

    @Override
    protected void describe(NodeShape shape) {
        shape.attribute("static", isStatic);
        shape.attribute("byRef", byRef);
        shape.attribute("returnType", returnType);
        shape.children("parameters", parameters);
        shape.children("uses", uses);
        shape.child("body", body);
    }
}
