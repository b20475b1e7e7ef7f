package org.dxworks.celerrate.mapper;

/**
 * The rule sets of one mapping pass, wired to a shared context. Rule sets call each other
 * through here, since declarations contain statements and expressions contain declarations.
 */
final class MappingPass {
    final MappingContext context;
    final TypeMapper types;
    final ExpressionMapper expressions;
    final StatementMapper statements;
    final DeclarationMapper declarations;

    MappingPass(MappingContext context) {
        this.context = context;
        this.types = new TypeMapper(context);
        this.expressions = new ExpressionMapper(this);
        this.statements = new StatementMapper(this);
        this.declarations = new DeclarationMapper(this);
    }
}
