package org.dxworks.celerrate.mapper;

import org.dxworks.celerrate.cst.ConcreteNode;
import org.dxworks.celerrate.cst.ConcreteTreeValidator;
import org.dxworks.celerrate.cst.SourceText;
import org.dxworks.celerrate.diagnostics.DiagnosticCode;
import org.dxworks.celerrate.diagnostics.DiagnosticsCollector;
import org.dxworks.celerrate.diagnostics.InvariantViolationException;
import org.dxworks.celerrate.dialect.Dialect;
import org.dxworks.celerrate.dialect.DialectResolver;
import org.dxworks.celerrate.dialect.DialectSelection;
import org.dxworks.celerrate.model.AstInvariants;
import org.dxworks.celerrate.model.AstNode;
import org.dxworks.celerrate.model.SourceFile;
import org.dxworks.celerrate.span.Span;
import org.dxworks.celerrate.span.SpanTracker;

import java.util.List;

/**
 * Turns a concrete tree into a {@link SourceFile} under one dialect. Each call is an
 * independent pass with its own diagnostics.
 */
public final class NodeMapper {
    private final DialectResolver resolver;

    public NodeMapper() {
        this(DialectResolver.getDefault());
    }

    public NodeMapper(DialectResolver resolver) {
        this.resolver = resolver;
    }

    public MappingResult map(ConcreteNode root, SourceText source, Dialect dialect) {
        return map(root, source, new DialectSelection(dialect.getTag(), dialect, false));
    }

    /**
     * Maps with a resolved dialect tag. A fallback selection is reported at the start of the file.
     *
     * @throws InvariantViolationException when the concrete tree breaks its contract or the
     *                                     mapped tree fails its structural checks
     */
    public MappingResult map(ConcreteNode root, SourceText source, DialectSelection selection) {
        if (root == null) {
            throw new IllegalArgumentException("Concrete root must not be null");
        }
        SpanTracker tracker = new SpanTracker(source.getBytes());
        DiagnosticsCollector diagnostics = new DiagnosticsCollector();
        Dialect dialect = selection.getDialect();
        if (selection.isFallback()) {
            diagnostics.warning(DiagnosticCode.DIALECT_FALLBACK, tracker.span(0, 0),
                    "Unknown dialect '" + selection.getRequestedTag() + "', using " + dialect);
        }

        List<Span> syntaxErrors = new ConcreteTreeValidator(tracker, diagnostics).validate(root);

        MappingPass pass = new MappingPass(
                new MappingContext(resolver, dialect, diagnostics, tracker, source, syntaxErrors));
        List<AstNode> statements;
        try {
            statements = pass.statements.fileStatements(root);
        } catch (StackOverflowError e) {
            throw new InvariantViolationException("Concrete tree too deep to map", e);
        }
        SourceFile file = new SourceFile(tracker.span(0, source.length()), statements);
        AstInvariants.verify(file);
        return new MappingResult(file, diagnostics.seal(), dialect);
    }
}
