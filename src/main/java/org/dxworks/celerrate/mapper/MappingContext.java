package org.dxworks.celerrate.mapper;

import org.dxworks.celerrate.cst.ConcreteNode;
import org.dxworks.celerrate.cst.GrammarKind;
import org.dxworks.celerrate.cst.SourceText;
import org.dxworks.celerrate.diagnostics.DiagnosticCode;
import org.dxworks.celerrate.diagnostics.DiagnosticsCollector;
import org.dxworks.celerrate.dialect.Construct;
import org.dxworks.celerrate.dialect.Dialect;
import org.dxworks.celerrate.dialect.DialectResolver;
import org.dxworks.celerrate.dialect.GateDecision;
import org.dxworks.celerrate.model.AstNode;
import org.dxworks.celerrate.model.AstTraversal;
import org.dxworks.celerrate.model.NodeVisit;
import org.dxworks.celerrate.model.UnknownDeclaration;
import org.dxworks.celerrate.model.UnknownExpression;
import org.dxworks.celerrate.model.UnknownStatement;
import org.dxworks.celerrate.span.Span;
import org.dxworks.celerrate.span.SpanTracker;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.stream.Collectors;

/**
 * State threaded through one mapping pass. Nothing here outlives the pass.
 */
public final class MappingContext {
    private final DialectResolver resolver;
    private final Dialect dialect;
    private final DiagnosticsCollector diagnostics;
    private final SpanTracker tracker;
    private final SourceText source;
    private final List<Span> syntaxErrors;
    private final Deque<DeclarationScope> scopes = new ArrayDeque<>();

    public MappingContext(DialectResolver resolver, Dialect dialect, DiagnosticsCollector diagnostics,
                          SpanTracker tracker, SourceText source) {
        this(resolver, dialect, diagnostics, tracker, source, List.of());
    }

    /**
     * @param syntaxErrors spans of the outermost engine error nodes, ordered by start offset
     */
    public MappingContext(DialectResolver resolver, Dialect dialect, DiagnosticsCollector diagnostics,
                          SpanTracker tracker, SourceText source, List<Span> syntaxErrors) {
        this.resolver = resolver;
        this.dialect = dialect;
        this.diagnostics = diagnostics;
        this.tracker = tracker;
        this.source = source;
        this.syntaxErrors = List.copyOf(syntaxErrors);
        scopes.push(DeclarationScope.of(DeclarationScope.Kind.FILE));
    }

    public DialectResolver getResolver() {
        return resolver;
    }

    public Dialect getDialect() {
        return dialect;
    }

    public DiagnosticsCollector getDiagnostics() {
        return diagnostics;
    }

    public SpanTracker getTracker() {
        return tracker;
    }

    public DeclarationScope scope() {
        return scopes.peek();
    }

    public void enterScope(DeclarationScope scope) {
        scopes.push(scope);
    }

    public void exitScope() {
        if (scopes.size() == 1) {
            throw new IllegalStateException("Cannot leave the file scope");
        }
        scopes.pop();
    }

    public Span span(ConcreteNode node) {
        return tracker.span(node.startByte(), node.endByte());
    }

    public Span span(int startByte, int endByte) {
        return tracker.span(startByte, endByte);
    }

    public Span zeroWidthAt(ConcreteNode node) {
        return tracker.span(node.startByte(), node.startByte());
    }

    public String text(ConcreteNode node) {
        return node == null ? null : source.text(node);
    }

    public String slice(int startByte, int endByte) {
        return source.slice(startByte, endByte);
    }

    /**
     * Checks a construct against the active dialect and reports what the decision implies.
     * Callers keep the construct when {@link GateDecision#keepsConstruct()} holds.
     */
    public GateDecision gate(Construct construct, ConcreteNode at) {
        GateDecision decision = resolver.gate(construct, dialect);
        Span span = span(at);
        switch (decision) {
            case ALLOW:
                if (resolver.isDeprecated(construct, dialect)) {
                    diagnostics.warning(DiagnosticCode.DEPRECATED_CONSTRUCT, span,
                            construct.getId() + " is deprecated in " + dialect);
                }
                break;
            case DOWNGRADE:
                diagnostics.warning(DiagnosticCode.DIALECT_CONSTRUCT_DISABLED, span,
                        unavailable(construct) + "; ignored");
                break;
            case KEEP_WITH_WARNING:
                diagnostics.warning(DiagnosticCode.DIALECT_CONSTRUCT_DISABLED, span, unavailable(construct));
                break;
            case REJECT:
                diagnostics.warning(DiagnosticCode.DIALECT_CONSTRUCT_REJECTED, span,
                        unavailable(construct) + "; not mapped");
                break;
        }
        return decision;
    }

    private String unavailable(Construct construct) {
        Dialect since = resolver.getMinimumDialect(construct);
        if (!dialect.isAtLeast(since)) {
            return construct.getId() + " requires " + since + " but " + dialect + " is active";
        }
        return construct.getId() + " was removed in " + resolver.getRemovedIn(construct).map(Dialect::toString).orElse("?");
    }

    public void invalidContext(ConcreteNode at, String message) {
        diagnostics.error(DiagnosticCode.INVALID_CONTEXT, span(at), message);
    }

    // Placeholders. Engine error and missing nodes were already reported by the validator.

    public UnknownExpression unknownExpression(ConcreteNode node, String expected) {
        return new UnknownExpression(span(node), node.kind(), reportUnmapped(node, expected));
    }

    public UnknownStatement unknownStatement(ConcreteNode node, String expected) {
        return new UnknownStatement(span(node), node.kind(), reportUnmapped(node, expected));
    }

    public UnknownDeclaration unknownDeclaration(ConcreteNode node, String expected) {
        return new UnknownDeclaration(span(node), node.kind(), reportUnmapped(node, expected));
    }

    public UnknownExpression rejectedExpression(ConcreteNode node, Construct construct) {
        return new UnknownExpression(span(node), node.kind(), construct.getId() + " rejected in " + dialect);
    }

    public UnknownDeclaration rejectedDeclaration(ConcreteNode node, Construct construct) {
        return new UnknownDeclaration(span(node), node.kind(), construct.getId() + " rejected in " + dialect);
    }

    /**
     * Placeholder for a statement whose rule stepped over an engine error node. The error itself
     * was reported by the validator and lies inside this span.
     */
    public UnknownStatement malformedStatement(ConcreteNode node) {
        return new UnknownStatement(span(node), node.kind(), "syntax error inside " + node.kind());
    }

    public UnknownDeclaration malformedDeclaration(ConcreteNode node) {
        return new UnknownDeclaration(span(node), node.kind(), "syntax error inside " + node.kind());
    }

    /**
     * True when an error node inside {@code node} is not covered by any placeholder in the nodes
     * mapped from it.
     */
    public boolean hidesSyntaxError(ConcreteNode node, List<? extends AstNode> mapped) {
        if (node.isError() || syntaxErrors.isEmpty()) return false;
        List<Span> placeholders = null;
        for (int i = firstErrorFrom(node.startByte()); i < syntaxErrors.size(); i++) {
            Span error = syntaxErrors.get(i);
            if (error.getStartOffset() >= node.endByte()) break;
            if (error.getEndOffset() > node.endByte()) continue;
            if (placeholders == null) {
                placeholders = placeholderSpans(mapped);
            }
            if (placeholders.stream().noneMatch(placeholder -> placeholder.contains(error))) {
                return true;
            }
        }
        return false;
    }

    private int firstErrorFrom(int offset) {
        int low = 0;
        int high = syntaxErrors.size();
        while (low < high) {
            int mid = (low + high) >>> 1;
            if (syntaxErrors.get(mid).getStartOffset() < offset) {
                low = mid + 1;
            } else {
                high = mid;
            }
        }
        return low;
    }

    private static List<Span> placeholderSpans(List<? extends AstNode> mapped) {
        return mapped.stream()
                .flatMap(AstTraversal::stream)
                .map(NodeVisit::getNode)
                .filter(AstNode::isPlaceholder)
                .map(AstNode::getSpan)
                .collect(Collectors.toList());
    }

    private String reportUnmapped(ConcreteNode node, String expected) {
        if (node.isError()) {
            return "syntax error";
        }
        if (node.isMissing()) {
            return "missing " + node.kind();
        }
        if (node.grammarKind() == GrammarKind.UNKNOWN) {
            String message = "Unknown grammar kind '" + node.kind() + "'";
            diagnostics.warning(DiagnosticCode.UNKNOWN_GRAMMAR_KIND, span(node), message);
            return message;
        }
        String message = "Unexpected " + node.kind() + " where " + expected + " was expected";
        diagnostics.warning(DiagnosticCode.UNEXPECTED_NODE, span(node), message);
        return message;
    }
}
