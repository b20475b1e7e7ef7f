package org.dxworks.celerrate.mapper;

import org.dxworks.celerrate.diagnostics.Diagnostic;
import org.dxworks.celerrate.dialect.Dialect;
import org.dxworks.celerrate.model.AstNode;
import org.dxworks.celerrate.model.AstTraversal;
import org.dxworks.celerrate.model.NodeVisit;
import org.dxworks.celerrate.model.SourceFile;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Outcome of one mapping pass: the tree, everything reported while building it and the
 * dialect it was built under.
 */
public final class MappingResult {
    private final SourceFile root;
    private final List<Diagnostic> diagnostics;
    private final Dialect dialect;

    public MappingResult(SourceFile root, List<Diagnostic> diagnostics, Dialect dialect) {
        this.root = root;
        this.diagnostics = List.copyOf(diagnostics);
        this.dialect = dialect;
    }

    public SourceFile getRoot() {
        return root;
    }

    public List<Diagnostic> getDiagnostics() {
        return diagnostics;
    }

    public Dialect getDialect() {
        return dialect;
    }

    public boolean hasErrors() {
        return diagnostics.stream().anyMatch(Diagnostic::isError);
    }

    /**
     * Placeholders left where the input could not be mapped, in source order.
     */
    public List<AstNode> getUnknownNodes() {
        return AstTraversal.stream(root)
                .map(NodeVisit::getNode)
                .filter(AstNode::isPlaceholder)
                .collect(Collectors.toList());
    }

    public List<Diagnostic> failures(ReportingMode mode) {
        if (mode == ReportingMode.STRICT) {
            return diagnostics;
        }
        return diagnostics.stream().filter(Diagnostic::isError).collect(Collectors.toList());
    }
}
