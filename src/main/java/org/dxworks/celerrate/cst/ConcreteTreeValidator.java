package org.dxworks.celerrate.cst;

import org.dxworks.celerrate.diagnostics.DiagnosticCode;
import org.dxworks.celerrate.diagnostics.DiagnosticsCollector;
import org.dxworks.celerrate.diagnostics.InvariantViolationException;
import org.dxworks.celerrate.span.Span;
import org.dxworks.celerrate.span.SpanTracker;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Set;

/**
 * Walks a concrete tree once before mapping.
 * <p>
 * Engine-reported problems become diagnostics: one error per outermost error node and one per
 * missing node. Breaches of the tree contract (ranges outside the parent or the source,
 * inverted ranges, unordered siblings, cycles) throw {@link InvariantViolationException}.
 * The walk keeps its own stack, so arbitrarily deep trees are fine.
 */
public final class ConcreteTreeValidator {
    private final SpanTracker tracker;
    private final DiagnosticsCollector diagnostics;

    public ConcreteTreeValidator(SpanTracker tracker, DiagnosticsCollector diagnostics) {
        this.tracker = tracker;
        this.diagnostics = diagnostics;
    }

    /**
     * @return spans of the outermost error nodes, ordered by start offset
     */
    public List<Span> validate(ConcreteNode root) {
        checkRange(root);
        if (root.endByte() > tracker.getSourceLength()) {
            throw new InvariantViolationException("Root " + describe(root) + " extends past the end of the source ("
                    + tracker.getSourceLength() + " bytes)");
        }

        List<Span> syntaxErrors = new ArrayList<>();
        Set<ConcreteNode> onPath = Collections.newSetFromMap(new IdentityHashMap<>());
        Deque<Frame> stack = new ArrayDeque<>();
        stack.push(new Frame(root, false));
        while (!stack.isEmpty()) {
            Frame frame = stack.pop();
            ConcreteNode node = frame.node;
            if (frame.exiting) {
                onPath.remove(node);
                continue;
            }
            if (!onPath.add(node)) {
                throw new InvariantViolationException("Cycle through " + describe(node));
            }
            stack.push(new Frame(node, true));

            boolean insideError = frame.insideError;
            if (node.isError() && !insideError) {
                Span span = tracker.span(node.startByte(), node.endByte());
                diagnostics.error(DiagnosticCode.SYNTAX_ERROR, span, "Syntax error");
                syntaxErrors.add(span);
                insideError = true;
            } else if (node.isMissing() && !insideError) {
                diagnostics.error(DiagnosticCode.MISSING_NODE, tracker.span(node.startByte(), node.endByte()),
                        "Missing " + node.kind());
            }

            List<ConcreteNode> children = node.children();
            int previousEnd = node.startByte();
            for (ConcreteNode child : children) {
                checkRange(child);
                if (child.startByte() < node.startByte() || child.endByte() > node.endByte()) {
                    throw new InvariantViolationException("Child " + describe(child) + " lies outside parent "
                            + describe(node));
                }
                if (child.startByte() < previousEnd) {
                    throw new InvariantViolationException("Child " + describe(child) + " overlaps or precedes "
                            + "its previous sibling inside " + describe(node));
                }
                previousEnd = child.endByte();
            }
            for (int i = children.size() - 1; i >= 0; i--) {
                stack.push(new Frame(children.get(i), false, insideError));
            }
        }
        return syntaxErrors;
    }

    private static void checkRange(ConcreteNode node) {
        if (node.startByte() < 0 || node.endByte() < node.startByte()) {
            throw new InvariantViolationException("Invalid byte range on " + describe(node));
        }
    }

    private static String describe(ConcreteNode node) {
        return node.kind() + "[" + node.startByte() + ".." + node.endByte() + ")";
    }

    private static final class Frame {
        final ConcreteNode node;
        final boolean exiting;
        final boolean insideError;

        Frame(ConcreteNode node, boolean exiting) {
            this(node, exiting, false);
        }

        Frame(ConcreteNode node, boolean exiting, boolean insideError) {
            this.node = node;
            this.exiting = exiting;
            this.insideError = insideError;
        }
    }
}
