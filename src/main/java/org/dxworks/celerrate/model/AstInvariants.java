package org.dxworks.celerrate.model;

import org.dxworks.celerrate.diagnostics.InvariantViolationException;
import org.dxworks.celerrate.span.Span;

import java.util.List;

/**
 * Structural checks every mapped tree must pass. A failure is a mapper bug, never a property
 * of the input, so it is thrown rather than reported.
 */
public final class AstInvariants {

    private AstInvariants() {
    }

    /**
     * Checks that every child lies inside its parent and that siblings are ordered by start
     * offset without overlapping. Zero-width siblings overlap nothing.
     *
     * @throws InvariantViolationException on the first breach found
     */
    public static void verify(AstNode root) {
        for (NodeVisit visit : AstTraversal.preOrder(root)) {
            AstNode node = visit.getNode();
            Span span = node.getSpan();
            List<AstNode> children = node.getChildren();
            int previousStart = -1;
            int coveredUntil = -1;
            for (AstNode child : children) {
                Span childSpan = child.getSpan();
                if (!span.contains(childSpan)) {
                    throw new InvariantViolationException(child.getKind().getTag() + " " + childSpan
                            + " escapes parent " + node.getKind().getTag() + " " + span);
                }
                if (childSpan.getStartOffset() < previousStart) {
                    throw new InvariantViolationException(child.getKind().getTag() + " " + childSpan
                            + " is out of source order inside " + node.getKind().getTag() + " " + span);
                }
                if (!childSpan.isEmpty()) {
                    if (childSpan.getStartOffset() < coveredUntil) {
                        throw new InvariantViolationException(child.getKind().getTag() + " " + childSpan
                                + " overlaps a sibling inside " + node.getKind().getTag() + " " + span);
                    }
                    coveredUntil = childSpan.getEndOffset();
                }
                previousStart = childSpan.getStartOffset();
            }
        }
    }
}
