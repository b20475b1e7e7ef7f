package org.dxworks.celerrate.model;

import org.dxworks.celerrate.diagnostics.InvariantViolationException;
import org.dxworks.celerrate.span.Span;
import org.dxworks.celerrate.span.SpanTracker;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class AstNodeTest {
    private final SpanTracker tracker = new SpanTracker(new byte[64]);

    private Span span(int start, int end) {
        return tracker.span(start, end);
    }

    private ReturnStatement returnOf(int offset, String variable) {
        Variable value = new Variable(span(offset + 7, offset + 9), variable, null);
        return new ReturnStatement(span(offset, offset + 10), value);
    }

    @Test
    void equals_ignoresSpans() {
        ReturnStatement first = returnOf(0, "a");
        ReturnStatement moved = returnOf(20, "a");

        assertEquals(first, moved);
        assertEquals(first.hashCode(), moved.hashCode());
        assertNotEquals(first, returnOf(0, "b"));
    }

    @Test
    void equals_distinguishesEmptySlotsFromMissingSlots() {
        Block empty = new Block(span(0, 2), List.of());
        IfStatement withElse = new IfStatement(span(0, 20), new BooleanLiteral(span(4, 8), true),
                new Block(span(10, 12), List.of()), List.of(), empty);
        IfStatement withoutElse = new IfStatement(span(0, 20), new BooleanLiteral(span(4, 8), true),
                new Block(span(10, 12), List.of()), List.of(), null);

        assertNotEquals(withElse, withoutElse);
    }

    @Test
    void preOrder_isRestartableAndTracksParents() {
        SourceFile file = new SourceFile(span(0, 40), List.of(returnOf(0, "a"), returnOf(20, "b")));
        Iterable<NodeVisit> walk = AstTraversal.preOrder(file);

        List<String> tags = new ArrayList<>();
        for (NodeVisit visit : walk) {
            tags.add(visit.getNode().getKind().getTag());
        }
        List<String> again = new ArrayList<>();
        walk.forEach(visit -> again.add(visit.getNode().getKind().getTag()));

        assertEquals(List.of("source_file", "return", "variable", "return", "variable"), tags);
        assertEquals(tags, again);

        NodeVisit variable = AstTraversal.stream(file)
                .filter(visit -> visit.getNode() instanceof Variable)
                .findFirst()
                .orElseThrow();
        assertEquals(2, variable.getDepth());
        assertSame(file, variable.findAncestor(SourceFile.class));
        assertNotNull(variable.findAncestor(ReturnStatement.class));
        assertEquals(2, AstTraversal.findAll(file, Variable.class).size());
    }

    @Test
    void verify_acceptsZeroWidthSiblingsInsideAnotherSibling() {
        Property promoted = new Property(span(5, 5), "x", Visibility.PUBLIC, false, false, null, true, List.of(), null);
        MethodDeclaration constructor = new MethodDeclaration(span(0, 20), "__construct", Visibility.PUBLIC,
                false, false, false, false, null, List.of(), List.of(), new Block(span(18, 20), List.of()));
        ClassDeclaration declaration = new ClassDeclaration(span(0, 30), "A", false, false, false, null,
                List.of(), List.of(), List.of(constructor, promoted));

        assertDoesNotThrow(() -> AstInvariants.verify(declaration));
    }

    @Test
    void verify_rejectsEscapingAndOverlappingChildren() {
        SourceFile escaping = new SourceFile(span(0, 5), List.of(returnOf(0, "a")));
        SourceFile overlapping = new SourceFile(span(0, 40), List.of(returnOf(0, "a"), returnOf(5, "b")));

        assertThrows(InvariantViolationException.class, () -> AstInvariants.verify(escaping));
        assertThrows(InvariantViolationException.class, () -> AstInvariants.verify(overlapping));
    }

    @Test
    void print_rendersSetAttributesOnly() {
        Parameter parameter = new Parameter(span(0, 10), "x", TypeHint.nullable(TypeHint.named("int")), false,
                false, Visibility.PRIVATE, true, List.of(), new NullLiteral(span(8, 10)));

        assertEquals("parameter name=\"x\" type=?int promotedVisibility=private readonly=true\n  null\n",
                AstPrinter.print(parameter));
    }
}
