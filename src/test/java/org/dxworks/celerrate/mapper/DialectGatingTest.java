package org.dxworks.celerrate.mapper;

import org.dxworks.celerrate.Celerrate;
import org.dxworks.celerrate.diagnostics.Diagnostic;
import org.dxworks.celerrate.diagnostics.DiagnosticCode;
import org.dxworks.celerrate.dialect.Dialect;
import org.dxworks.celerrate.model.*;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

public class DialectGatingTest {

    private static final String MATCH_SOURCE = "<?php\n$r = match ($x) { 1, 2 => 'a', default => 'b' };\n";

    private static final String MIXED_SOURCE = "<?php\n"
            + "enum Suit: string { case Hearts = 'H'; }\n"
            + "class Box { public readonly int $size; }\n"
            + "$r = match ($x) { default => 1 };\n"
            + "$y = $a?->b;\n"
            + "[$p, $q] = $pair;\n";

    private static List<Diagnostic> withCode(MappingResult result, DiagnosticCode code) {
        return result.getDiagnostics().stream()
                .filter(d -> d.getCode() == code)
                .collect(Collectors.toList());
    }

    @Test
    void map_matchBeforePhp8IsRejected() {
        MappingResult result = Celerrate.map(MATCH_SOURCE, Dialect.PHP_7_4);

        assertFalse(result.hasErrors());
        assertEquals(1, withCode(result, DiagnosticCode.DIALECT_CONSTRUCT_REJECTED).size());
        assertNull(AstTraversal.findFirst(result.getRoot(), MatchExpression.class));
        assertEquals(1, result.getUnknownNodes().size());
        assertTrue(result.getUnknownNodes().get(0) instanceof UnknownExpression);
    }

    @Test
    void map_matchInPhp8IsKept() {
        MappingResult result = Celerrate.map(MATCH_SOURCE, Dialect.PHP_8_0);

        assertTrue(result.getDiagnostics().isEmpty(), () -> result.getDiagnostics().toString());
        MatchExpression match = AstTraversal.findFirst(result.getRoot(), MatchExpression.class);
        assertNotNull(match);
        assertEquals(2, match.arms.size());
        assertEquals(2, match.arms.get(0).conditions.size());
        assertTrue(match.arms.get(1).isDefault);
    }

    @Test
    void map_enumBeforePhp81IsRejected() {
        MappingResult result = Celerrate.map("<?php\nenum Suit { case Hearts; }\n", Dialect.PHP_8_0);

        assertFalse(result.hasErrors());
        assertEquals(1, withCode(result, DiagnosticCode.DIALECT_CONSTRUCT_REJECTED).size());
        assertNull(AstTraversal.findFirst(result.getRoot(), EnumDeclaration.class));
        assertTrue(result.getRoot().statements.get(0) instanceof UnknownDeclaration);
    }

    @Test
    void map_enumInPhp81IsKept() {
        MappingResult result = Celerrate.map("<?php\nenum Suit: string { case Hearts = 'H'; }\n", Dialect.PHP_8_1);

        assertTrue(result.getDiagnostics().isEmpty(), () -> result.getDiagnostics().toString());
        EnumDeclaration declaration = (EnumDeclaration) result.getRoot().statements.get(0);
        assertEquals("Suit", declaration.name);
        assertEquals(TypeHint.named("string"), declaration.backingType);
        assertEquals(1, declaration.members.size());
    }

    @Test
    void map_unparenthesizedNestedTernaryInPhp8IsAnError() {
        MappingResult result = Celerrate.map("<?php\n$v = $a ? 1 : $b ? 2 : 3;\n", Dialect.PHP_8_0);

        assertTrue(result.hasErrors());
        assertFalse(withCode(result, DiagnosticCode.AMBIGUOUS_CONSTRUCT).isEmpty());
    }

    @Test
    void map_parenthesizedNestedTernaryIsFine() {
        MappingResult result = Celerrate.map("<?php\n$v = ($a ? 1 : $b) ? 2 : 3;\n", Dialect.PHP_8_0);

        assertTrue(result.getDiagnostics().isEmpty(), () -> result.getDiagnostics().toString());
    }

    @Test
    void map_gateWarningsNeverGrowWithNewerDialects() {
        int previous = Integer.MAX_VALUE;
        for (Dialect dialect : Dialect.values()) {
            MappingResult result = Celerrate.map(MIXED_SOURCE, dialect);
            int count = withCode(result, DiagnosticCode.DIALECT_CONSTRUCT_REJECTED).size()
                    + withCode(result, DiagnosticCode.DIALECT_CONSTRUCT_DISABLED).size();
            assertTrue(count <= previous, "more gate warnings in " + dialect);
            previous = count;
        }
        assertEquals(0, previous);
    }
}
