package org.dxworks.celerrate.dialect;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class DialectResolverTest {
    private final DialectResolver resolver = DialectResolver.getDefault();

    @Test
    void gate_readonlyPropertyFollowsIntroduction() {
        assertEquals(GateDecision.DOWNGRADE, resolver.gate(Construct.READONLY_PROPERTY, Dialect.PHP_8_0));
        assertEquals(GateDecision.ALLOW, resolver.gate(Construct.READONLY_PROPERTY, Dialect.PHP_8_1));
        assertTrue(resolver.isConstructEnabled("readonly_property", Dialect.PHP_8_4));
    }

    @Test
    void gate_rejectPolicyForEnumAndMatch() {
        assertEquals(GateDecision.REJECT, resolver.gate(Construct.ENUM, Dialect.PHP_8_0));
        assertEquals(GateDecision.REJECT, resolver.gate(Construct.MATCH_EXPRESSION, Dialect.PHP_7_4));
        assertEquals(GateDecision.ALLOW, resolver.gate(Construct.MATCH_EXPRESSION, Dialect.PHP_8_0));
    }

    @Test
    void gate_removedConstructsStopBeingEnabled() {
        assertTrue(resolver.isConstructEnabled(Construct.REAL_CAST, Dialect.PHP_7_4));
        assertTrue(resolver.isDeprecated(Construct.REAL_CAST, Dialect.PHP_7_4));
        assertFalse(resolver.isConstructEnabled(Construct.REAL_CAST, Dialect.PHP_8_0));
        assertEquals(GateDecision.KEEP_WITH_WARNING, resolver.gate(Construct.REAL_CAST, Dialect.PHP_8_0));
        assertEquals(Dialect.PHP_8_0, resolver.getRemovedIn(Construct.REAL_CAST).orElseThrow());
    }

    @Test
    void isConstructEnabled_isMonotonicForIntroducedConstructs() {
        for (Construct construct : Construct.values()) {
            if (resolver.getRemovedIn(construct).isPresent()) continue;
            boolean seen = false;
            for (Dialect dialect : Dialect.values()) {
                boolean enabled = resolver.isConstructEnabled(construct, dialect);
                assertFalse(seen && !enabled, construct.getId() + " disabled again in " + dialect);
                seen |= enabled;
            }
            assertTrue(seen, construct.getId() + " never enabled");
        }
    }

    @Test
    void isConstructEnabled_rejectsUnknownIds() {
        assertThrows(IllegalArgumentException.class, () -> resolver.isConstructEnabled("goto_labels", Dialect.PHP_8_0));
    }

    @Test
    void resolveAmbiguity_prefersEarliestLegalReading() {
        assertEquals(InterpretationChoice.AS_WRITTEN,
                resolver.resolveAmbiguity(Ambiguity.NULLABLE_SPELLING, Dialect.PHP_7_0));
        assertEquals(InterpretationChoice.NULLABLE_SHORTHAND,
                resolver.resolveAmbiguity(Ambiguity.NULLABLE_SPELLING, Dialect.PHP_7_1));
        assertEquals(InterpretationChoice.NULLABLE_SHORTHAND,
                resolver.resolveAmbiguity(Ambiguity.NULLABLE_SPELLING, Dialect.PHP_8_2));
    }

    @Test
    void resolveAmbiguity_nestedTernaryRejectedFromPhp8() {
        assertEquals(InterpretationChoice.LEFT_ASSOCIATIVE,
                resolver.resolveAmbiguity(Ambiguity.NESTED_TERNARY, Dialect.PHP_7_4));
        assertEquals(InterpretationChoice.REJECT,
                resolver.resolveAmbiguity(Ambiguity.NESTED_TERNARY, Dialect.PHP_8_0));
    }

    @Test
    void resolveAmbiguity_tiesKeepDeclarationOrder() {
        assertEquals(InterpretationChoice.ELSEIF_CLAUSE,
                resolver.resolveAmbiguity(Ambiguity.ELSE_IF_SPELLING, Dialect.PHP_7_0));
    }

    @Test
    void resolveTag_acceptsSpellingsAndFallsBack() {
        assertEquals(Dialect.PHP_8_1, resolver.resolveTag("8.1.12").getDialect());
        assertEquals(Dialect.PHP_7_4, resolver.resolveTag("php7.4").getDialect());
        assertFalse(resolver.resolveTag("8.1").isFallback());

        DialectSelection future = resolver.resolveTag("9.0");
        assertTrue(future.isFallback());
        assertEquals(Dialect.latest(), future.getDialect());
        assertEquals("9.0", future.getRequestedTag());
    }

    @Test
    void withReading_overridesOneAmbiguityOnCopy() {
        DialectResolver asWritten = resolver.withReading(Ambiguity.ARRAY_SPELLING, InterpretationChoice.AS_WRITTEN);

        assertEquals(InterpretationChoice.AS_WRITTEN, asWritten.resolveAmbiguity(Ambiguity.ARRAY_SPELLING, Dialect.PHP_8_3));
        assertEquals(InterpretationChoice.ARRAY_LITERAL, resolver.resolveAmbiguity(Ambiguity.ARRAY_SPELLING, Dialect.PHP_8_3));
        assertEquals(resolver.resolveAmbiguity(Ambiguity.LIST_SPELLING, Dialect.PHP_8_3),
                asWritten.resolveAmbiguity(Ambiguity.LIST_SPELLING, Dialect.PHP_8_3));
        assertEquals(GateDecision.REJECT, asWritten.gate(Construct.ENUM, Dialect.PHP_8_0));
    }
}
