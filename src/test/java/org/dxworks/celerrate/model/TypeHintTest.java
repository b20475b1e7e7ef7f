package org.dxworks.celerrate.model;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class TypeHintTest {

    @Test
    void named_lowercasesBuiltinsOnly() {
        assertEquals("int", TypeHint.named("INT").getName());
        assertTrue(TypeHint.named("Int").isBuiltin());
        assertEquals("Foo\\Bar", TypeHint.named("Foo\\Bar").getName());
        assertFalse(TypeHint.named("Foo\\Bar").isBuiltin());
    }

    @Test
    void toString_isCanonical() {
        TypeHint dnf = TypeHint.union(List.of(
                TypeHint.intersection(List.of(TypeHint.named("A"), TypeHint.named("B"))),
                TypeHint.named("null")));

        assertEquals("?int", TypeHint.nullable(TypeHint.named("int")).toString());
        assertEquals("(A&B)|null", dnf.toString());
        assertEquals("int|string", TypeHint.union(List.of(TypeHint.named("int"), TypeHint.named("string"))).toString());
    }

    @Test
    void mentions_searchesMembers() {
        TypeHint union = TypeHint.union(List.of(TypeHint.named("Foo"), TypeHint.named("MIXED")));

        assertTrue(union.mentions("mixed"));
        assertFalse(union.mentions("int"));
    }

    @Test
    void equals_isStructural() {
        assertEquals(TypeHint.nullable(TypeHint.named("String")), TypeHint.nullable(TypeHint.named("string")));
        assertNotEquals(TypeHint.nullable(TypeHint.named("int")),
                TypeHint.union(List.of(TypeHint.named("int"), TypeHint.named("null"))));
    }
}
