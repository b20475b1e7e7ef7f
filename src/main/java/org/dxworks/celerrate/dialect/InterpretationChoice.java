package org.dxworks.celerrate.dialect;

public enum InterpretationChoice {
    BLOCK,
    ELSEIF_CLAUSE,
    NESTED_IF,
    ARRAY_LITERAL,
    DESTRUCTURING,
    NULLABLE_SHORTHAND,
    UNION_WITH_NULL,
    LEFT_ASSOCIATIVE,
    REJECT,
    AS_WRITTEN
}
