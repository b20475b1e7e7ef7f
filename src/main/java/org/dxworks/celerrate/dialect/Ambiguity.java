package org.dxworks.celerrate.dialect;

/**
 * Source forms with more than one possible reading, or more than one spelling of the same meaning.
 */
public enum Ambiguity {
    /** {@code if ($a) foo();} versus {@code if ($a) { foo(); }} */
    STATEMENT_BODY,
    /** {@code if ($a): ... endif;} versus braces */
    ALTERNATIVE_SYNTAX,
    /** {@code else if} versus {@code elseif} */
    ELSE_IF_SPELLING,
    /** {@code array(...)} versus {@code [...]} */
    ARRAY_SPELLING,
    /** {@code list(...)} versus {@code [...]} on the left of an assignment */
    LIST_SPELLING,
    /** {@code ?T} versus {@code T|null} */
    NULLABLE_SPELLING,
    /** {@code $a ? $b : $c ? $d : $e} without parentheses */
    NESTED_TERNARY
}
