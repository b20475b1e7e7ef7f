package org.dxworks.celerrate.dialect;

import java.util.Optional;

/**
 * Grammar productions whose legality depends on the dialect. Version data lives in
 * {@link DialectResolver}'s table, not here.
 */
public enum Construct {
    NULLABLE_TYPE("nullable_type"),
    VOID_TYPE("void_type"),
    ITERABLE_TYPE("iterable_type"),
    OBJECT_TYPE("object_type"),
    MIXED_TYPE("mixed_type"),
    STATIC_RETURN_TYPE("static_return_type"),
    NEVER_TYPE("never_type"),
    STANDALONE_LITERAL_TYPE("standalone_literal_type"),
    CLASS_CONSTANT_VISIBILITY("class_constant_visibility"),
    MULTI_CATCH("multi_catch"),
    SHORT_LIST_DESTRUCTURING("short_list_destructuring"),
    TYPED_PROPERTY("typed_property"),
    ARROW_FUNCTION("arrow_function"),
    NULL_COALESCING_ASSIGNMENT("null_coalescing_assignment"),
    ARRAY_SPREAD("array_spread"),
    NUMERIC_LITERAL_SEPARATOR("numeric_literal_separator"),
    CONSTRUCTOR_PROMOTION("constructor_promotion"),
    UNION_TYPE("union_type"),
    MATCH_EXPRESSION("match_expression"),
    NULLSAFE_OPERATOR("nullsafe_operator"),
    NAMED_ARGUMENTS("named_arguments"),
    ATTRIBUTES("attributes"),
    THROW_EXPRESSION("throw_expression"),
    READONLY_PROPERTY("readonly_property"),
    ENUM("enum"),
    FIRST_CLASS_CALLABLE("first_class_callable"),
    INTERSECTION_TYPE("intersection_type"),
    NEW_IN_INITIALIZER("new_in_initializer"),
    FINAL_CLASS_CONSTANT("final_class_constant"),
    EXPLICIT_OCTAL_LITERAL("explicit_octal_literal"),
    READONLY_CLASS("readonly_class"),
    DNF_TYPE("dnf_type"),
    TRAIT_CONSTANT("trait_constant"),
    TYPED_CLASS_CONSTANT("typed_class_constant"),
    DYNAMIC_CLASS_CONSTANT_FETCH("dynamic_class_constant_fetch"),
    UNPARENTHESIZED_NESTED_TERNARY("unparenthesized_nested_ternary"),
    REAL_CAST("real_cast"),
    UNSET_CAST("unset_cast");

    private final String id;

    Construct(String id) {
        this.id = id;
    }

    public String getId() {
        return id;
    }

    public static Optional<Construct> fromId(String id) {
        for (Construct construct : values()) {
            if (construct.id.equals(id)) {
                return Optional.of(construct);
            }
        }
        return Optional.empty();
    }
}
