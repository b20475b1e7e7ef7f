package org.dxworks.celerrate.cst;

import java.util.HashMap;
import java.util.Map;

/**
 * Closed set of grammar kinds the mapper understands, keyed by the tags the PHP grammar emits.
 * Anything else maps to {@link #UNKNOWN}. The set is pinned to one grammar release, see
 * {@link #GRAMMAR_VERSION}.
 */
public enum GrammarKind {
    // Structure and trivia
    PROGRAM("program"),
    PHP_TAG("php_tag"),
    TEXT("text"),
    TEXT_INTERPOLATION("text_interpolation"),
    COMMENT("comment"),
    ERROR("ERROR"),

    // Namespaces and imports
    NAMESPACE_DEFINITION("namespace_definition"),
    NAMESPACE_USE_DECLARATION("namespace_use_declaration"),
    NAMESPACE_USE_CLAUSE("namespace_use_clause"),
    NAMESPACE_USE_GROUP("namespace_use_group"),
    NAMESPACE_USE_GROUP_CLAUSE("namespace_use_group_clause"),
    NAMESPACE_ALIASING_CLAUSE("namespace_aliasing_clause"),
    NAMESPACE_NAME("namespace_name"),

    // Type declarations
    CLASS_DECLARATION("class_declaration"),
    INTERFACE_DECLARATION("interface_declaration"),
    TRAIT_DECLARATION("trait_declaration"),
    ENUM_DECLARATION("enum_declaration"),
    ENUM_CASE("enum_case"),
    DECLARATION_LIST("declaration_list"),
    ENUM_DECLARATION_LIST("enum_declaration_list"),
    BASE_CLAUSE("base_clause"),
    CLASS_INTERFACE_CLAUSE("class_interface_clause"),
    ANONYMOUS_CLASS("anonymous_class"),

    // Members
    FUNCTION_DEFINITION("function_definition"),
    METHOD_DECLARATION("method_declaration"),
    PROPERTY_DECLARATION("property_declaration"),
    PROPERTY_ELEMENT("property_element"),
    PROPERTY_INITIALIZER("property_initializer"),
    CONST_DECLARATION("const_declaration"),
    CONST_ELEMENT("const_element"),
    USE_DECLARATION("use_declaration"),
    USE_LIST("use_list"),
    USE_INSTEAD_OF_CLAUSE("use_instead_of_clause"),
    USE_AS_CLAUSE("use_as_clause"),
    FORMAL_PARAMETERS("formal_parameters"),
    SIMPLE_PARAMETER("simple_parameter"),
    VARIADIC_PARAMETER("variadic_parameter"),
    PROPERTY_PROMOTION_PARAMETER("property_promotion_parameter"),
    ATTRIBUTE_LIST("attribute_list"),
    ATTRIBUTE_GROUP("attribute_group"),
    ATTRIBUTE("attribute"),

    // Modifiers
    VISIBILITY_MODIFIER("visibility_modifier"),
    STATIC_MODIFIER("static_modifier"),
    ABSTRACT_MODIFIER("abstract_modifier"),
    FINAL_MODIFIER("final_modifier"),
    READONLY_MODIFIER("readonly_modifier"),
    VAR_MODIFIER("var_modifier"),
    REFERENCE_MODIFIER("reference_modifier"),

    // Types
    NAMED_TYPE("named_type"),
    PRIMITIVE_TYPE("primitive_type"),
    OPTIONAL_TYPE("optional_type"),
    UNION_TYPE("union_type"),
    INTERSECTION_TYPE("intersection_type"),
    DISJUNCTIVE_NORMAL_FORM_TYPE("disjunctive_normal_form_type"),
    BOTTOM_TYPE("bottom_type"),
    TYPE_LIST("type_list"),
    CAST_TYPE("cast_type"),

    // Statements
    COMPOUND_STATEMENT("compound_statement"),
    COLON_BLOCK("colon_block"),
    EMPTY_STATEMENT("empty_statement"),
    EXPRESSION_STATEMENT("expression_statement"),
    ECHO_STATEMENT("echo_statement"),
    RETURN_STATEMENT("return_statement"),
    IF_STATEMENT("if_statement"),
    ELSE_IF_CLAUSE("else_if_clause"),
    ELSE_CLAUSE("else_clause"),
    WHILE_STATEMENT("while_statement"),
    DO_STATEMENT("do_statement"),
    FOR_STATEMENT("for_statement"),
    FOREACH_STATEMENT("foreach_statement"),
    SWITCH_STATEMENT("switch_statement"),
    SWITCH_BLOCK("switch_block"),
    CASE_STATEMENT("case_statement"),
    DEFAULT_STATEMENT("default_statement"),
    BREAK_STATEMENT("break_statement"),
    CONTINUE_STATEMENT("continue_statement"),
    TRY_STATEMENT("try_statement"),
    CATCH_CLAUSE("catch_clause"),
    FINALLY_CLAUSE("finally_clause"),
    GLOBAL_DECLARATION("global_declaration"),
    FUNCTION_STATIC_DECLARATION("function_static_declaration"),
    STATIC_VARIABLE_DECLARATION("static_variable_declaration"),
    UNSET_STATEMENT("unset_statement"),
    DECLARE_STATEMENT("declare_statement"),
    DECLARE_DIRECTIVE("declare_directive"),
    GOTO_STATEMENT("goto_statement"),
    NAMED_LABEL_STATEMENT("named_label_statement"),
    EXIT_STATEMENT("exit_statement"),

    // Expressions
    PARENTHESIZED_EXPRESSION("parenthesized_expression"),
    ASSIGNMENT_EXPRESSION("assignment_expression"),
    REFERENCE_ASSIGNMENT_EXPRESSION("reference_assignment_expression"),
    AUGMENTED_ASSIGNMENT_EXPRESSION("augmented_assignment_expression"),
    BINARY_EXPRESSION("binary_expression"),
    UNARY_OP_EXPRESSION("unary_op_expression"),
    UPDATE_EXPRESSION("update_expression"),
    ERROR_SUPPRESSION_EXPRESSION("error_suppression_expression"),
    CAST_EXPRESSION("cast_expression"),
    CONDITIONAL_EXPRESSION("conditional_expression"),
    FUNCTION_CALL_EXPRESSION("function_call_expression"),
    MEMBER_CALL_EXPRESSION("member_call_expression"),
    NULLSAFE_MEMBER_CALL_EXPRESSION("nullsafe_member_call_expression"),
    SCOPED_CALL_EXPRESSION("scoped_call_expression"),
    MEMBER_ACCESS_EXPRESSION("member_access_expression"),
    NULLSAFE_MEMBER_ACCESS_EXPRESSION("nullsafe_member_access_expression"),
    SCOPED_PROPERTY_ACCESS_EXPRESSION("scoped_property_access_expression"),
    CLASS_CONSTANT_ACCESS_EXPRESSION("class_constant_access_expression"),
    SUBSCRIPT_EXPRESSION("subscript_expression"),
    OBJECT_CREATION_EXPRESSION("object_creation_expression"),
    ANONYMOUS_FUNCTION("anonymous_function"),
    ANONYMOUS_FUNCTION_CREATION_EXPRESSION("anonymous_function_creation_expression"),
    ANONYMOUS_FUNCTION_USE_CLAUSE("anonymous_function_use_clause"),
    ARROW_FUNCTION("arrow_function"),
    MATCH_EXPRESSION("match_expression"),
    MATCH_BLOCK("match_block"),
    MATCH_CONDITIONAL_EXPRESSION("match_conditional_expression"),
    MATCH_DEFAULT_EXPRESSION("match_default_expression"),
    MATCH_CONDITION_LIST("match_condition_list"),
    THROW_EXPRESSION("throw_expression"),
    CLONE_EXPRESSION("clone_expression"),
    PRINT_INTRINSIC("print_intrinsic"),
    INCLUDE_EXPRESSION("include_expression"),
    INCLUDE_ONCE_EXPRESSION("include_once_expression"),
    REQUIRE_EXPRESSION("require_expression"),
    REQUIRE_ONCE_EXPRESSION("require_once_expression"),
    YIELD_EXPRESSION("yield_expression"),
    ARRAY_CREATION_EXPRESSION("array_creation_expression"),
    ARRAY_ELEMENT_INITIALIZER("array_element_initializer"),
    LIST_LITERAL("list_literal"),
    BY_REF("by_ref"),
    VARIADIC_UNPACKING("variadic_unpacking"),
    VARIADIC_PLACEHOLDER("variadic_placeholder"),
    ARGUMENTS("arguments"),
    ARGUMENT("argument"),
    SEQUENCE_EXPRESSION("sequence_expression"),
    PAIR("pair"),

    // Names and literals
    VARIABLE_NAME("variable_name"),
    DYNAMIC_VARIABLE_NAME("dynamic_variable_name"),
    NAME("name"),
    QUALIFIED_NAME("qualified_name"),
    RELATIVE_SCOPE("relative_scope"),
    INTEGER("integer"),
    FLOAT("float"),
    STRING("string"),
    ENCAPSED_STRING("encapsed_string"),
    HEREDOC("heredoc"),
    NOWDOC("nowdoc"),
    STRING_CONTENT("string_content"),
    STRING_VALUE("string_value"),
    ESCAPE_SEQUENCE("escape_sequence"),
    HEREDOC_BODY("heredoc_body"),
    NOWDOC_BODY("nowdoc_body"),
    NOWDOC_STRING("nowdoc_string"),
    BOOLEAN("boolean"),
    NULL("null"),

    UNKNOWN(null);

    public static final String GRAMMAR_VERSION = "tree-sitter-php 0.23";

    private static final Map<String, GrammarKind> BY_TAG = new HashMap<>();

    static {
        for (GrammarKind kind : values()) {
            if (kind.tag != null) {
                BY_TAG.put(kind.tag, kind);
            }
        }
    }

    private final String tag;

    GrammarKind(String tag) {
        this.tag = tag;
    }

    public String getTag() {
        return tag;
    }

    public static GrammarKind fromTag(String tag) {
        if (tag == null) return UNKNOWN;
        return BY_TAG.getOrDefault(tag, UNKNOWN);
    }
}
