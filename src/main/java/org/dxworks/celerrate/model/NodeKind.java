package org.dxworks.celerrate.model;

/**
 * Stable node-kind tags. Every tag belongs to exactly one category.
 */
public enum NodeKind {
    SOURCE_FILE("source_file", NodeCategory.FILE),

    NAMESPACE("namespace", NodeCategory.DECLARATION),
    USE_DECLARATION("use_declaration", NodeCategory.DECLARATION),
    CLASS("class", NodeCategory.DECLARATION),
    INTERFACE("interface", NodeCategory.DECLARATION),
    TRAIT("trait", NodeCategory.DECLARATION),
    ENUM("enum", NodeCategory.DECLARATION),
    ENUM_CASE("enum_case", NodeCategory.DECLARATION),
    FUNCTION("function", NodeCategory.DECLARATION),
    METHOD("method", NodeCategory.DECLARATION),
    PROPERTY("property", NodeCategory.DECLARATION),
    PARAMETER("parameter", NodeCategory.DECLARATION),
    CONSTANT("constant", NodeCategory.DECLARATION),
    TRAIT_USE("trait_use", NodeCategory.DECLARATION),
    UNKNOWN_DECLARATION("unknown_declaration", NodeCategory.DECLARATION),

    BLOCK("block", NodeCategory.STATEMENT),
    EXPRESSION_STATEMENT("expression_statement", NodeCategory.STATEMENT),
    ECHO("echo", NodeCategory.STATEMENT),
    RETURN("return", NodeCategory.STATEMENT),
    IF("if", NodeCategory.STATEMENT),
    WHILE("while", NodeCategory.STATEMENT),
    DO_WHILE("do_while", NodeCategory.STATEMENT),
    FOR("for", NodeCategory.STATEMENT),
    FOREACH("foreach", NodeCategory.STATEMENT),
    SWITCH("switch", NodeCategory.STATEMENT),
    BREAK("break", NodeCategory.STATEMENT),
    CONTINUE("continue", NodeCategory.STATEMENT),
    TRY("try", NodeCategory.STATEMENT),
    GLOBAL("global", NodeCategory.STATEMENT),
    STATIC_VARIABLES("static_variables", NodeCategory.STATEMENT),
    UNSET("unset", NodeCategory.STATEMENT),
    INLINE_HTML("inline_html", NodeCategory.STATEMENT),
    DECLARE("declare", NodeCategory.STATEMENT),
    GOTO("goto", NodeCategory.STATEMENT),
    LABEL("label", NodeCategory.STATEMENT),
    UNKNOWN_STATEMENT("unknown_statement", NodeCategory.STATEMENT),

    ELSE_IF("else_if", NodeCategory.CLAUSE),
    SWITCH_CASE("switch_case", NodeCategory.CLAUSE),
    CATCH("catch", NodeCategory.CLAUSE),
    ARGUMENT("argument", NodeCategory.CLAUSE),
    ARRAY_ELEMENT("array_element", NodeCategory.CLAUSE),
    MATCH_ARM("match_arm", NodeCategory.CLAUSE),
    CLOSURE_USE("closure_use", NodeCategory.CLAUSE),
    USE_ITEM("use_item", NodeCategory.CLAUSE),
    STATIC_VARIABLE("static_variable", NodeCategory.CLAUSE),

    VARIABLE("variable", NodeCategory.EXPRESSION),
    NAME("name", NodeCategory.EXPRESSION),
    INTEGER("integer", NodeCategory.EXPRESSION),
    FLOAT("float", NodeCategory.EXPRESSION),
    STRING("string", NodeCategory.EXPRESSION),
    INTERPOLATED_STRING("interpolated_string", NodeCategory.EXPRESSION),
    BOOLEAN("boolean", NodeCategory.EXPRESSION),
    NULL("null", NodeCategory.EXPRESSION),
    ARRAY("array", NodeCategory.EXPRESSION),
    LIST("list", NodeCategory.EXPRESSION),
    ASSIGNMENT("assignment", NodeCategory.EXPRESSION),
    BINARY("binary", NodeCategory.EXPRESSION),
    UNARY("unary", NodeCategory.EXPRESSION),
    CAST("cast", NodeCategory.EXPRESSION),
    TERNARY("ternary", NodeCategory.EXPRESSION),
    FUNCTION_CALL("function_call", NodeCategory.EXPRESSION),
    METHOD_CALL("method_call", NodeCategory.EXPRESSION),
    STATIC_CALL("static_call", NodeCategory.EXPRESSION),
    PROPERTY_FETCH("property_fetch", NodeCategory.EXPRESSION),
    STATIC_PROPERTY_FETCH("static_property_fetch", NodeCategory.EXPRESSION),
    CLASS_CONSTANT_FETCH("class_constant_fetch", NodeCategory.EXPRESSION),
    ARRAY_ACCESS("array_access", NodeCategory.EXPRESSION),
    NEW("new", NodeCategory.EXPRESSION),
    CLOSURE("closure", NodeCategory.EXPRESSION),
    ARROW_FUNCTION("arrow_function", NodeCategory.EXPRESSION),
    MATCH("match", NodeCategory.EXPRESSION),
    THROW("throw", NodeCategory.EXPRESSION),
    INTRINSIC("intrinsic", NodeCategory.EXPRESSION),
    YIELD("yield", NodeCategory.EXPRESSION),
    UNKNOWN_EXPRESSION("unknown_expression", NodeCategory.EXPRESSION);

    private final String tag;
    private final NodeCategory category;

    NodeKind(String tag, NodeCategory category) {
        this.tag = tag;
        this.category = category;
    }

    public String getTag() {
        return tag;
    }

    public NodeCategory getCategory() {
        return category;
    }
}
