package com.raditha.pyopt.ast;

/**
 * The closed set of node kinds in the syntax tree.
 * <p>
 * Passes that dispatch on the kind use switch expressions without a default
 * branch, so adding a constant here fails compilation until every match site
 * handles it.
 */
public enum NodeKind {
    MODULE,

    // statements
    FUNCTION_DEF,
    CLASS_DEF,
    FOR,
    WHILE,
    IF,
    TRY,
    EXCEPT_HANDLER,
    WITH,
    MATCH,
    ASSIGN,
    AUG_ASSIGN,
    ANN_ASSIGN,
    EXPR_STMT,
    RETURN,
    PASS,
    BREAK,
    CONTINUE,
    IMPORT,
    IMPORT_FROM,
    RAISE,
    GLOBAL,
    DELETE,
    ASSERT,

    // match clauses and patterns
    MATCH_CASE,
    MATCH_VALUE,
    MATCH_SINGLETON,
    MATCH_SEQUENCE,
    MATCH_MAPPING,
    MATCH_CLASS,
    MATCH_STAR,
    MATCH_AS,
    MATCH_OR,

    // expressions
    NAME,
    CONSTANT,
    BIN_OP,
    UNARY_OP,
    BOOL_OP,
    COMPARE,
    CALL,
    ATTRIBUTE,
    SUBSCRIPT,
    SLICE,
    TUPLE,
    LIST,
    SET,
    DICT,
    COMPREHENSION,
    IF_EXP,
    LAMBDA,
    STARRED,
    YIELD,
    NAMED_EXPR,
    AWAIT
}
