package com.examboard.pseudocode.model.syntax;

/**
 * Closed set of syntax tree node kinds shared by the Java and TypeScript parsers.
 *
 * Child layout per kind (optional children are represented by an {@link #EMPTY} node
 * where a fixed slot is needed):
 * <ul>
 *   <li>IF_STATEMENT: condition, then, else (EMPTY when absent)</li>
 *   <li>WHILE_STATEMENT: condition, body; DO_WHILE_STATEMENT: body, condition</li>
 *   <li>FOR_STATEMENT: init, condition, update, body</li>
 *   <li>FOR_EACH_STATEMENT: value is the loop variable; iterable, body</li>
 *   <li>SWITCH_CASE: EXPRESSION_LIST of labels, BLOCK body</li>
 *   <li>METHOD_DECLARATION / CONSTRUCTOR_DECLARATION: PARAMETER..., then BLOCK when a body exists</li>
 *   <li>ASSIGNMENT / BINARY_EXPRESSION: left, right</li>
 *   <li>CALL_EXPRESSION: callee, arguments...</li>
 *   <li>TRY_STATEMENT: BLOCK, CATCH_CLAUSE... (a finally clause is a CATCH_CLAUSE flagged finally)</li>
 * </ul>
 */
public enum SyntaxKind {
    PROGRAM,

    CLASS_DECLARATION,
    INTERFACE_DECLARATION,
    ENUM_DECLARATION,
    TYPE_ALIAS,
    FIELD_DECLARATION,
    METHOD_DECLARATION,
    CONSTRUCTOR_DECLARATION,
    PARAMETER,
    VARIABLE_DECLARATION,
    DECLARATION_GROUP,
    DESTRUCTURING_DECLARATION,

    BLOCK,
    IF_STATEMENT,
    WHILE_STATEMENT,
    DO_WHILE_STATEMENT,
    FOR_STATEMENT,
    FOR_EACH_STATEMENT,
    SWITCH_STATEMENT,
    SWITCH_CASE,
    BREAK_STATEMENT,
    CONTINUE_STATEMENT,
    RETURN_STATEMENT,
    THROW_STATEMENT,
    TRY_STATEMENT,
    CATCH_CLAUSE,
    EXPRESSION_STATEMENT,
    EMPTY,
    UNSUPPORTED,

    ASSIGNMENT,
    BINARY_EXPRESSION,
    UNARY_EXPRESSION,
    UPDATE_EXPRESSION,
    CONDITIONAL_EXPRESSION,
    CALL_EXPRESSION,
    MEMBER_ACCESS,
    INDEX_ACCESS,
    NEW_EXPRESSION,
    NEW_ARRAY,
    ARRAY_LITERAL,
    OBJECT_LITERAL,
    PROPERTY_ASSIGNMENT,
    LITERAL,
    TEMPLATE_LITERAL,
    IDENTIFIER,
    LAMBDA_EXPRESSION,
    CAST_EXPRESSION,
    SPREAD_ELEMENT,
    PARENTHESIZED,
    SEQUENCE_EXPRESSION,
    EXPRESSION_LIST
}
