package com.examboard.pseudocode.model.syntax;

import lombok.experimental.UtilityClass;

/**
 * Attribute keys used on {@link SyntaxNode}s.
 */
@UtilityClass
public class SyntaxAttributes {
    public static final String OPERATOR = "operator";
    public static final String TYPE = "type";
    public static final String RETURN_TYPE = "returnType";
    public static final String MODIFIERS = "modifiers";
    public static final String LITERAL_TYPE = "literalType";
    public static final String FEATURE = "feature";
    public static final String SUGGESTION = "suggestion";
    public static final String EXTENDS = "extends";
    public static final String IMPLEMENTS = "implements";
    public static final String TYPE_PARAMETERS = "typeParameters";
    public static final String DECLARATION_KIND = "declarationKind";
    public static final String OPTIONAL = "optional";
    public static final String REST = "rest";
    public static final String PREFIX = "prefix";
    public static final String DEFAULT = "default";
    public static final String ARROW = "arrow";
    public static final String FINALLY = "finally";
    public static final String ITERATION = "iteration";
    public static final String PATTERN = "pattern";
    public static final String PROPERTY = "property";
    public static final String ASYNC = "async";
    public static final String ABSTRACT = "abstract";
    public static final String TEMPLATE_PART = "templatePart";
    public static final String ACCESSOR = "accessor";
    public static final String INDEX_SIGNATURE = "indexSignature";
    public static final String OPTIONAL_CHAIN = "optionalChain";

    public static final String LITERAL_INTEGER = "integer";
    public static final String LITERAL_DECIMAL = "decimal";
    public static final String LITERAL_STRING = "string";
    public static final String LITERAL_CHAR = "char";
    public static final String LITERAL_BOOLEAN = "boolean";
    public static final String LITERAL_NULL = "null";
}
