package org.pragmatica.scss.tree;

/**
 * Syntactic category of a parse-tree node.
 */
public enum NodeType {
    /** Grammar-transparent grouping (parenthesized operation, unary operator, url argument). */
    UNDEFINED,
    /** Ordered container behind a list role. */
    NODE_LIST,

    STYLESHEET,
    CHARSET,
    IDENTIFIER,
    RULESET,
    SELECTOR,
    SIMPLE_SELECTOR,
    SELECTOR_COMBINATOR,
    SELECTOR_COMBINATOR_PARENT,
    SELECTOR_COMBINATOR_SIBLING,
    SELECTOR_COMBINATOR_ALL_SIBLINGS,
    SELECTOR_COMBINATOR_SHADOW_PIERCING_DESCENDANT,
    SELECTOR_PLACEHOLDER,
    CLASS_SELECTOR,
    IDENTIFIER_SELECTOR,
    ELEMENT_NAME_SELECTOR,
    PSEUDO_SELECTOR,
    ATTRIBUTE_SELECTOR,
    NAMESPACE_PREFIX,

    DECLARATIONS,
    DECLARATION,
    CUSTOM_PROPERTY_DECLARATION,
    PROPERTY,
    NESTED_PROPERTIES,
    PRIO,

    EXPRESSION,
    BINARY_EXPRESSION,
    TERM,
    OPERATOR,
    STRING_LITERAL,
    URI_LITERAL,
    FUNCTION,
    NUMERIC_VALUE,
    HEX_COLOR_VALUE,
    RATIO_VALUE,
    GRID_LINE,
    LIST_ENTRY,

    VARIABLE,
    VARIABLE_DECLARATION,
    INTERPOLATION,
    MODULE,

    MIXIN_DECLARATION,
    MIXIN_REFERENCE,
    MIXIN_CONTENT_REFERENCE,
    MIXIN_CONTENT_DECLARATION,
    FUNCTION_DECLARATION,
    FUNCTION_PARAMETER,
    FUNCTION_ARGUMENT,
    RETURN_STATEMENT,

    IF_STATEMENT,
    ELSE_CLAUSE,
    FOR_STATEMENT,
    EACH_STATEMENT,
    WHILE_STATEMENT,
    DEBUG,
    EXTENDS_REFERENCE,

    USE,
    FORWARD,
    FORWARD_VISIBILITY,
    MODULE_CONFIGURATION,

    IMPORT,
    MEDIA,
    MEDIA_QUERY_LIST,
    MEDIA_QUERY,
    MEDIA_CONDITION,
    MEDIA_FEATURE,
    SUPPORTS,
    SUPPORTS_CONDITION,
    LAYER,
    LAYER_NAME_LIST,
    LAYER_NAME,
    PROPERTY_AT_RULE,
    FONT_FACE,
    KEYFRAME,
    KEYFRAME_SELECTOR,
    PAGE,
    PAGE_BOX_MARGIN_BOX,
    UNKNOWN_AT_RULE
}
