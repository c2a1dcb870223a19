package org.pragmatica.scss.tree;

/**
 * Semantic role of a child within its parent node.
 * <p>
 * A role is a named view into the parent's children, not a second owner.
 * List roles ({@link #SELECTORS}, {@link #PARAMETERS}, {@link #ARGUMENTS},
 * {@link #VARIABLES}) refer to a {@link NodeType#NODE_LIST} child.
 */
public enum Role {
    IDENTIFIER,
    VALUE,
    VARIABLE,
    CONDITION,
    ELSE_CLAUSE,
    DEFAULT_VALUE,
    KEY,
    PROPERTY,
    LEFT,
    OPERATOR,
    RIGHT,
    EXPRESSION,
    DECLARATIONS,
    NESTED_PROPERTIES,
    CONTENT,
    KEYWORD,
    NAMES,
    MEDIA_LIST,
    NAMESPACE_PREFIX,
    SELECTORS,
    PARAMETERS,
    ARGUMENTS,
    VARIABLES
}
