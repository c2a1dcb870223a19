package org.pragmatica.scss.scanner;

/**
 * Token kinds produced by the scanners.
 */
public enum TokenType {
    IDENT,
    AT_KEYWORD,
    STRING,
    BAD_STRING,
    UNQUOTED_STRING,
    HASH,
    NUM,
    PERCENTAGE,
    DIMENSION,
    CDO,
    CDC,
    COLON,
    SEMICOLON,
    CURLY_L,
    CURLY_R,
    PARENTHESIS_L,
    PARENTHESIS_R,
    BRACKET_L,
    BRACKET_R,
    INCLUDES,
    DASHMATCH,
    SUBSTRING_OPERATOR,
    PREFIX_OPERATOR,
    SUFFIX_OPERATOR,
    DELIM,
    EXCLAMATION,
    COMMA,
    CHARSET,
    EOF,

    // SCSS
    VARIABLE_NAME,
    INTERPOLATION_START,
    ELLIPSIS,
    EQUALS_OPERATOR,
    NOT_EQUALS_OPERATOR,
    GREATER_EQUALS_OPERATOR,
    SMALLER_EQUALS_OPERATOR
}
