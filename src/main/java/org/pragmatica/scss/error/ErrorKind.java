package org.pragmatica.scss.error;

/**
 * Closed taxonomy of syntactic errors.
 */
public sealed interface ErrorKind permits ParseError, ScssParseError {
    /**
     * Stable identifier, e.g. {@code css-colonexpected}.
     */
    String code();

    /**
     * Human-readable message.
     */
    String message();
}
