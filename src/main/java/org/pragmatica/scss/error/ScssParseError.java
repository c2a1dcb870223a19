package org.pragmatica.scss.error;

/**
 * Errors only the SCSS dialect reports.
 */
public enum ScssParseError implements ErrorKind {
    FROM_EXPECTED("scss-fromexpected", "'from' expected"),
    THROUGH_OR_TO_EXPECTED("scss-throughexpected", "'through' or 'to' expected"),
    IN_EXPECTED("scss-inexpected", "'in' expected");

    private final String code;
    private final String message;

    ScssParseError(String code, String message) {
        this.code = code;
        this.message = message;
    }

    @Override
    public String code() {
        return code;
    }

    @Override
    public String message() {
        return message;
    }
}
