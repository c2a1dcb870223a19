package org.pragmatica.scss.parser;

/**
 * Style sheet language accepted by the parser.
 */
public enum Dialect {
    CSS,
    SCSS;

    /**
     * Grammar for this dialect over {@code source}.
     */
    public CssParser parser(String source) {
        return switch (this) {
            case CSS -> CssParser.create(source);
            case SCSS -> ScssParser.create(source);
        };
    }
}
