package org.pragmatica.scss.parser;

import java.util.Objects;

/**
 * Parser configuration options.
 */
public record ParserConfig(Dialect dialect) {
    public static final ParserConfig DEFAULT = new ParserConfig(Dialect.SCSS);
    public static final ParserConfig CSS = new ParserConfig(Dialect.CSS);

    public ParserConfig {
        Objects.requireNonNull(dialect, "dialect");
    }
}
