package org.pragmatica.scss;

import org.pragmatica.scss.parser.Dialect;
import org.pragmatica.scss.parser.ParseResult;
import org.pragmatica.scss.parser.ParserConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * Entry point for parsing style sheets.
 *
 * <p>Example usage:
 * <pre>{@code
 * var result = StyleSheetParser.parse("""
 *     @use "sass:math" as m;
 *     .a { width: m.div(10px, 2); }
 *     """);
 *
 * result.diagnostics().forEach(d -> System.out.println(d.formatSimple()));
 * }</pre>
 */
public final class StyleSheetParser {
    private static final Logger logger = LoggerFactory.getLogger(StyleSheetParser.class);

    private final ParserConfig config;

    private StyleSheetParser(ParserConfig config) {
        this.config = config;
    }

    /**
     * Parse SCSS source text.
     */
    public static ParseResult parse(String source) {
        return parse(source, ParserConfig.DEFAULT);
    }

    /**
     * Parse source text with custom configuration.
     */
    public static ParseResult parse(String source, ParserConfig config) {
        return create(config).parseSource(source);
    }

    public static StyleSheetParser create(ParserConfig config) {
        return new StyleSheetParser(Objects.requireNonNull(config, "config"));
    }

    /**
     * Create a builder for parser configuration.
     */
    public static Builder builder() {
        return new Builder();
    }

    public ParserConfig config() {
        return config;
    }

    /**
     * Parse {@code source}. Never fails on malformed input; problems are reported as diagnostics.
     */
    public ParseResult parseSource(String source) {
        Objects.requireNonNull(source, "source");
        var root = config.dialect()
                         .parser(source)
                         .parseStylesheet();
        var result = ParseResult.of(root, source);
        logger.debug("Parsed {} characters as {}: {} diagnostic(s)",
                     source.length(),
                     config.dialect(),
                     result.diagnostics()
                           .size());
        return result;
    }

    public static final class Builder {
        private Dialect dialect = ParserConfig.DEFAULT.dialect();

        private Builder() {}

        public Builder dialect(Dialect dialect) {
            this.dialect = dialect;
            return this;
        }

        public StyleSheetParser build() {
            return create(new ParserConfig(dialect));
        }
    }
}
