package org.pragmatica.scss.error;

import org.pragmatica.scss.tree.SourceSpan;

import java.util.ArrayList;
import java.util.List;

/**
 * Syntactic diagnostic attached to a parse-tree node.
 *
 * @param severity Error severity level
 * @param kind     Error kind from the closed taxonomy
 * @param message  Primary error message
 * @param span     The offending token
 * @param labels   Additional labeled spans, e.g. input skipped during recovery
 */
public record Diagnostic(
    Severity severity,
    ErrorKind kind,
    String message,
    SourceSpan span,
    List<Label> labels
) {
    /**
     * Error severity levels.
     */
    public enum Severity {
        ERROR("error");

        private final String display;

        Severity(String display) {
            this.display = display;
        }

        public String display() {
            return display;
        }
    }

    /**
     * A labeled span providing additional context.
     *
     * @param span    Source span for this label
     * @param message Label message
     */
    public record Label(SourceSpan span, String message) {}

    /**
     * Create an error diagnostic for the given kind.
     */
    public static Diagnostic error(ErrorKind kind, SourceSpan span) {
        return new Diagnostic(Severity.ERROR, kind, kind.message(), span, List.of());
    }

    /**
     * Add a secondary label at a different span.
     */
    public Diagnostic withSecondaryLabel(SourceSpan labelSpan, String labelMessage) {
        var newLabels = new ArrayList<>(labels);
        newLabels.add(new Label(labelSpan, labelMessage));
        return new Diagnostic(severity, kind, message, span, List.copyOf(newLabels));
    }

    public String code() {
        return kind.code();
    }

    /**
     * Simple single-line format for quick display.
     */
    public String formatSimple() {
        return String.format("%d:%d: %s[%s]: %s", span.offset(), span.end(), severity.display(), kind.code(), message);
    }
}
