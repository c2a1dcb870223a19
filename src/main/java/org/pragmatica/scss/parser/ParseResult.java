package org.pragmatica.scss.parser;

import org.pragmatica.scss.error.Diagnostic;
import org.pragmatica.scss.tree.Node;

import java.util.List;

/**
 * Result of parsing a style sheet.
 *
 * <p>The tree is always present. Malformed input yields a best-effort tree with erroneous nodes, and
 * their diagnostics are collected in {@code diagnostics} in source order.
 *
 * @param root        The stylesheet node spanning the whole source
 * @param diagnostics Diagnostics of all nodes in the tree (empty on full success)
 * @param source      The parsed source text (for formatting diagnostics)
 */
public record ParseResult(Node root, List<Diagnostic> diagnostics, String source) {
    public ParseResult {
        diagnostics = List.copyOf(diagnostics);
    }

    public static ParseResult of(Node root, String source) {
        return new ParseResult(root, root.collectDiagnostics(), source);
    }

    /**
     * Check if parsing succeeded without any errors.
     */
    public boolean isSuccess() {
        return diagnostics.isEmpty();
    }

    public boolean hasErrors() {
        return !diagnostics.isEmpty();
    }

    /**
     * Format all diagnostics, one per line.
     */
    public String formatDiagnostics() {
        if (diagnostics.isEmpty()) {
            return "";
        }
        var sb = new StringBuilder();
        for (var diag : diagnostics) {
            sb.append(diag.formatSimple());
            sb.append("\n");
        }
        return sb.toString();
    }
}
