package org.pragmatica.scss.parser;

import org.pragmatica.scss.tree.Node;

/**
 * A grammar production. Returns the parsed node, or {@code null} when the input does not start with
 * this construct, in which case nothing was consumed.
 */
@FunctionalInterface
public interface Production {
    Node parse();
}
