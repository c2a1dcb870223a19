package org.pragmatica.scss.parser;

import org.pragmatica.scss.tree.Node;
import org.pragmatica.scss.tree.NodeType;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tree queries and structural checks shared by parser tests.
 */
final class Trees {
    private Trees() {}

    static ParseResult parseScss(String source) {
        return ParseResult.of(ScssParser.create(source)
                                        .parseStylesheet(), source);
    }

    static ParseResult parseCss(String source) {
        return ParseResult.of(CssParser.create(source)
                                       .parseStylesheet(), source);
    }

    static List<Node> all(Node root, NodeType type) {
        var result = new ArrayList<Node>();
        root.walk(node -> {
            if (node.type() == type) {
                result.add(node);
            }
            return true;
        });
        return result;
    }

    static Node first(Node root, NodeType type) {
        var found = all(root, type);
        assertThat(found).as("nodes of type %s", type)
                         .isNotEmpty();
        return found.get(0);
    }

    static String text(ParseResult result, Node node) {
        return node.text(result.source());
    }

    /**
     * Root spans the source, parent links are consistent, children lie within their parents and
     * siblings follow each other without overlapping.
     */
    static void assertWellFormed(ParseResult result) {
        var root = result.root();
        var length = result.source()
                           .length();
        assertThat(root.type()).isEqualTo(NodeType.STYLESHEET);
        assertThat(root.offset()).isZero();
        assertThat(root.length()).isEqualTo(length);
        root.walk(node -> {
            assertThat(node.offset()).as("offset of %s", node)
                                     .isGreaterThanOrEqualTo(0);
            assertThat(node.end()).as("end of %s", node)
                                  .isLessThanOrEqualTo(length);
            var siblingEnd = node.offset();
            for (var child : node.children()) {
                assertThat(child.parent()).as("parent of %s", child)
                                          .containsSame(node);
                assertThat(child.offset()).as("start of %s in %s", child, node)
                                          .isGreaterThanOrEqualTo(siblingEnd);
                assertThat(child.end()).as("end of %s in %s", child, node)
                                       .isLessThanOrEqualTo(node.end());
                siblingEnd = child.end();
            }
            return true;
        });
        var previous = 0;
        for (var diagnostic : result.diagnostics()) {
            assertThat(diagnostic.span()
                                 .offset()).isGreaterThanOrEqualTo(previous);
            assertThat(diagnostic.span()
                                 .end()).isLessThanOrEqualTo(length);
            previous = diagnostic.span()
                                 .offset();
        }
    }
}
