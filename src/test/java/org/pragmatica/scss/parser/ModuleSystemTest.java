package org.pragmatica.scss.parser;

import org.junit.jupiter.api.Test;
import org.pragmatica.scss.tree.Node;
import org.pragmatica.scss.tree.NodeType;
import org.pragmatica.scss.tree.ReferenceType;
import org.pragmatica.scss.tree.Role;

import static org.assertj.core.api.Assertions.assertThat;
import static org.pragmatica.scss.parser.Trees.all;
import static org.pragmatica.scss.parser.Trees.assertWellFormed;
import static org.pragmatica.scss.parser.Trees.first;
import static org.pragmatica.scss.parser.Trees.parseScss;
import static org.pragmatica.scss.parser.Trees.text;

class ModuleSystemTest {

    @Test
    void use_withoutClauses_isValid() {
        var result = parseScss("@use 'src/corners';");

        assertWellFormed(result);
        assertThat(result.isSuccess()).isTrue();
        assertThat(first(result.root(), NodeType.USE).identifier()).isEmpty();
    }

    @Test
    void use_withWildcard_hasNoIdentifier() {
        var result = parseScss("@use 'library' as *;");

        assertWellFormed(result);
        assertThat(result.isSuccess()).isTrue();
        assertThat(first(result.root(), NodeType.USE).identifier()).isEmpty();
    }

    @Test
    void use_withConfiguration_collectsParameters() {
        var result = parseScss("@use 'library' with ($black: #222, $border-radius: 0.1rem !default);");

        assertWellFormed(result);
        assertThat(result.isSuccess()).isTrue();

        var parameters = first(result.root(), NodeType.USE).elements(Role.PARAMETERS);
        assertThat(parameters).extracting(Node::type)
                              .containsOnly(NodeType.MODULE_CONFIGURATION);
        assertThat(parameters).extracting(node -> text(result, node.identifier()
                                                                   .orElseThrow()))
                              .containsExactly("$black", "$border-radius");
    }

    @Test
    void use_withAliasAndConfiguration_keepsBoth() {
        var result = parseScss("@use 'library' as lib with ($a: 1);");

        assertWellFormed(result);
        assertThat(result.isSuccess()).isTrue();

        var use = first(result.root(), NodeType.USE);
        assertThat(text(result, use.identifier()
                                   .orElseThrow())).isEqualTo("lib");
        assertThat(use.elements(Role.PARAMETERS)).hasSize(1);
    }

    @Test
    void use_withoutPath_reportsStringLiteralExpected() {
        var result = parseScss("@use foo;");

        assertWellFormed(result);
        assertThat(result.diagnostics()
                         .get(0)
                         .code()).isEqualTo("css-stringliteralexpected");
    }

    @Test
    void use_withUnknownClause_reportsUnknownKeyword() {
        var result = parseScss("@use 'a' foo;");

        assertWellFormed(result);

        var diagnostic = result.diagnostics()
                               .get(0);
        assertThat(diagnostic.code()).isEqualTo("css-unknownkeyword");
        assertThat(diagnostic.span()
                             .offset()).isEqualTo(9);
    }

    @Test
    void use_asWithoutName_reportsIdentifierOrWildcardExpected() {
        var result = parseScss("@use 'a' as;");

        assertWellFormed(result);
        assertThat(result.diagnostics()).extracting(d -> d.code())
                                        .containsExactly("css-idorwildcardexpected");
    }

    @Test
    void use_configurationWithUnknownFlag_reportsUnknownKeyword() {
        var result = parseScss("@use 'a' with ($x: 1 !global);");

        assertWellFormed(result);
        assertThat(result.diagnostics()
                         .get(0)
                         .code()).isEqualTo("css-unknownkeyword");
    }

    @Test
    void use_atEndOfInput_needsNoSemicolon() {
        var result = parseScss("@use 'a'");

        assertWellFormed(result);
        assertThat(result.isSuccess()).isTrue();
    }

    @Test
    void forward_withPrefix_requiresAdjacentWildcard() {
        var result = parseScss("@forward 'src/list' as list-*;");

        assertWellFormed(result);
        assertThat(result.isSuccess()).isTrue();

        var prefix = first(result.root(), NodeType.FORWARD).identifier()
                                                           .orElseThrow();
        assertThat(text(result, prefix)).isEqualTo("list-");
        assertThat(prefix.referenceTypes()).containsExactly(ReferenceType.FORWARD);
    }

    @Test
    void forward_withDetachedWildcard_reportsWildcardExpected() {
        var result = parseScss("@forward 'src/list' as list- *;");

        assertWellFormed(result);
        assertThat(result.diagnostics()
                         .get(0)
                         .code()).isEqualTo("css-wildcardexpected");
    }

    @Test
    void forward_withHide_collectsMembers() {
        var result = parseScss("@forward 'src/list' hide list-reset, $horizontal-list-gap;");

        assertWellFormed(result);
        assertThat(result.isSuccess()).isTrue();

        var visibility = first(result.root(), NodeType.FORWARD_VISIBILITY);
        assertThat(text(result, visibility.identifier()
                                          .orElseThrow())).isEqualTo("hide");
        assertThat(visibility.children()).extracting(node -> text(result, node))
                                         .containsExactly("hide", "list-reset", "$horizontal-list-gap");
    }

    @Test
    void forward_withConfiguration_hasNoVisibility() {
        var result = parseScss("@forward 'a' with ($x: 1 !default);");

        assertWellFormed(result);
        assertThat(result.isSuccess()).isTrue();
        assertThat(all(result.root(), NodeType.FORWARD_VISIBILITY)).isEmpty();
        assertThat(first(result.root(), NodeType.FORWARD).elements(Role.PARAMETERS)).hasSize(1);
    }

    @Test
    void forward_visibilityKeywordWithoutNames_isNotAClause() {
        var result = parseScss("@forward 'a' hide;");

        assertWellFormed(result);
        assertThat(all(result.root(), NodeType.FORWARD_VISIBILITY)).isEmpty();
        assertThat(result.diagnostics()).hasSize(1);

        var diagnostic = result.diagnostics()
                               .get(0);
        assertThat(diagnostic.code()).isEqualTo("css-idorvarexpected");
        assertThat(diagnostic.span()
                             .offset()).isEqualTo(13);
        assertThat(diagnostic.labels()).extracting(label -> label.message())
                                       .containsExactly("skipped");
    }

    @Test
    void forwardVisibility_bareKeyword_consumesNothing() {
        var parser = ScssParser.create("show;");

        assertThat(parser.parseForwardVisibility()).isNull();
        assertThat(parser.cursor.offset()).isZero();
    }

    @Test
    void moduleStatements_followedByRules_parseInOrder() {
        var result = parseScss("""
            @use 'sass:math';
            @forward 'theme' show $primary;
            .a { width: math.div(100%, 3); }
            """);

        assertWellFormed(result);
        assertThat(result.isSuccess()).isTrue();
        assertThat(result.root()
                         .children()).extracting(Node::type)
                                     .containsExactly(NodeType.USE, NodeType.FORWARD, NodeType.RULESET);
    }
}
