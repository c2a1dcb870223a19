package org.pragmatica.scss.parser;

import org.junit.jupiter.api.Test;
import org.pragmatica.scss.tree.Node;
import org.pragmatica.scss.tree.NodeType;
import org.pragmatica.scss.tree.Role;

import static org.assertj.core.api.Assertions.assertThat;
import static org.pragmatica.scss.parser.Trees.all;
import static org.pragmatica.scss.parser.Trees.assertWellFormed;
import static org.pragmatica.scss.parser.Trees.first;
import static org.pragmatica.scss.parser.Trees.parseScss;
import static org.pragmatica.scss.parser.Trees.text;

class ControlFlowTest {

    @Test
    void ifElseIfElse_chainsThroughElseClauses() {
        var result = parseScss("@if $a { a: 1; } @else if $b { b: 2; } @else { c: 3; }");

        assertWellFormed(result);
        assertThat(result.isSuccess()).isTrue();

        var outer = result.root()
                          .children()
                          .get(0);
        var elseIf = outer.get(Role.ELSE_CLAUSE)
                          .orElseThrow();
        assertThat(elseIf.type()).isEqualTo(NodeType.IF_STATEMENT);
        assertThat(text(result, elseIf.get(Role.CONDITION)
                                      .orElseThrow())).isEqualTo("$b");

        var last = elseIf.get(Role.ELSE_CLAUSE)
                         .orElseThrow();
        assertThat(last.type()).isEqualTo(NodeType.ELSE_CLAUSE);
        assertThat(last.get(Role.ELSE_CLAUSE)).isEmpty();
    }

    @Test
    void if_withoutElse_hasNoElseClause() {
        var result = parseScss(".a { @if $dark { color: white; } color: black; }");

        assertWellFormed(result);
        assertThat(result.isSuccess()).isTrue();
        assertThat(first(result.root(), NodeType.IF_STATEMENT).get(Role.ELSE_CLAUSE)).isEmpty();
        assertThat(all(result.root(), NodeType.DECLARATION)).hasSize(2);
    }

    @Test
    void if_withoutCondition_reportsExpressionExpected() {
        var result = parseScss("@if { }");

        assertWellFormed(result);
        assertThat(result.diagnostics()).extracting(d -> d.code())
                                        .containsExactly("css-expressionexpected");
    }

    @Test
    void for_withThrough_parsesVariableBoundsAndBody() {
        var result = parseScss("@for $i from 1 through 3 { .item-#{$i} { width: 2em * $i; } }");

        assertWellFormed(result);
        assertThat(result.isSuccess()).isTrue();

        var loop = result.root()
                         .children()
                         .get(0);
        assertThat(loop.type()).isEqualTo(NodeType.FOR_STATEMENT);
        assertThat(text(result, loop.get(Role.VARIABLE)
                                    .orElseThrow())).isEqualTo("$i");
        assertThat(all(loop, NodeType.BINARY_EXPRESSION)).isNotEmpty();
        assertThat(all(loop, NodeType.RULESET)).hasSize(1);
    }

    @Test
    void for_withTo_parsesCleanly() {
        var result = parseScss("@for $i from 0 to $n { }");

        assertWellFormed(result);
        assertThat(result.isSuccess()).isTrue();
    }

    @Test
    void for_withoutFrom_reportsFromExpected() {
        var result = parseScss("@for $i to 3 { }");

        assertWellFormed(result);
        assertThat(result.diagnostics()).extracting(d -> d.code())
                                        .containsExactly("scss-fromexpected");
    }

    @Test
    void for_withoutToOrThrough_reportsThroughOrToExpected() {
        var result = parseScss("@for $i from 1 { }");

        assertWellFormed(result);
        assertThat(result.diagnostics()).extracting(d -> d.code())
                                        .containsExactly("scss-throughexpected");
    }

    @Test
    void for_withoutVariable_reportsVariableNameExpected() {
        var result = parseScss("@for from 1 to 2 { }");

        assertWellFormed(result);
        assertThat(result.diagnostics()).extracting(d -> d.code())
                                        .containsExactly("css-varnameexpected");
    }

    @Test
    void each_withSeveralVariables_collectsThem() {
        var result = parseScss("@each $key, $value in $map { .#{$key} { color: $value; } }");

        assertWellFormed(result);
        assertThat(result.isSuccess()).isTrue();

        var loop = result.root()
                         .children()
                         .get(0);
        assertThat(loop.type()).isEqualTo(NodeType.EACH_STATEMENT);
        assertThat(loop.elements(Role.VARIABLES)).extracting(node -> text(result, node))
                                                 .containsExactly("$key", "$value");
    }

    @Test
    void each_withoutIn_reportsInExpected() {
        var result = parseScss("@each $x of $list { }");

        assertWellFormed(result);
        assertThat(result.diagnostics()).extracting(d -> d.code())
                                        .containsExactly("scss-inexpected");
        assertThat(result.diagnostics()
                         .get(0)
                         .span()
                         .offset()).isEqualTo(9);
    }

    @Test
    void while_withComparison_parsesBody() {
        var result = parseScss("@while $i > 0 { $i: $i - 1; }");

        assertWellFormed(result);
        assertThat(result.isSuccess()).isTrue();

        var loop = result.root()
                         .children()
                         .get(0);
        assertThat(loop.type()).isEqualTo(NodeType.WHILE_STATEMENT);
        assertThat(all(loop, NodeType.VARIABLE_DECLARATION)).hasSize(1);
    }

    @Test
    void functionBody_allowsReturnAndControlFlow() {
        var result = parseScss("""
            @function clamp-to($n, $max: 10) {
              $limit: $max;
              @if $n > $limit {
                @return $limit;
              }
              @warn "in range";
              @return $n;
            }
            """);

        assertWellFormed(result);
        assertThat(result.isSuccess()).isTrue();

        var function = result.root()
                             .children()
                             .get(0);
        assertThat(function.type()).isEqualTo(NodeType.FUNCTION_DECLARATION);
        assertThat(function.elements(Role.PARAMETERS)).hasSize(2);
        assertThat(all(function, NodeType.RETURN_STATEMENT)).hasSize(2);
        assertThat(function.elements(Role.DECLARATIONS)).extracting(Node::type)
                                                        .containsExactly(NodeType.VARIABLE_DECLARATION,
                                                                         NodeType.IF_STATEMENT,
                                                                         NodeType.DEBUG,
                                                                         NodeType.RETURN_STATEMENT);
    }

    @Test
    void functionBody_rejectsRuleset() {
        var result = parseScss("@function f() { .a { } }");

        assertWellFormed(result);
        assertThat(result.diagnostics()
                         .get(0)
                         .code()).isEqualTo("css-rcurlyexpected");
        assertThat(all(result.root(), NodeType.RULESET)).isEmpty();
    }

    @Test
    void return_withoutExpression_reportsExpressionExpected() {
        var result = parseScss("@function f() { @return; }");

        assertWellFormed(result);
        assertThat(result.diagnostics()).extracting(d -> d.code())
                                        .containsExactly("css-expressionexpected");
    }

    @Test
    void controlFlow_insideKeyframes_wrapsKeyframeSelectors() {
        var result = parseScss("@keyframes pulse { @for $i from 0 through 2 { #{$i * 50%} { opacity: 1; } } }");

        assertWellFormed(result);
        assertThat(result.isSuccess()).isTrue();
        assertThat(first(result.root(), NodeType.FOR_STATEMENT).parent()
                                                               .map(Node::type)).contains(NodeType.DECLARATIONS);
    }
}
