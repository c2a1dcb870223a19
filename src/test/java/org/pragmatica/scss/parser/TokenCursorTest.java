package org.pragmatica.scss.parser;

import org.junit.jupiter.api.Test;
import org.pragmatica.scss.scanner.Scanner;
import org.pragmatica.scss.scanner.Token;
import org.pragmatica.scss.scanner.TokenType;

import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;

class TokenCursorTest {

    private static TokenCursor cursor(String source) {
        return TokenCursor.create(new Scanner(source));
    }

    @Test
    void previousEnd_isZeroBeforeAnythingIsConsumed() {
        var cursor = cursor("abc def");

        assertThat(cursor.previousEnd()).isZero();
        assertThat(cursor.previous()).isEmpty();

        cursor.consume();

        assertThat(cursor.previousEnd()).isEqualTo(3);
        assertThat(cursor.offset()).isEqualTo(4);
    }

    @Test
    void endOfInput_isTerminal() {
        var cursor = cursor("a");

        cursor.consume();
        assertThat(cursor.isAtEnd()).isTrue();

        cursor.consume();
        assertThat(cursor.isAtEnd()).isTrue();
        assertThat(cursor.offset()).isEqualTo(1);
    }

    @Test
    void restore_rewindsToMarkedToken() {
        var cursor = cursor("a b c");
        var mark = cursor.mark();

        cursor.consume();
        cursor.consume();
        assertThat(cursor.current()
                         .text()).isEqualTo("c");

        cursor.restore(mark);

        assertThat(cursor.current()
                         .text()).isEqualTo("a");
        assertThat(cursor.previousEnd()).isZero();
        cursor.consume();
        assertThat(cursor.current()
                         .text()).isEqualTo("b");
    }

    @Test
    void restore_withoutConsumption_changesNothing() {
        var cursor = cursor("a b");
        cursor.consume();
        var mark = cursor.mark();

        cursor.restore(mark);

        assertThat(cursor.current()
                         .text()).isEqualTo("b");
        assertThat(cursor.previousEnd()).isEqualTo(1);
    }

    @Test
    void acceptIdent_ignoresCase() {
        var cursor = cursor("COLOR red");

        assertThat(cursor.acceptIdent("color")).isTrue();
        assertThat(cursor.acceptIdent("blue")).isFalse();
        assertThat(cursor.peekIdent("RED")).isTrue();
    }

    @Test
    void hasWhitespace_reflectsPrecedingTrivia() {
        var cursor = cursor("a/* c */b  c");

        assertThat(cursor.hasWhitespace()).isFalse();
        cursor.consume();
        assertThat(cursor.hasWhitespace()).isTrue();
        cursor.consume();
        assertThat(cursor.hasWhitespace()).isTrue();
    }

    @Test
    void acceptUnquotedString_consumesWholeUrl() {
        var cursor = cursor("foo.png)");

        assertThat(cursor.acceptUnquotedString()).isTrue();
        assertThat(cursor.previous()
                         .map(Token::text)).contains("foo.png");
        assertThat(cursor.peek(TokenType.PARENTHESIS_R)).isTrue();
    }

    @Test
    void acceptUnquotedString_rejectsClosingParenthesis() {
        var cursor = cursor(")");

        assertThat(cursor.acceptUnquotedString()).isFalse();
        assertThat(cursor.peek(TokenType.PARENTHESIS_R)).isTrue();
    }

    @Test
    void claimErrorToken_reportsEachTokenOnce() {
        var cursor = cursor("a b");

        assertThat(cursor.claimErrorToken()).isTrue();
        assertThat(cursor.claimErrorToken()).isFalse();

        cursor.consume();
        assertThat(cursor.claimErrorToken()).isTrue();
    }

    @Test
    void restore_forgetsClaimsMadeAfterMark() {
        var cursor = cursor("a");
        var mark = cursor.mark();

        cursor.claimErrorToken();
        cursor.restore(mark);

        assertThat(cursor.claimErrorToken()).isTrue();
    }

    @Test
    void resync_consumesSynchronizationToken() {
        var cursor = cursor("a b ; c");

        var skipped = cursor.resync(Set.of(TokenType.SEMICOLON), Set.of());

        assertThat(skipped.offset()).isZero();
        assertThat(skipped.end()).isEqualTo(3);
        assertThat(cursor.current()
                         .text()).isEqualTo("c");
        assertThat(cursor.previous()
                         .map(Token::type)).contains(TokenType.SEMICOLON);
    }

    @Test
    void resync_leavesStopTokenInPlace() {
        var cursor = cursor("a b ; c");

        var skipped = cursor.resync(Set.of(), Set.of(TokenType.SEMICOLON));

        assertThat(skipped.end()).isEqualTo(3);
        assertThat(cursor.peek(TokenType.SEMICOLON)).isTrue();
        assertThat(cursor.previous()).isEmpty();
    }

    @Test
    void resync_onSynchronizationToken_skipsNothing() {
        var cursor = cursor("; a");

        var skipped = cursor.resync(Set.of(TokenType.SEMICOLON), Set.of());

        assertThat(skipped.length()).isZero();
        assertThat(cursor.current()
                         .text()).isEqualTo("a");
    }

    @Test
    void resync_stopsAtEndOfInput() {
        var cursor = cursor("a b");

        var skipped = cursor.resync(Set.of(TokenType.SEMICOLON), Set.of());

        assertThat(skipped.end()).isEqualTo(3);
        assertThat(cursor.isAtEnd()).isTrue();
    }
}
