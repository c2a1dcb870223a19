package org.pragmatica.scss.scanner;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class ScannerTest {

    private static List<Token> tokens(Scanner scanner) {
        var result = new ArrayList<Token>();
        var token = scanner.scan();
        while (token.type() != TokenType.EOF) {
            result.add(token);
            token = scanner.scan();
        }
        return result;
    }

    private static List<TokenType> types(String input) {
        return tokens(new Scanner(input)).stream()
                                         .map(Token::type)
                                         .toList();
    }

    @Test
    void scan_declaration_producesIdentColonIdent() {
        var tokens = tokens(new Scanner("color: red"));

        assertThat(tokens).extracting(Token::type)
                          .containsExactly(TokenType.IDENT, TokenType.COLON, TokenType.IDENT);
        assertThat(tokens.get(0).precededByTrivia()).isFalse();
        assertThat(tokens.get(1).precededByTrivia()).isFalse();
        assertThat(tokens.get(2).precededByTrivia()).isTrue();
        assertThat(tokens.get(2).offset()).isEqualTo(7);
        assertThat(tokens.get(2).text()).isEqualTo("red");
    }

    @Test
    void scan_numbers_distinguishesUnitsAndPercentages() {
        var tokens = tokens(new Scanner("10px 50% 1.5 .5em"));

        assertThat(tokens).extracting(Token::type)
                          .containsExactly(TokenType.DIMENSION, TokenType.PERCENTAGE, TokenType.NUM, TokenType.DIMENSION);
        assertThat(tokens).extracting(Token::text)
                          .containsExactly("10px", "50%", "1.5", ".5em");
    }

    @Test
    void scan_numberWithTwoDots_stopsAtSecondDot() {
        var first = new Scanner("1.2.3").scan();

        assertThat(first.type()).isEqualTo(TokenType.NUM);
        assertThat(first.text()).isEqualTo("1.2");
    }

    @Test
    void scan_atKeywords_recognizesCharset() {
        assertThat(types("@media @charset @")).containsExactly(TokenType.AT_KEYWORD, TokenType.CHARSET, TokenType.DELIM);
    }

    @Test
    void scan_hash_requiresName() {
        assertThat(types("#fff # a")).containsExactly(TokenType.HASH, TokenType.DELIM, TokenType.IDENT);
    }

    @Test
    void scan_strings_reportsUnterminatedLineAsBadString() {
        assertThat(types("\"abc\" 'x\\'y'")).containsExactly(TokenType.STRING, TokenType.STRING);
        assertThat(types("\"abc\nd")).containsExactly(TokenType.BAD_STRING, TokenType.IDENT);
    }

    @Test
    void scan_identifiers_acceptsHyphenPrefixesAndEscapes() {
        var tokens = tokens(new Scanner("--main -moz-box a\\:b _x"));

        assertThat(tokens).extracting(Token::type)
                          .containsOnly(TokenType.IDENT);
        assertThat(tokens).extracting(Token::text)
                          .containsExactly("--main", "-moz-box", "a\\:b", "_x");
    }

    @Test
    void scan_minusBeforeDigit_isDelimiter() {
        assertThat(types("-1")).containsExactly(TokenType.DELIM, TokenType.NUM);
    }

    @Test
    void scan_attributeOperators_producesDedicatedTypes() {
        assertThat(types("~= |= *= ^= $= ="))
            .containsExactly(TokenType.INCLUDES,
                             TokenType.DASHMATCH,
                             TokenType.SUBSTRING_OPERATOR,
                             TokenType.PREFIX_OPERATOR,
                             TokenType.SUFFIX_OPERATOR,
                             TokenType.DELIM);
    }

    @Test
    void scan_punctuation_producesSingleCharacterTokens() {
        assertThat(types("{}[]();:,!"))
            .containsExactly(TokenType.CURLY_L,
                             TokenType.CURLY_R,
                             TokenType.BRACKET_L,
                             TokenType.BRACKET_R,
                             TokenType.PARENTHESIS_L,
                             TokenType.PARENTHESIS_R,
                             TokenType.SEMICOLON,
                             TokenType.COLON,
                             TokenType.COMMA,
                             TokenType.EXCLAMATION);
    }

    @Test
    void scan_htmlCommentMarkers_producesCdoAndCdc() {
        assertThat(types("<!-- a -->")).containsExactly(TokenType.CDO, TokenType.IDENT, TokenType.CDC);
    }

    @Test
    void scan_blockComment_isTrivia() {
        var token = new Scanner("/* note */a").scan();

        assertThat(token.type()).isEqualTo(TokenType.IDENT);
        assertThat(token.offset()).isEqualTo(10);
        assertThat(token.precededByTrivia()).isTrue();
    }

    @Test
    void scan_lineComment_isNotTriviaInPlainCss() {
        assertThat(types("// a")).containsExactly(TokenType.DELIM, TokenType.DELIM, TokenType.IDENT);
    }

    @Test
    void scan_endOfInput_isRepeatable() {
        var scanner = new Scanner("  ");

        var first = scanner.scan();
        var second = scanner.scan();

        assertThat(first.type()).isEqualTo(TokenType.EOF);
        assertThat(first.offset()).isEqualTo(2);
        assertThat(first.precededByTrivia()).isTrue();
        assertThat(second.type()).isEqualTo(TokenType.EOF);
    }

    @Test
    void goBackTo_earlierOffset_relexesSameToken() {
        var scanner = new Scanner("a b");
        scanner.scan();
        var second = scanner.scan();

        scanner.goBackTo(1);

        assertThat(scanner.scan()).isEqualTo(second);
    }

    @Test
    void scanUnquotedString_urlArgument_stopsAtParenthesis() {
        var scanner = new Scanner("foo/bar.png?x=1)");

        var token = scanner.scanUnquotedString();

        assertThat(token).isPresent();
        assertThat(token.get().type()).isEqualTo(TokenType.UNQUOTED_STRING);
        assertThat(token.get().text()).isEqualTo("foo/bar.png?x=1");
        assertThat(scanner.position()).isEqualTo(15);
    }

    @Test
    void scanUnquotedString_atParenthesis_isEmpty() {
        assertThat(new Scanner(")").scanUnquotedString()).isEmpty();
    }

    @Test
    void token_span_coversText() {
        var token = new Scanner("  abc").scan();

        assertThat(token.span().offset()).isEqualTo(2);
        assertThat(token.span().end()).isEqualTo(5);
        assertThat(token.end()).isEqualTo(5);
    }
}
