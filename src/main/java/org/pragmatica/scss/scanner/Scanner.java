package org.pragmatica.scss.scanner;

import java.util.Objects;
import java.util.Optional;

/**
 * Scanner for plain CSS.
 *
 * <p>Produces one token per {@link #scan()} call, skipping whitespace and comments and recording
 * whether any were skipped. The scanner can be repositioned with {@link #goBackTo(int)}, which lets a
 * parser re-lex from any earlier token offset. After the end of input every call returns {@code EOF}.
 */
public class Scanner {
    private static final char EOS = '\0';

    private final String input;
    private int pos;
    private boolean inUrl;

    public Scanner(String input) {
        this.input = Objects.requireNonNull(input, "input");
        this.pos = 0;
    }

    public Token scan() {
        var start = pos;
        skipTrivia();
        var preceded = pos > start;
        var offset = pos;
        if (isAtEnd()) {
            return token(offset, TokenType.EOF, preceded);
        }
        return scanNext(offset, preceded);
    }

    /**
     * Scan an unquoted {@code url(...)} argument at the current position, without skipping trivia.
     */
    public Optional<Token> scanUnquotedString() {
        var offset = pos;
        while (unquotedChar() || escape()) {
            // consume
        }
        if (pos == offset) {
            return Optional.empty();
        }
        return Optional.of(token(offset, TokenType.UNQUOTED_STRING, false));
    }

    public int position() {
        return pos;
    }

    public void goBackTo(int position) {
        this.pos = position;
    }

    public boolean inUrl() {
        return inUrl;
    }

    public void setInUrl(boolean inUrl) {
        this.inUrl = inUrl;
    }

    public String input() {
        return input;
    }

    protected Token scanNext(int offset, boolean preceded) {
        // CDO <!--
        if (advanceIfChars("<!--")) {
            return token(offset, TokenType.CDO, preceded);
        }
        // CDC -->
        if (advanceIfChars("-->")) {
            return token(offset, TokenType.CDC, preceded);
        }
        if (ident()) {
            return token(offset, TokenType.IDENT, preceded);
        }
        // at-keyword
        if (advanceIfChar('@')) {
            if (name()) {
                var type = "@charset".equals(input.substring(offset, pos))
                           ? TokenType.CHARSET
                           : TokenType.AT_KEYWORD;
                return token(offset, type, preceded);
            }
            return token(offset, TokenType.DELIM, preceded);
        }
        // hash
        if (advanceIfChar('#')) {
            if (name()) {
                return token(offset, TokenType.HASH, preceded);
            }
            return token(offset, TokenType.DELIM, preceded);
        }
        if (advanceIfChar('!')) {
            return token(offset, TokenType.EXCLAMATION, preceded);
        }
        if (number()) {
            if (advanceIfChar('%')) {
                return token(offset, TokenType.PERCENTAGE, preceded);
            }
            if (ident()) {
                return token(offset, TokenType.DIMENSION, preceded);
            }
            return token(offset, TokenType.NUM, preceded);
        }
        var stringType = string();
        if (stringType != null) {
            return token(offset, stringType, preceded);
        }
        var single = singleCharToken(peekChar(0));
        if (single != null) {
            advance(1);
            return token(offset, single, preceded);
        }
        if (peekChar(1) == '=') {
            var operator = switch (peekChar(0)) {
                case '~' -> TokenType.INCLUDES;
                case '|' -> TokenType.DASHMATCH;
                case '*' -> TokenType.SUBSTRING_OPERATOR;
                case '^' -> TokenType.PREFIX_OPERATOR;
                case '$' -> TokenType.SUFFIX_OPERATOR;
                default -> null;
            };
            if (operator != null) {
                advance(2);
                return token(offset, operator, preceded);
            }
        }
        advance(Character.charCount(input.codePointAt(pos)));
        return token(offset, TokenType.DELIM, preceded);
    }

    protected final Token token(int offset, TokenType type, boolean preceded) {
        return new Token(type, input.substring(offset, pos), offset, pos - offset, preceded);
    }

    // === Trivia ===

    private void skipTrivia() {
        while (whitespace() || comment()) {
            // skip
        }
    }

    private boolean whitespace() {
        var start = pos;
        while (isWhitespace(peekChar(0))) {
            pos++;
        }
        return pos > start;
    }

    protected boolean comment() {
        if (advanceIfChars("/*")) {
            var closed = input.indexOf("*/", pos);
            pos = closed < 0
                  ? input.length()
                  : closed + 2;
            return true;
        }
        return false;
    }

    // === Lexical rules ===

    protected final boolean ident() {
        var start = pos;
        if (minus()) {
            if (minus() || identFirstChar() || escape()) {
                while (identChar() || escape()) {
                    // consume
                }
                return true;
            }
        } else if (identFirstChar() || escape()) {
            while (identChar() || escape()) {
                // consume
            }
            return true;
        }
        pos = start;
        return false;
    }

    private boolean name() {
        var start = pos;
        while (identChar() || escape()) {
            // consume
        }
        return pos > start;
    }

    private boolean minus() {
        return advanceIfChar('-');
    }

    private boolean identFirstChar() {
        var ch = peekChar(0);
        if (ch == '_' || isLetter(ch) || ch >= 0x80) {
            pos++;
            return true;
        }
        return false;
    }

    private boolean identChar() {
        var ch = peekChar(0);
        if (ch == '_' || ch == '-' || isLetter(ch) || isDigit(ch) || ch >= 0x80) {
            pos++;
            return true;
        }
        return false;
    }

    private boolean escape() {
        if (peekChar(0) != '\\') {
            return false;
        }
        var next = peekChar(1);
        if (next == EOS || next == '\n' || next == '\r' || next == '\f') {
            return false;
        }
        pos++;
        var hexDigits = 0;
        while (hexDigits < 6 && isHexDigit(peekChar(0))) {
            pos++;
            hexDigits++;
        }
        if (hexDigits == 0) {
            pos++;
        } else if (peekChar(0) == '\r' && peekChar(1) == '\n') {
            pos += 2;
        } else if (isWhitespace(peekChar(0))) {
            pos++;
        }
        return true;
    }

    private boolean number() {
        var lookahead = peekChar(0) == '.'
                        ? 1
                        : 0;
        if (!isDigit(peekChar(lookahead))) {
            return false;
        }
        pos += lookahead + 1;
        var fraction = lookahead == 1;
        while (true) {
            if (isDigit(peekChar(0))) {
                pos++;
            } else if (!fraction && peekChar(0) == '.' && isDigit(peekChar(1))) {
                fraction = true;
                pos++;
            } else {
                return true;
            }
        }
    }

    private TokenType string() {
        var quote = peekChar(0);
        if (quote != '"' && quote != '\'') {
            return null;
        }
        pos++;
        while (!isAtEnd()) {
            var ch = peekChar(0);
            if (ch == quote) {
                pos++;
                return TokenType.STRING;
            }
            if (ch == '\\') {
                if (peekChar(1) == '\r' && peekChar(2) == '\n') {
                    pos += 3;
                } else {
                    pos = Math.min(pos + 2, input.length());
                }
                continue;
            }
            if (ch == '\n' || ch == '\r' || ch == '\f') {
                return TokenType.BAD_STRING;
            }
            pos++;
        }
        return TokenType.BAD_STRING;
    }

    private boolean unquotedChar() {
        var ch = peekChar(0);
        switch (ch) {
            case EOS, '\\', '"', '\'', '(', ')', ' ', '\t', '\n', '\f', '\r':
                return false;
            default:
                pos++;
                return true;
        }
    }

    private static TokenType singleCharToken(char ch) {
        return switch (ch) {
            case ';' -> TokenType.SEMICOLON;
            case ':' -> TokenType.COLON;
            case '{' -> TokenType.CURLY_L;
            case '}' -> TokenType.CURLY_R;
            case '[' -> TokenType.BRACKET_L;
            case ']' -> TokenType.BRACKET_R;
            case '(' -> TokenType.PARENTHESIS_L;
            case ')' -> TokenType.PARENTHESIS_R;
            case ',' -> TokenType.COMMA;
            default -> null;
        };
    }

    // === Character access ===

    protected final boolean isAtEnd() {
        return pos >= input.length();
    }

    protected final char peekChar(int offset) {
        var index = pos + offset;
        return index < input.length()
               ? input.charAt(index)
               : EOS;
    }

    protected final void advance(int count) {
        pos = Math.min(pos + count, input.length());
    }

    protected final boolean advanceIfChar(char ch) {
        if (!isAtEnd() && input.charAt(pos) == ch) {
            pos++;
            return true;
        }
        return false;
    }

    protected final boolean advanceIfChars(String chars) {
        if (input.startsWith(chars, pos)) {
            pos += chars.length();
            return true;
        }
        return false;
    }

    private static boolean isWhitespace(char c) {
        return c == ' ' || c == '\t' || c == '\n' || c == '\r' || c == '\f';
    }

    private static boolean isLetter(char c) {
        return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z');
    }

    private static boolean isDigit(char c) {
        return c >= '0' && c <= '9';
    }

    private static boolean isHexDigit(char c) {
        return isDigit(c) || (c >= 'a' && c <= 'f') || (c >= 'A' && c <= 'F');
    }
}
