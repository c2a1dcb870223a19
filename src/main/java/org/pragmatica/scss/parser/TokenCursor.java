package org.pragmatica.scss.parser;

import org.pragmatica.scss.scanner.Scanner;
import org.pragmatica.scss.scanner.Token;
import org.pragmatica.scss.scanner.TokenType;
import org.pragmatica.scss.tree.SourceSpan;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Mutable cursor over the token stream that tracks state during parsing.
 *
 * <p>Tokens are scanned lazily. A {@link Mark} captures the previous and current token; restoring it
 * repositions the scanner right after the saved current token, so the same tokens are re-lexed on the
 * next advance. End of input is a terminal token: consuming it leaves the cursor on {@code EOF}.
 */
public final class TokenCursor {
    private static final Logger logger = LoggerFactory.getLogger(TokenCursor.class);

    private final Scanner scanner;
    private Token previous;
    private Token current;
    private Token lastErrorToken;

    private TokenCursor(Scanner scanner) {
        this.scanner = scanner;
        this.current = scanner.scan();
    }

    public static TokenCursor create(Scanner scanner) {
        return new TokenCursor(scanner);
    }

    /**
     * Saved cursor state.
     */
    public record Mark(Token previous, Token current, Token lastErrorToken) {}

    // === Position Management ===

    public Token current() {
        return current;
    }

    public Optional<Token> previous() {
        return Optional.ofNullable(previous);
    }

    /**
     * End offset of the last consumed token, or 0 before anything was consumed.
     */
    public int previousEnd() {
        return previous == null
               ? 0
               : previous.end();
    }

    public int offset() {
        return current.offset();
    }

    public boolean isAtEnd() {
        return current.type() == TokenType.EOF;
    }

    public Mark mark() {
        return new Mark(previous, current, lastErrorToken);
    }

    public void restore(Mark mark) {
        previous = mark.previous();
        current = mark.current();
        lastErrorToken = mark.lastErrorToken();
        scanner.goBackTo(current.end());
    }

    /**
     * Whether whitespace or a comment precedes the current token.
     */
    public boolean hasWhitespace() {
        return current.precededByTrivia();
    }

    public Token consume() {
        var consumed = current;
        previous = current;
        current = scanner.scan();
        return consumed;
    }

    public void setInUrl(boolean inUrl) {
        scanner.setInUrl(inUrl);
    }

    // === Lookahead ===

    public boolean peek(TokenType type) {
        return current.type() == type;
    }

    /**
     * Current token is an identifier equal to {@code text}, ignoring case.
     */
    public boolean peekIdent(String text) {
        return current.type() == TokenType.IDENT && text.equalsIgnoreCase(current.text());
    }

    /**
     * Current token is the at-keyword {@code keyword}, ignoring case.
     */
    public boolean peekKeyword(String keyword) {
        return current.type() == TokenType.AT_KEYWORD && keyword.equalsIgnoreCase(current.text());
    }

    public boolean peekDelim(String text) {
        return current.type() == TokenType.DELIM && text.equals(current.text());
    }

    /**
     * Current token has the given type and its text matches {@code pattern}.
     */
    public boolean peekText(TokenType type, Pattern pattern) {
        return current.type() == type && pattern.matcher(current.text())
                                                .find();
    }

    // === Conditional consumption ===

    public boolean accept(TokenType type) {
        if (peek(type)) {
            consume();
            return true;
        }
        return false;
    }

    public boolean acceptIdent(String text) {
        if (peekIdent(text)) {
            consume();
            return true;
        }
        return false;
    }

    public boolean acceptKeyword(String keyword) {
        if (peekKeyword(keyword)) {
            consume();
            return true;
        }
        return false;
    }

    public boolean acceptDelim(String text) {
        if (peekDelim(text)) {
            consume();
            return true;
        }
        return false;
    }

    public boolean acceptText(Pattern pattern) {
        if (pattern.matcher(current.text())
                   .find()) {
            consume();
            return true;
        }
        return false;
    }

    /**
     * Re-scan the current token as an unquoted {@code url(...)} argument and consume it.
     */
    public boolean acceptUnquotedString() {
        var position = scanner.position();
        scanner.goBackTo(current.offset());
        var unquoted = scanner.scanUnquotedString();
        if (unquoted.isPresent()) {
            current = unquoted.get()
                              .withPrecededByTrivia(current.precededByTrivia());
            consume();
            return true;
        }
        scanner.goBackTo(position);
        return false;
    }

    // === Error Tracking ===

    /**
     * Whether the current token has not yet been reported on. Marks it as reported.
     */
    boolean claimErrorToken() {
        if (current.equals(lastErrorToken)) {
            return false;
        }
        lastErrorToken = current;
        return true;
    }

    /**
     * Panic-mode skip. Discards tokens until one in {@code resyncTokens} (consumed), one in
     * {@code stopTokens} (left in place) or end of input.
     *
     * @return the span of discarded tokens, empty if nothing was discarded
     */
    SourceSpan resync(Set<TokenType> resyncTokens, Set<TokenType> stopTokens) {
        var start = current.offset();
        var end = start;
        while (true) {
            if (resyncTokens.contains(current.type())) {
                consume();
                break;
            }
            if (stopTokens.contains(current.type()) || isAtEnd()) {
                break;
            }
            logger.trace("Skipping {} '{}' at {}", current.type(), current.text(), current.offset());
            end = current.end();
            current = scanner.scan();
        }
        return SourceSpan.of(start, end);
    }

    /**
     * Discards a group whose opening token was already consumed: everything up to and including the
     * matching {@code close} token, counting nested {@code openers}. Stops at end of input when the
     * group is unclosed.
     *
     * @return the span of the group content, without the closing token
     */
    SourceSpan skipGroup(Set<TokenType> openers, TokenType close) {
        var start = current.offset();
        var end = start;
        var depth = 1;
        while (!isAtEnd()) {
            if (openers.contains(current.type())) {
                depth++;
            } else if (current.type() == close && --depth == 0) {
                consume();
                break;
            }
            logger.trace("Skipping {} '{}' at {}", current.type(), current.text(), current.offset());
            end = current.end();
            consume();
        }
        return SourceSpan.of(start, end);
    }
}
