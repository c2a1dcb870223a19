package org.pragmatica.scss.scanner;

/**
 * Scanner for SCSS. Adds variables, interpolation starts, comparison operators, the ellipsis and
 * line comments on top of the CSS token set.
 */
public class ScssScanner extends Scanner {
    public ScssScanner(String input) {
        super(input);
    }

    @Override
    protected Token scanNext(int offset, boolean preceded) {
        if (advanceIfChar('$')) {
            if (ident()) {
                return token(offset, TokenType.VARIABLE_NAME, preceded);
            }
            goBackTo(offset);
        }
        if (advanceIfChars("#{")) {
            return token(offset, TokenType.INTERPOLATION_START, preceded);
        }
        if (advanceIfChars("==")) {
            return token(offset, TokenType.EQUALS_OPERATOR, preceded);
        }
        if (advanceIfChars("!=")) {
            return token(offset, TokenType.NOT_EQUALS_OPERATOR, preceded);
        }
        if (advanceIfChar('<')) {
            var type = advanceIfChar('=')
                       ? TokenType.SMALLER_EQUALS_OPERATOR
                       : TokenType.DELIM;
            return token(offset, type, preceded);
        }
        if (advanceIfChar('>')) {
            var type = advanceIfChar('=')
                       ? TokenType.GREATER_EQUALS_OPERATOR
                       : TokenType.DELIM;
            return token(offset, type, preceded);
        }
        if (advanceIfChars("...")) {
            return token(offset, TokenType.ELLIPSIS, preceded);
        }
        return super.scanNext(offset, preceded);
    }

    @Override
    protected boolean comment() {
        if (super.comment()) {
            return true;
        }
        if (!inUrl() && advanceIfChars("//")) {
            while (!isAtEnd() && peekChar(0) != '\n' && peekChar(0) != '\r' && peekChar(0) != '\f') {
                advance(1);
            }
            return true;
        }
        return false;
    }
}
