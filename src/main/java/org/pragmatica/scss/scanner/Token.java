package org.pragmatica.scss.scanner;

import org.pragmatica.scss.tree.SourceSpan;

/**
 * Immutable positioned token.
 *
 * @param type             Token kind
 * @param text             Source text of the token
 * @param offset           Offset of the first character
 * @param length           Length in characters
 * @param precededByTrivia Whether whitespace or a comment immediately precedes the token
 */
public record Token(TokenType type, String text, int offset, int length, boolean precededByTrivia) {

    public int end() {
        return offset + length;
    }

    public SourceSpan span() {
        return new SourceSpan(offset, length);
    }

    public Token withPrecededByTrivia(boolean preceded) {
        return new Token(type, text, offset, length, preceded);
    }
}
