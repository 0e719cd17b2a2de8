package org.pragmatica.authz.schema;

import org.pragmatica.authz.tree.SourceLocation;

/**
 * Lexical token with the position of its first character.
 */
public record Token(TokenKind kind, String text, SourceLocation location) {

    public static Token of(TokenKind kind, String text, int line, int column) {
        return new Token(kind, text, SourceLocation.at(line, column));
    }

    public int line() {
        return location.line();
    }

    public int column() {
        return location.column();
    }

    public boolean is(TokenKind expected) {
        return kind == expected;
    }

    @Override
    public String toString() {
        return kind + "(" + text + ")@" + location;
    }
}
