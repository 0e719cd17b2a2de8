package org.pragmatica.authz.schema;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Lexer for the authorization schema language.
 *
 * <p>Never fails: characters outside the language become {@link TokenKind#ILLEGAL} tokens and the
 * parser decides whether they matter. The returned list always ends with exactly one
 * {@link TokenKind#EOF} token.
 */
public final class SchemaLexer {
    private static final int DEFAULT_TOKEN_CAPACITY = 16;

    private static final Map<String, TokenKind> KEYWORDS = Map.of(
        "definition", TokenKind.DEFINITION,
        "relation", TokenKind.RELATION,
        "permission", TokenKind.PERMISSION
    );

    private final String input;
    private int pos;
    private int line;
    private int column;

    private SchemaLexer(String input) {
        this.input = input;
        this.pos = 0;
        this.line = 1;
        this.column = 1;
    }

    public static List<Token> tokenize(String input) {
        return new SchemaLexer(input).tokenizeAll();
    }

    private List<Token> tokenizeAll() {
        var tokens = new ArrayList<Token>();
        while (true) {
            skipWhitespaceAndComments();
            if (isAtEnd()) {
                break;
            }
            tokens.add(nextToken());
        }
        tokens.add(Token.of(TokenKind.EOF, "", line, column));
        return List.copyOf(tokens);
    }

    private Token nextToken() {
        int startLine = line;
        int startColumn = column;
        char c = peek();

        if (isIdentifierStart(c)) {
            return scanIdentifier(startLine, startColumn);
        }
        advance();
        var kind = switch (c) {
            case '=' -> TokenKind.EQUAL;
            case '+' -> TokenKind.PLUS;
            case '|' -> TokenKind.PIPE;
            case '*' -> TokenKind.WILDCARD;
            case '{' -> TokenKind.LBRACE;
            case '}' -> TokenKind.RBRACE;
            case ':' -> TokenKind.COLON;
            case '/' -> TokenKind.SLASH;
            case '#' -> TokenKind.HASH;
            case '-' -> TokenKind.MINUS;
            default -> TokenKind.ILLEGAL;
        };
        if (kind == TokenKind.MINUS && !isAtEnd() && peek() == '>') {
            advance();
            return Token.of(TokenKind.ARROW, "->", startLine, startColumn);
        }
        return Token.of(kind, String.valueOf(c), startLine, startColumn);
    }

    private Token scanIdentifier(int startLine, int startColumn) {
        var sb = new StringBuilder(DEFAULT_TOKEN_CAPACITY);
        while (!isAtEnd() && isIdentifierPart(peek())) {
            sb.append(advance());
        }
        var text = sb.toString();
        return Token.of(KEYWORDS.getOrDefault(text, TokenKind.IDENTIFIER), text, startLine, startColumn);
    }

    // Loops so that comments directly following whitespace or other comments are all consumed
    private void skipWhitespaceAndComments() {
        while (!isAtEnd()) {
            char c = peek();
            if (c == ' ' || c == '\t' || c == '\r' || c == '\n') {
                advance();
            } else if (c == '/' && peekNext() == '/') {
                while (!isAtEnd() && peek() != '\n') {
                    advance();
                }
            } else {
                break;
            }
        }
    }

    private boolean isAtEnd() {
        return pos >= input.length();
    }

    private char peek() {
        return input.charAt(pos);
    }

    private char peekNext() {
        return pos + 1 < input.length() ? input.charAt(pos + 1) : '\0';
    }

    private char advance() {
        char c = input.charAt(pos++);
        if (c == '\n') {
            line++;
            column = 1;
        } else {
            column++;
        }
        return c;
    }

    private static boolean isIdentifierStart(char c) {
        return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z') || c == '_';
    }

    private static boolean isIdentifierPart(char c) {
        return isIdentifierStart(c) || (c >= '0' && c <= '9');
    }
}
