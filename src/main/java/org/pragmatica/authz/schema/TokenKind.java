package org.pragmatica.authz.schema;

/**
 * Closed set of token kinds produced by {@link SchemaLexer}.
 */
public enum TokenKind {
    EOF("end of input"),
    ILLEGAL("illegal character"),
    IDENTIFIER("identifier"),

    // Keywords
    DEFINITION("'definition'"),
    RELATION("'relation'"),
    PERMISSION("'permission'"),

    // Operators and punctuation
    EQUAL("'='"),
    PLUS("'+'"),
    MINUS("'-'"),
    PIPE("'|'"),
    WILDCARD("'*'"),
    LBRACE("'{'"),
    RBRACE("'}'"),
    COLON("':'"),
    SLASH("'/'"),
    HASH("'#'"),
    ARROW("'->'");

    private final String display;

    TokenKind(String display) {
        this.display = display;
    }

    public String display() {
        return display;
    }

    public boolean isKeyword() {
        return this == DEFINITION || this == RELATION || this == PERMISSION;
    }
}
