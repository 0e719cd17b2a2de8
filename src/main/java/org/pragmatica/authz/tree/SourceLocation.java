package org.pragmatica.authz.tree;

/**
 * A position in schema text. Line and column are both 1-based.
 */
public record SourceLocation(int line, int column) {

    public static final SourceLocation START = new SourceLocation(1, 1);

    public static SourceLocation at(int line, int column) {
        return new SourceLocation(line, column);
    }

    @Override
    public String toString() {
        return line + ":" + column;
    }
}
