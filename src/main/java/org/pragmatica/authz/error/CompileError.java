package org.pragmatica.authz.error;

import io.vavr.control.Option;
import org.pragmatica.authz.schema.Token;
import org.pragmatica.authz.schema.TokenKind;
import org.pragmatica.authz.tree.SourceLocation;

import java.nio.file.Path;

/**
 * Everything that can stop (or, for {@link FormatError}, degrade) a compilation.
 */
public sealed interface CompileError {

    String message();

    /**
     * Position in the schema text, when the error has one.
     */
    default Option<SourceLocation> location() {
        return Option.none();
    }

    /**
     * Warning-class errors do not abort compilation.
     */
    default boolean isFatal() {
        return true;
    }

    /**
     * Shape of a token mismatch, used to pick an actionable message.
     */
    enum Mismatch {
        MISSING_OPENING_BRACE("missing opening brace after object type definition"),
        MISSING_CLOSING_BRACE("missing closing brace to end definition block"),
        TOKEN_MISMATCH("token mismatch");

        private final String description;

        Mismatch(String description) {
            this.description = description;
        }

        public String description() {
            return description;
        }

        public static Mismatch classify(TokenKind expected, TokenKind found) {
            if (expected == TokenKind.LBRACE && found == TokenKind.IDENTIFIER) {
                return MISSING_OPENING_BRACE;
            }
            if (expected == TokenKind.RBRACE) {
                return MISSING_CLOSING_BRACE;
            }
            return TOKEN_MISMATCH;
        }
    }

    // === Syntax ===

    /**
     * A token of the wrong kind where {@code expected} was required.
     */
    record UnexpectedToken(
        String production,
        TokenKind expected,
        Token found,
        Mismatch mismatch) implements CompileError {

        @Override
        public String message() {
            return CompileError.prefixed(production,
                                         mismatch.description() + ": " + CompileError.expectedGot(expected, found));
        }

        @Override
        public Option<SourceLocation> location() {
            return Option.some(found.location());
        }
    }

    /**
     * Input ended while {@code expected} was still required.
     */
    record UnexpectedEof(String production, TokenKind expected, Token eof) implements CompileError {

        @Override
        public String message() {
            return CompileError.prefixed(production,
                                         "unexpected end of file: " + CompileError.expectedGot(expected, eof));
        }

        @Override
        public Option<SourceLocation> location() {
            return Option.some(eof.location());
        }
    }

    /**
     * The lexer could not classify a character and the parser needed a real token there.
     */
    record IllegalCharacter(String production, TokenKind expected, Token found) implements CompileError {

        @Override
        public String message() {
            return CompileError.prefixed(production,
                                         "illegal character encountered: " + CompileError.expectedGot(expected, found));
        }

        @Override
        public Option<SourceLocation> location() {
            return Option.some(found.location());
        }
    }

    /**
     * After {@code definition <identifier>} neither {@code /} nor {@code &#123;} followed.
     */
    record MalformedObjectType(String identifier, Token found) implements CompileError {

        @Override
        public String message() {
            return "expected either '/' (for prefix/name format) or '{' (for standard format) after identifier '"
                   + identifier + "', got " + found.kind().display() + " (" + found.text() + ") at line "
                   + found.line();
        }

        @Override
        public Option<SourceLocation> location() {
            return Option.some(found.location());
        }
    }

    // === Semantic ===

    record DuplicateDefinition(SourceLocation at, String objectType, SourceLocation first) implements CompileError {

        @Override
        public String message() {
            return "duplicate definition '" + objectType + "' at line " + at.line()
                   + " (first defined at line " + first.line() + ")";
        }

        @Override
        public Option<SourceLocation> location() {
            return Option.some(at);
        }
    }

    record DuplicateMember(SourceLocation at, String definition, String member) implements CompileError {

        @Override
        public String message() {
            return "duplicate relation or permission '" + member + "' in definition '" + definition
                   + "' at line " + at.line();
        }

        @Override
        public Option<SourceLocation> location() {
            return Option.some(at);
        }
    }

    // === Generation ===

    record TemplateError(String reason) implements CompileError {

        @Override
        public String message() {
            return "template execution failed: " + reason;
        }
    }

    record FormatError(String reason) implements CompileError {

        @Override
        public String message() {
            return "formatting failed, emitting unformatted source: " + reason;
        }

        @Override
        public boolean isFatal() {
            return false;
        }
    }

    // === External ===

    record IoError(Path path, String operation, Throwable cause) implements CompileError {

        @Override
        public String message() {
            return "failed to " + operation + " '" + path + "': " + cause.getMessage();
        }
    }

    record Cancelled(String stage) implements CompileError {

        @Override
        public String message() {
            return "compilation cancelled before " + stage;
        }
    }

    private static String prefixed(String production, String detail) {
        return production.isEmpty() ? detail : production + ": " + detail;
    }

    private static String expectedGot(TokenKind expected, Token found) {
        return "expected " + expected.display() + ", got " + found.kind().display()
               + " (" + found.text() + ") at line " + found.line();
    }
}
