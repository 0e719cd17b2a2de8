package org.pragmatica.authz.error;

import io.vavr.control.Option;
import org.pragmatica.authz.schema.TokenKind;
import org.pragmatica.authz.tree.SourceLocation;

import java.util.ArrayList;
import java.util.List;

/**
 * Compiler-style rendering of a {@link CompileError} against the schema text.
 *
 * <p>Example output:
 * <pre>
 * error: expected ':' after relation name 'viewer': token mismatch: expected ':', got identifier (user) at line 3
 *   --> schema.zed:3:21
 *    |
 *  3 |     relation viewer user
 *    |                     ^^^^
 *    |
 * </pre>
 *
 * @param severity error or warning
 * @param message  primary message
 * @param location where to point, if anywhere
 * @param length   number of columns to underline
 * @param notes    trailing notes
 */
public record Diagnostic(
    Severity severity,
    String message,
    Option<SourceLocation> location,
    int length,
    List<String> notes) {

    public enum Severity {
        ERROR("error"),
        WARNING("warning");

        private final String display;

        Severity(String display) {
            this.display = display;
        }

        public String display() {
            return display;
        }
    }

    public static Diagnostic of(CompileError error) {
        var severity = error.isFatal() ? Severity.ERROR : Severity.WARNING;
        var diagnostic = new Diagnostic(severity,
                                        error.message(),
                                        error.location(),
                                        underlineLength(error),
                                        List.of());
        return help(error).map(diagnostic::withHelp)
                          .getOrElse(diagnostic);
    }

    public Diagnostic withNote(String note) {
        var newNotes = new ArrayList<>(notes);
        newNotes.add(note);
        return new Diagnostic(severity, message, location, length, List.copyOf(newNotes));
    }

    public Diagnostic withHelp(String help) {
        return withNote("help: " + help);
    }

    /**
     * Format with the offending source line and a caret underline.
     *
     * @param source   schema text the error refers to
     * @param filename name shown after {@code -->}, may be {@code null}
     */
    public String format(String source, String filename) {
        var sb = new StringBuilder();
        sb.append(severity.display()).append(": ").append(message).append("\n");

        if (location.isEmpty()) {
            notes.forEach(note -> sb.append("  = ").append(note).append("\n"));
            return sb.toString();
        }

        var loc = location.get();
        sb.append("  --> ");
        if (filename != null) {
            sb.append(filename).append(":");
        }
        sb.append(loc.line()).append(":").append(loc.column()).append("\n");

        var lines = source.split("\n", -1);
        var gutterWidth = String.valueOf(loc.line()).length();
        var gutter = " ".repeat(gutterWidth + 1);

        sb.append(gutter).append("|\n");
        if (loc.line() >= 1 && loc.line() <= lines.length) {
            var lineContent = lines[loc.line() - 1].replace("\r", "");
            sb.append(String.format("%" + gutterWidth + "d", loc.line()))
              .append(" | ")
              .append(lineContent)
              .append("\n");
            sb.append(gutter)
              .append("| ")
              .append(" ".repeat(Math.max(0, loc.column() - 1)))
              .append("^".repeat(Math.max(1, length)))
              .append("\n");
        }
        sb.append(gutter).append("|\n");

        for (var note : notes) {
            sb.append(gutter).append("= ").append(note).append("\n");
        }
        return sb.toString();
    }

    /**
     * Single-line form: {@code file:line:column: error: message}.
     */
    public String formatSimple(String filename) {
        var position = location.map(loc -> loc.line() + ":" + loc.column() + ": ").getOrElse("");
        var prefix = filename == null ? "" : filename + ":";
        return prefix + position + severity.display() + ": " + message;
    }

    private static int underlineLength(CompileError error) {
        if (error instanceof CompileError.UnexpectedToken unexpected) {
            return unexpected.found().text().length();
        }
        if (error instanceof CompileError.IllegalCharacter illegal) {
            return illegal.found().text().length();
        }
        if (error instanceof CompileError.MalformedObjectType malformed) {
            return malformed.found().text().length();
        }
        return 1;
    }

    private static Option<String> help(CompileError error) {
        if (error instanceof CompileError.UnexpectedToken unexpected) {
            return switch (unexpected.mismatch()) {
                case MISSING_OPENING_BRACE -> Option.some("a definition body starts with '{'");
                case MISSING_CLOSING_BRACE -> Option.some("a definition body contains only relations and permissions");
                case TOKEN_MISMATCH -> keywordAsName(unexpected);
            };
        }
        if (error instanceof CompileError.MalformedObjectType) {
            return Option.some("write 'definition name {' or 'definition prefix/name {'");
        }
        if (error instanceof CompileError.IllegalCharacter) {
            return Option.some("identifiers use ASCII letters, digits and '_'; comments start with '//'");
        }
        return Option.none();
    }

    private static Option<String> keywordAsName(CompileError.UnexpectedToken unexpected) {
        if (unexpected.expected() == TokenKind.IDENTIFIER && unexpected.found().kind().isKeyword()) {
            return Option.some("'" + unexpected.found().text() + "' is a keyword and cannot be used as a name");
        }
        return Option.none();
    }
}
