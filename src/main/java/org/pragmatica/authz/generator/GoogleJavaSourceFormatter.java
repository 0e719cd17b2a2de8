package org.pragmatica.authz.generator;

import com.google.googlejavaformat.java.Formatter;
import com.google.googlejavaformat.java.FormatterException;
import io.vavr.control.Either;
import org.pragmatica.authz.error.CompileError;

/**
 * {@link SourceFormatter} backed by google-java-format.
 *
 * <p>On JDK 16+ google-java-format needs {@code --add-exports} access to {@code jdk.compiler}
 * internals; the build passes those flags to tests and the jar manifest carries them.
 */
final class GoogleJavaSourceFormatter implements SourceFormatter {
    private final Formatter formatter = new Formatter();

    @Override
    public Either<CompileError, String> format(String source) {
        try {
            return Either.right(formatter.formatSource(source));
        } catch (FormatterException e) {
            return Either.left(new CompileError.FormatError(e.getMessage()));
        }
    }
}
