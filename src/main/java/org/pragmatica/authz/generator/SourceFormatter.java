package org.pragmatica.authz.generator;

import io.vavr.control.Either;
import org.pragmatica.authz.error.CompileError;

/**
 * Second step of generation: canonical layout of rendered source.
 */
@FunctionalInterface
public interface SourceFormatter {

    /**
     * Format source text. A {@link CompileError.FormatError} means the text could not be formatted,
     * usually because it is not valid Java.
     */
    Either<CompileError, String> format(String source);

    /**
     * Formatter that returns its input unchanged.
     */
    static SourceFormatter identity() {
        return Either::right;
    }

    static SourceFormatter googleJavaFormat() {
        return new GoogleJavaSourceFormatter();
    }
}
