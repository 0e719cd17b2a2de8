package org.pragmatica.authz.generator;

import io.vavr.control.Option;
import org.pragmatica.authz.error.CompileError;

/**
 * Result of one compilation: a single Java compilation unit.
 *
 * @param formatWarning present when formatting failed and {@code content} is the raw template output
 */
public record GeneratedSource(
    String packageName,
    String className,
    String content,
    Option<CompileError> formatWarning) {

    public String fileName() {
        return className + ".java";
    }

    public boolean formatted() {
        return formatWarning.isEmpty();
    }
}
