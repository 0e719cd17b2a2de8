package org.pragmatica.authz.generator;

import org.pragmatica.authz.model.SchemaExtractor;

/**
 * Code generation options.
 *
 * @param defaultPackage package used when the first definition has no prefix
 * @param formatter      layout step applied after rendering
 */
public record GeneratorConfig(String defaultPackage, SourceFormatter formatter) {
    public static final GeneratorConfig DEFAULT = new GeneratorConfig(
        SchemaExtractor.DEFAULT_PACKAGE,
        SourceFormatter.googleJavaFormat()
    );

    public GeneratorConfig withDefaultPackage(String packageName) {
        return new GeneratorConfig(packageName, formatter);
    }

    public GeneratorConfig withFormatter(SourceFormatter sourceFormatter) {
        return new GeneratorConfig(defaultPackage, sourceFormatter);
    }

    public GeneratorConfig unformatted() {
        return withFormatter(SourceFormatter.identity());
    }
}
