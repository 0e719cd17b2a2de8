package org.pragmatica.authz.generator;

import io.vavr.control.Either;
import io.vavr.control.Option;
import org.pragmatica.authz.error.CompileError;
import org.pragmatica.authz.model.Schema;

/**
 * Generates Java bindings from a {@link Schema} in two explicit steps: {@link #render(Schema)}
 * and {@link #format(String)}. A formatting failure is not fatal, the unformatted text is kept and
 * the failure is reported on the {@link GeneratedSource}.
 */
public final class CodeGenerator {
    private final SchemaTemplate template;
    private final SourceFormatter formatter;

    private CodeGenerator(SchemaTemplate template, SourceFormatter formatter) {
        this.template = template;
        this.formatter = formatter;
    }

    public static CodeGenerator create(GeneratorConfig config) {
        return new CodeGenerator(new SchemaTemplate(), config.formatter());
    }

    public static CodeGenerator create() {
        return create(GeneratorConfig.DEFAULT);
    }

    public Either<CompileError, GeneratedSource> generate(Schema schema) {
        var className = SchemaTemplate.unitClassName(schema.packageName());
        return render(schema).map(rendered -> format(rendered).fold(
            warning -> new GeneratedSource(schema.packageName(), className, rendered, Option.some(warning)),
            formatted -> new GeneratedSource(schema.packageName(), className, formatted, Option.none())));
    }

    /**
     * Template output for the schema with definitions sorted by name.
     */
    public Either<CompileError, String> render(Schema schema) {
        return template.render(schema.sortedByName());
    }

    public Either<CompileError, String> format(String source) {
        return formatter.format(source);
    }
}
