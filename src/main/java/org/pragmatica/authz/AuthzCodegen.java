package org.pragmatica.authz;

import io.vavr.control.Either;
import org.pragmatica.authz.error.CompileError;
import org.pragmatica.authz.generator.CodeGenerator;
import org.pragmatica.authz.generator.GeneratedSource;
import org.pragmatica.authz.generator.GeneratorConfig;
import org.pragmatica.authz.io.ArtifactWriter;
import org.pragmatica.authz.io.GeneratedArtifact;
import org.pragmatica.authz.io.SchemaSource;
import org.pragmatica.authz.model.Schema;
import org.pragmatica.authz.model.SchemaExtractor;
import org.pragmatica.authz.schema.DefinitionNode;
import org.pragmatica.authz.schema.SchemaLexer;
import org.pragmatica.authz.schema.SchemaParser;
import org.pragmatica.authz.schema.Token;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.List;
import java.util.function.BooleanSupplier;

/**
 * Entry point for compiling authorization schemas into Java bindings.
 *
 * <p>Example usage:
 * <pre>{@code
 * var source = AuthzCodegen.compile("""
 *     definition user {}
 *     definition document {
 *         relation viewer: user
 *         permission view = viewer
 *     }
 *     """).get();
 * }</pre>
 *
 * <p>The pipeline is lex, parse, extract, generate. Every stage runs to completion before the next
 * one starts and the first failing stage ends the compilation. Compilations share no state.
 */
public final class AuthzCodegen {
    private static final Logger log = LoggerFactory.getLogger(AuthzCodegen.class);

    private static final BooleanSupplier NEVER_CANCELLED = () -> false;

    private AuthzCodegen() {}

    public static List<Token> tokenize(String schemaText) {
        return SchemaLexer.tokenize(schemaText);
    }

    public static Either<CompileError, List<DefinitionNode>> parse(String schemaText) {
        return SchemaParser.parse(tokenize(schemaText));
    }

    public static Either<CompileError, Schema> extract(String schemaText, String defaultPackage) {
        return parse(schemaText).flatMap(nodes -> SchemaExtractor.extract(nodes, defaultPackage));
    }

    /**
     * Compile schema text with the default configuration.
     */
    public static Either<CompileError, GeneratedSource> compile(String schemaText) {
        return compile(schemaText, GeneratorConfig.DEFAULT);
    }

    public static Either<CompileError, GeneratedSource> compile(String schemaText, GeneratorConfig config) {
        return compile(schemaText, config, NEVER_CANCELLED);
    }

    /**
     * Compile schema text, checking {@code cancelled} between stages.
     *
     * @return generated source, or the error of the first failing stage
     */
    public static Either<CompileError, GeneratedSource> compile(String schemaText,
                                                                GeneratorConfig config,
                                                                BooleanSupplier cancelled) {
        var tokens = tokenize(schemaText);
        if (cancelled.getAsBoolean()) {
            return Either.left(new CompileError.Cancelled("parse"));
        }

        var nodes = SchemaParser.parse(tokens);
        if (nodes.isLeft()) {
            return Either.left(nodes.getLeft());
        }
        if (cancelled.getAsBoolean()) {
            return Either.left(new CompileError.Cancelled("extract"));
        }

        var schema = SchemaExtractor.extract(nodes.get(), config.defaultPackage());
        if (schema.isLeft()) {
            return Either.left(schema.getLeft());
        }
        if (cancelled.getAsBoolean()) {
            return Either.left(new CompileError.Cancelled("generate"));
        }

        return CodeGenerator.create(config).generate(schema.get());
    }

    /**
     * Read the schema at {@code schemaPath} (file or directory), compile it and write the result into
     * {@code outputDirectory}. Nothing is written unless compilation succeeds.
     */
    public static Either<CompileError, GeneratedArtifact> generate(Path schemaPath,
                                                                   Path outputDirectory,
                                                                   GeneratorConfig config,
                                                                   ArtifactWriter writer) {
        log.info("Reading schema from {}", schemaPath);
        var schemaText = SchemaSource.read(schemaPath);
        if (schemaText.isLeft()) {
            log.error("Schema could not be read: {}", schemaText.getLeft().message());
            return Either.left(schemaText.getLeft());
        }
        log.debug("Schema read, {} characters", schemaText.get().length());

        var source = compile(schemaText.get(), config);
        if (source.isLeft()) {
            log.error("Compilation of {} failed: {}", schemaPath, source.getLeft().message());
            return Either.left(source.getLeft());
        }
        var generated = source.get();
        generated.formatWarning()
                 .forEach(warning -> log.warn("{}: {}", schemaPath, warning.message()));

        var written = writer.write(outputDirectory, generated);
        if (written.isLeft()) {
            log.error("Writing generated source failed: {}", written.getLeft().message());
            return Either.left(written.getLeft());
        }
        log.info("Generated package {} into {}", generated.packageName(), written.get());
        return Either.right(new GeneratedArtifact(written.get(), generated));
    }

    public static Either<CompileError, GeneratedArtifact> generate(Path schemaPath, Path outputDirectory) {
        return generate(schemaPath, outputDirectory, GeneratorConfig.DEFAULT, ArtifactWriter.files());
    }
}
