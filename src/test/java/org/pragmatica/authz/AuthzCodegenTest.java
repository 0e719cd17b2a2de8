package org.pragmatica.authz;

import io.vavr.control.Either;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.pragmatica.authz.error.CompileError;
import org.pragmatica.authz.generator.GeneratedSource;
import org.pragmatica.authz.generator.GeneratorConfig;
import org.pragmatica.authz.io.ArtifactWriter;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

class AuthzCodegenTest {

    private static final String SCHEMA = """
        definition tenant/user {}

        definition tenant/document {
            relation owner: tenant/user
            permission edit = owner
        }
        """;

    // === In-memory compilation ===

    @Test
    void compile_validSchema_producesSourceInFirstPackage() {
        var source = AuthzCodegen.compile(SCHEMA).get();

        assertEquals("tenant", source.packageName());
        assertEquals("Tenant.java", source.fileName());
        assertThat(source.content()).contains("public static final class Document")
                                    .contains("public static final class User");
    }

    @Test
    void compile_syntaxError_shortCircuits() {
        var result = AuthzCodegen.compile("definition user");

        assertTrue(result.isLeft());
        assertInstanceOf(CompileError.MalformedObjectType.class, result.getLeft());
    }

    @Test
    void compile_cancelledBeforeGeneration_stopsWithStage() {
        var checks = new AtomicInteger();

        var result = AuthzCodegen.compile(SCHEMA, GeneratorConfig.DEFAULT, () -> checks.incrementAndGet() == 3);

        var cancelled = assertInstanceOf(CompileError.Cancelled.class, result.getLeft());
        assertEquals("generate", cancelled.stage());
        assertEquals(3, checks.get());
    }

    @Test
    void compile_cancelledUpFront_neverParses() {
        var result = AuthzCodegen.compile("this is not a schema", GeneratorConfig.DEFAULT, () -> true);

        assertEquals(new CompileError.Cancelled("parse"), result.getLeft());
    }

    @Test
    void compile_parallelCallers_getIdenticalOutput() throws Exception {
        var executor = Executors.newFixedThreadPool(4);
        try {
            var futures = new ArrayList<Future<Either<CompileError, String>>>();
            for (int i = 0; i < 8; i++) {
                futures.add(executor.submit(() -> AuthzCodegen.compile(SCHEMA).map(GeneratedSource::content)));
            }
            var expected = AuthzCodegen.compile(SCHEMA).get().content();
            for (var future : futures) {
                assertEquals(expected, future.get(30, TimeUnit.SECONDS).get());
            }
        } finally {
            executor.shutdownNow();
        }
    }

    // === File based generation ===

    @Test
    void generate_writesArtifactIntoOutputDirectory(@TempDir Path dir) throws IOException {
        var schemaFile = Files.writeString(dir.resolve("schema.zed"), SCHEMA);
        var output = dir.resolve("out");

        var artifact = AuthzCodegen.generate(schemaFile, output).get();

        assertEquals(output.resolve("Tenant.java"), artifact.path());
        assertEquals(artifact.source().content(), Files.readString(artifact.path()));
    }

    @Test
    void generate_failedCompile_writesNothing(@TempDir Path dir) throws IOException {
        var schemaFile = Files.writeString(dir.resolve("schema.zed"), "definition doc { relation r bar }");
        var output = dir.resolve("out");

        var result = AuthzCodegen.generate(schemaFile, output);

        assertTrue(result.isLeft());
        assertFalse(Files.exists(output));
    }

    @Test
    void generate_missingSchema_isIoError(@TempDir Path dir) {
        ArtifactWriter neverCalled = (outputDirectory, source) -> {
            throw new AssertionError("writer must not be called");
        };

        var result = AuthzCodegen.generate(dir.resolve("absent.zed"), dir, GeneratorConfig.DEFAULT, neverCalled);

        assertInstanceOf(CompileError.IoError.class, result.getLeft());
    }

    @Test
    void generate_formatWarning_stillWritesUnformattedSource(@TempDir Path dir) throws IOException {
        var schemaFile = Files.writeString(dir.resolve("schema.zed"), SCHEMA);
        var config = GeneratorConfig.DEFAULT.withFormatter(
            source -> Either.left(new CompileError.FormatError("formatter unavailable")));

        var artifact = AuthzCodegen.generate(schemaFile, dir, config, ArtifactWriter.files()).get();

        assertFalse(artifact.source().formatted());
        assertTrue(Files.exists(artifact.path()));
    }

    @Test
    void generate_writerFailure_isPropagated(@TempDir Path dir) throws IOException {
        var schemaFile = Files.writeString(dir.resolve("schema.zed"), SCHEMA);
        var failure = new CompileError.IoError(dir, "write generated source", new IOException("disk full"));
        ArtifactWriter failing = (outputDirectory, source) -> Either.left(failure);

        var result = AuthzCodegen.generate(schemaFile, dir, GeneratorConfig.DEFAULT, failing);

        assertSame(failure, result.getLeft());
    }
}
