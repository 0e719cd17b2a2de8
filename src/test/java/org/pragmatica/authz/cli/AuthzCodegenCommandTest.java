package org.pragmatica.authz.cli;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import picocli.CommandLine;

import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;

class AuthzCodegenCommandTest {

    private static final String SCHEMA = """
        definition user {}

        definition document {
            relation viewer: user
            permission view = viewer
        }
        """;

    @TempDir
    Path tempDir;

    private StringWriter out;
    private StringWriter err;

    @BeforeEach
    void setUp() {
        out = new StringWriter();
        err = new StringWriter();
    }

    private int execute(String... args) {
        CommandLine cmdLine = AuthzCodegenCommand.createCommandLine();
        cmdLine.setOut(new PrintWriter(out));
        cmdLine.setErr(new PrintWriter(err));
        return cmdLine.execute(args);
    }

    @Test
    void helpOutput_listsOptions() {
        int exitCode = execute("--help");

        assertThat(exitCode).isEqualTo(AuthzCodegenCommand.EXIT_OK);
        assertThat(out.toString()).contains("--schema")
                                  .contains("--output")
                                  .contains("--package")
                                  .contains("--no-format");
    }

    @Test
    void missingSchema_isUsageError() {
        int exitCode = execute();

        assertThat(exitCode).isEqualTo(AuthzCodegenCommand.EXIT_USAGE);
        assertThat(err.toString()).contains("schema file is required");
    }

    @Test
    void schemaOption_writesIntoOutputOption() throws Exception {
        var schema = Files.writeString(tempDir.resolve("schema.zed"), SCHEMA);
        var output = tempDir.resolve("gen");

        int exitCode = execute("--schema", schema.toString(), "--output", output.toString());

        assertThat(exitCode)
            .describedAs("Exit code should be 0. stderr: %s, stdout: %s", err.toString(), out.toString())
            .isEqualTo(AuthzCodegenCommand.EXIT_OK);
        assertThat(output.resolve("Authz.java")).exists();
        assertThat(out.toString()).contains("Code generation completed successfully")
                                  .contains("Authz.java");
    }

    @Test
    void positionalArguments_areFallbacks() throws Exception {
        var schema = Files.writeString(tempDir.resolve("schema.zed"), SCHEMA);
        var output = tempDir.resolve("positional");

        int exitCode = execute(schema.toString(), output.toString());

        assertThat(exitCode).isEqualTo(AuthzCodegenCommand.EXIT_OK);
        assertThat(output.resolve("Authz.java")).exists();
    }

    @Test
    void packageOption_changesDefaultPackage() throws Exception {
        var schema = Files.writeString(tempDir.resolve("schema.zed"), SCHEMA);

        int exitCode = execute("-s", schema.toString(), "-o", tempDir.toString(), "-p", "com.example.acl");

        assertThat(exitCode).isEqualTo(AuthzCodegenCommand.EXIT_OK);
        assertThat(Files.readString(tempDir.resolve("Acl.java"))).contains("package com.example.acl;");
    }

    @Test
    void noFormat_writesTemplateOutput() throws Exception {
        var schema = Files.writeString(tempDir.resolve("schema.zed"), SCHEMA);

        int exitCode = execute("-s", schema.toString(), "-o", tempDir.toString(), "--no-format");

        assertThat(exitCode).isEqualTo(AuthzCodegenCommand.EXIT_OK);
        // Template output is not indented
        assertThat(Files.readString(tempDir.resolve("Authz.java"))).contains("\npublic static final class Document {");
    }

    @Test
    void schemaDirectory_isCompiledAsOneDocument() throws Exception {
        var schemas = Files.createDirectories(tempDir.resolve("schemas"));
        Files.writeString(schemas.resolve("a_user.zed"), "definition user {}\n");
        Files.writeString(schemas.resolve("b_document.zed"), "definition document { relation viewer: user }\n");

        int exitCode = execute("-s", schemas.toString(), "-o", tempDir.toString());

        assertThat(exitCode).isEqualTo(AuthzCodegenCommand.EXIT_OK);
        assertThat(Files.readString(tempDir.resolve("Authz.java"))).contains("class Document")
                                                                   .contains("class User");
    }

    @Test
    void syntaxError_printsDiagnosticAndFails() throws Exception {
        var schema = Files.writeString(tempDir.resolve("broken.zed"), "definition doc {\n  relation viewer user\n}\n");
        var output = tempDir.resolve("never");

        int exitCode = execute("-s", schema.toString(), "-o", output.toString());

        assertThat(exitCode).isEqualTo(AuthzCodegenCommand.EXIT_COMPILE_FAILED);
        assertThat(err.toString()).contains("error: expected ':' after relation name 'viewer'")
                                  .contains("broken.zed:2:19")
                                  .contains("relation viewer user");
        assertThat(output).doesNotExist();
    }

    @Test
    void unreadableSchema_failsWithIoMessage() {
        int exitCode = execute("-s", tempDir.resolve("absent.zed").toString());

        assertThat(exitCode).isEqualTo(AuthzCodegenCommand.EXIT_COMPILE_FAILED);
        assertThat(err.toString()).contains("failed to read schema file");
    }
}
