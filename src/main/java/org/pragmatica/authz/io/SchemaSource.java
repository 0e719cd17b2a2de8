package org.pragmatica.authz.io;

import io.vavr.control.Either;
import org.pragmatica.authz.error.CompileError;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Reads schema text from a file, or from every {@code *.zed} file of a directory.
 *
 * <p>Directory contents are concatenated in file-name order into one document; no cross-file
 * resolution takes place.
 */
public final class SchemaSource {
    public static final String SCHEMA_EXTENSION = ".zed";

    private SchemaSource() {}

    public static Either<CompileError, String> read(Path path) {
        if (Files.isDirectory(path)) {
            return readDirectory(path);
        }
        return readFile(path);
    }

    private static Either<CompileError, String> readFile(Path file) {
        try {
            return Either.right(Files.readString(file, StandardCharsets.UTF_8));
        } catch (IOException e) {
            return Either.left(new CompileError.IoError(file, "read schema file", e));
        }
    }

    private static Either<CompileError, String> readDirectory(Path directory) {
        List<Path> files;
        try (Stream<Path> entries = Files.list(directory)) {
            files = entries.filter(Files::isRegularFile)
                           .filter(file -> file.getFileName().toString().endsWith(SCHEMA_EXTENSION))
                           .sorted()
                           .collect(Collectors.toList());
        } catch (IOException e) {
            return Either.left(new CompileError.IoError(directory, "list schema directory", e));
        }

        if (files.isEmpty()) {
            return Either.left(new CompileError.IoError(directory,
                                                        "find schema files in",
                                                        new IOException("no " + SCHEMA_EXTENSION + " files")));
        }

        var sb = new StringBuilder();
        for (var file : files) {
            var content = readFile(file);
            if (content.isLeft()) {
                return content;
            }
            sb.append(content.get());
            if (!content.get().endsWith("\n")) {
                sb.append('\n');
            }
        }
        return Either.right(sb.toString());
    }
}
