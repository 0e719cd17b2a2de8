package org.pragmatica.authz.io;

import io.vavr.control.Either;
import org.pragmatica.authz.error.CompileError;
import org.pragmatica.authz.generator.GeneratedSource;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;

/**
 * Writes a generated compilation unit into an output directory.
 */
@FunctionalInterface
public interface ArtifactWriter {

    /**
     * @return path of the written file
     */
    Either<CompileError, Path> write(Path outputDirectory, GeneratedSource source);

    /**
     * Writer for the local file system. Output directories are created as needed and content is
     * written to a temporary file first, so a failed write never leaves a partial artifact.
     */
    static ArtifactWriter files() {
        return (outputDirectory, source) -> {
            try {
                Files.createDirectories(outputDirectory);
            } catch (IOException e) {
                return Either.left(new CompileError.IoError(outputDirectory, "create output directory", e));
            }

            var target = outputDirectory.resolve(source.fileName());
            try {
                var temporary = Files.createTempFile(outputDirectory, source.className(), ".tmp");
                try {
                    Files.writeString(temporary, source.content(), StandardCharsets.UTF_8);
                    Files.move(temporary, target, StandardCopyOption.REPLACE_EXISTING);
                } finally {
                    Files.deleteIfExists(temporary);
                }
                return Either.right(target);
            } catch (IOException e) {
                return Either.left(new CompileError.IoError(target, "write generated source", e));
            }
        };
    }
}
