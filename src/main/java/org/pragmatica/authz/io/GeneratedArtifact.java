package org.pragmatica.authz.io;

import org.pragmatica.authz.generator.GeneratedSource;

import java.nio.file.Path;

/**
 * A generated source together with where it was written.
 */
public record GeneratedArtifact(Path path, GeneratedSource source) {}
