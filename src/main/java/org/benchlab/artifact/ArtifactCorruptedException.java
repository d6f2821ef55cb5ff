package org.benchlab.artifact;

import java.nio.file.Path;
import java.util.Optional;

/**
 * An artifact cannot be turned back into the requested stage.
 */
public final class ArtifactCorruptedException extends IllegalArgumentException {
    private final Path source;

    public ArtifactCorruptedException(String message) {
        this(message, null, null);
    }

    public ArtifactCorruptedException(String message, Throwable cause) {
        this(message, null, cause);
    }

    public ArtifactCorruptedException(String message, Path source, Throwable cause) {
        super(source == null ? message : source + ": " + message, cause);
        this.source = source;
    }

    public Optional<Path> source() {
        return Optional.ofNullable(source);
    }

    ArtifactCorruptedException withSource(Path path) {
        if (source != null || path == null) {
            return this;
        }
        return new ArtifactCorruptedException(getMessage(), path, getCause());
    }
}
