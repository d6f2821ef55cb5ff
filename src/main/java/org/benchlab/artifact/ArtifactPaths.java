package org.benchlab.artifact;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;
import java.util.Objects;

final class ArtifactPaths {
    private ArtifactPaths() {
    }

    /**
     * Appends {@code .extension} when the file name has none; rejects any other extension.
     */
    static Path resolveOutput(Path path, String extension) throws IOException {
        Objects.requireNonNull(path, "path");
        Path fileName = path.getFileName();
        if (fileName == null) {
            throw new IllegalArgumentException("output path has no file name: " + path);
        }
        String name = fileName.toString();
        int dot = name.lastIndexOf('.');
        Path resolved = path;
        if (dot <= 0) {
            resolved = path.resolveSibling(name + "." + extension);
        } else {
            String actual = name.substring(dot + 1).toLowerCase(Locale.ROOT);
            if (!actual.equals(extension)) {
                throw new IllegalArgumentException(
                    "output path must end with ." + extension + " but was " + path);
            }
        }
        Path parent = resolved.toAbsolutePath().normalize().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        return resolved;
    }
}
