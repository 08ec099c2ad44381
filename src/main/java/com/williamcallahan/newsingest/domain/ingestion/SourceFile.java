package com.williamcallahan.newsingest.domain.ingestion;

import java.nio.file.Path;
import java.util.Objects;

/**
 * A document discovered under the source root. Identity is the absolute path.
 *
 * @param absolutePath normalized absolute path of the file
 * @param relativePath path relative to the source root
 * @param type document format
 */
public record SourceFile(Path absolutePath, Path relativePath, SourceFileType type) {

    public SourceFile {
        Objects.requireNonNull(absolutePath, "absolutePath");
        Objects.requireNonNull(relativePath, "relativePath");
        Objects.requireNonNull(type, "type");
        if (!absolutePath.isAbsolute()) {
            throw new IllegalArgumentException("Source file path must be absolute: " + absolutePath);
        }
        if (relativePath.isAbsolute() || relativePath.getFileName() == null) {
            throw new IllegalArgumentException("Relative path must be relative and name a file: " + relativePath);
        }
    }

    /**
     * Creates a source file for a path under the given root.
     *
     * @param sourceRoot root of the source tree
     * @param file file under the root
     * @return the source file
     * @throws IllegalArgumentException when the file is outside the root or has an unsupported extension
     */
    public static SourceFile of(Path sourceRoot, Path file) {
        Path root = sourceRoot.toAbsolutePath().normalize();
        Path absolute = file.toAbsolutePath().normalize();
        if (!absolute.startsWith(root)) {
            throw new IllegalArgumentException("File " + absolute + " is not under " + root);
        }
        SourceFileType type = SourceFileType.fromPath(absolute)
                .orElseThrow(() -> new IllegalArgumentException("Unsupported source file type: " + absolute));
        return new SourceFile(absolute, root.relativize(absolute), type);
    }

    /**
     * Returns the file name including extension.
     */
    public String fileName() {
        return relativePath.getFileName().toString();
    }

    /**
     * Returns the relative path with forward slashes, used as the ledger and reconciliation key.
     */
    public String relativeKey() {
        return toKey(relativePath);
    }

    /**
     * Renders a relative path with forward slashes regardless of platform.
     *
     * @param relativePath relative path
     * @return slash-separated path text
     */
    public static String toKey(Path relativePath) {
        return relativePath.toString().replace('\\', '/');
    }
}
