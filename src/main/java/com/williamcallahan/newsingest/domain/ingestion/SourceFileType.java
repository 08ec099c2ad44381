package com.williamcallahan.newsingest.domain.ingestion;

import java.nio.file.Path;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Supported source document formats, keyed by file extension.
 */
public enum SourceFileType {
    TEXT(List.of(".txt")),
    PDF(List.of(".pdf")),
    DOCX(List.of(".docx")),
    HTML(List.of(".html", ".htm"));

    private final List<String> extensions;

    SourceFileType(List<String> extensions) {
        this.extensions = extensions;
    }

    /**
     * Resolves the type for a file name, ignoring extension case.
     *
     * @param fileName file name including extension
     * @return the matching type, or empty for unsupported files
     */
    public static Optional<SourceFileType> fromFileName(String fileName) {
        if (fileName == null || fileName.isBlank()) {
            return Optional.empty();
        }
        String lowered = fileName.toLowerCase(Locale.ROOT);
        for (SourceFileType type : values()) {
            for (String extension : type.extensions) {
                if (lowered.endsWith(extension) && lowered.length() > extension.length()) {
                    return Optional.of(type);
                }
            }
        }
        return Optional.empty();
    }

    /**
     * Resolves the type for a path's file name.
     *
     * @param path file path
     * @return the matching type, or empty for unsupported files and paths without a file name
     */
    public static Optional<SourceFileType> fromPath(Path path) {
        Path fileName = path == null ? null : path.getFileName();
        return fileName == null ? Optional.empty() : fromFileName(fileName.toString());
    }
}
