package com.williamcallahan.newsingest.service.naming;

import com.williamcallahan.newsingest.config.AppProperties;
import com.williamcallahan.newsingest.domain.date.FullDate;
import java.nio.file.Path;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Maps a source file and its date to {@code <root>/<folder>/<YYYY-MM-DD>_<stem>.txt}.
 *
 * <p>The stem is sanitized with escalating limits so the whole path fits the configured ceiling:
 * first effectively unbounded, then 50 code points, then exactly the budget that remains after the
 * folder, date prefix and extension. The date prefix and folder structure are never shortened.
 * The mapping is a pure function of its inputs.</p>
 */
@Service
public class DestinationPathBuilder {
    private static final Logger log = LoggerFactory.getLogger(DestinationPathBuilder.class);

    static final int UNBOUNDED_STEM_LENGTH = 1000;
    static final int SHORT_STEM_LENGTH = 50;
    static final String EXTENSION = ".txt";
    static final int DATE_PREFIX_LENGTH = "YYYY-MM-DD_".length();
    private static final int SAFETY_MARGIN = 1;

    private final NameSanitizer sanitizer;
    private final AppProperties appProperties;

    public DestinationPathBuilder(NameSanitizer sanitizer, AppProperties appProperties) {
        this.sanitizer = sanitizer;
        this.appProperties = appProperties;
    }

    /**
     * Builds the destination path for a source file.
     *
     * @param sourceRelativePath source path relative to the source root
     * @param date resolved publication date
     * @param destinationRoot root of the normalized tree
     * @return destination path; never throws for long names
     */
    public Path buildDestination(Path sourceRelativePath, FullDate date, Path destinationRoot) {
        Objects.requireNonNull(sourceRelativePath, "sourceRelativePath");
        Objects.requireNonNull(date, "date");
        Objects.requireNonNull(destinationRoot, "destinationRoot");
        Path fileName = sourceRelativePath.getFileName();
        if (fileName == null) {
            throw new IllegalArgumentException("Source path has no file name: " + sourceRelativePath);
        }
        Path parent = sourceRelativePath.getParent();
        Path folder = parent == null ? destinationRoot : destinationRoot.resolve(parent);
        String stem = stemOf(fileName.toString());
        int ceiling = appProperties.getIngestion().getMaxPathLength();

        Path candidate = folder.resolve(fileName(date, sanitizer.sanitize(stem, UNBOUNDED_STEM_LENGTH)));
        if (candidate.toString().length() <= ceiling) {
            return candidate;
        }
        candidate = folder.resolve(fileName(date, sanitizer.sanitize(stem, SHORT_STEM_LENGTH)));
        if (candidate.toString().length() <= ceiling) {
            return candidate;
        }

        int budget = ceiling - folder.toString().length() - 1 - DATE_PREFIX_LENGTH - EXTENSION.length() - SAFETY_MARGIN;
        if (budget <= 0) {
            log.warn("No room for a stem under {} ({} chars); using date-only name", folder, folder.toString().length());
            return folder.resolve(fileName(date, ""));
        }
        String sanitized = sanitizer.sanitize(stem, budget);
        candidate = folder.resolve(fileName(date, sanitized));
        // Supplementary characters count twice toward the path length.
        while (candidate.toString().length() > ceiling && budget > 0) {
            budget--;
            candidate = folder.resolve(fileName(date, sanitizer.sanitize(stem, budget)));
        }
        log.debug("Truncated stem of {} to fit {} chars", sourceRelativePath, ceiling);
        return candidate;
    }

    /**
     * Returns the stem a source file name contributes to its destination name, before sanitizing.
     *
     * @param fileName source file name
     * @return the name without its last extension
     */
    static String stemOf(String fileName) {
        int dotIndex = fileName.lastIndexOf('.');
        return dotIndex > 0 ? fileName.substring(0, dotIndex) : fileName;
    }

    private static String fileName(FullDate date, String sanitizedStem) {
        return date.canonical() + "_" + sanitizedStem + EXTENSION;
    }
}
