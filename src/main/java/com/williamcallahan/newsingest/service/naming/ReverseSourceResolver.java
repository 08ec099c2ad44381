package com.williamcallahan.newsingest.service.naming;

import com.williamcallahan.newsingest.domain.date.FullDate;
import com.williamcallahan.newsingest.domain.ingestion.SourceFile;
import com.williamcallahan.newsingest.domain.ingestion.SourceFileType;
import com.williamcallahan.newsingest.service.date.DateResolver;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Stream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Recovers the source file that produced a normalized document.
 *
 * <p>The filename date is the authoritative filter because date extraction survives sanitizing.
 * Among same-date candidates in the mirrored source folder, an exact sanitized-stem match wins,
 * then a prefix match in either direction, then a case-insensitive match on the first 20
 * characters, then the first candidate in file-name order. A single same-date candidate is
 * returned without comparing names.</p>
 */
@Service
public class ReverseSourceResolver {
    private static final Logger log = LoggerFactory.getLogger(ReverseSourceResolver.class);

    static final Pattern DESTINATION_NAME = Pattern.compile("^(\\d{4}-\\d{2}-\\d{2})_(.*)\\.txt$");
    private static final int LOOSE_PREFIX_LENGTH = 20;

    private final DateResolver dateResolver;
    private final NameSanitizer sanitizer;

    public ReverseSourceResolver(DateResolver dateResolver, NameSanitizer sanitizer) {
        this.dateResolver = dateResolver;
        this.sanitizer = sanitizer;
    }

    /**
     * Finds the source file behind a normalized document.
     *
     * @param destinationFile normalized document
     * @param destinationRoot root of the normalized tree
     * @param sourceRoot root of the source tree
     * @return the source file, or empty when none can be identified; never throws
     */
    public Optional<SourceFile> findSource(Path destinationFile, Path destinationRoot, Path sourceRoot) {
        try {
            return resolve(destinationFile, destinationRoot, sourceRoot);
        } catch (Exception exception) {
            log.debug("Reverse resolution failed for {}: {}", destinationFile, exception.toString());
            return Optional.empty();
        }
    }

    private Optional<SourceFile> resolve(Path destinationFile, Path destinationRoot, Path sourceRoot)
            throws IOException {
        Path fileName = destinationFile.getFileName();
        if (fileName == null) {
            return Optional.empty();
        }
        Matcher matcher = DESTINATION_NAME.matcher(fileName.toString());
        if (!matcher.matches()) {
            return Optional.empty();
        }
        Optional<FullDate> destinationDate = FullDate.parseCanonical(matcher.group(1));
        if (destinationDate.isEmpty()) {
            return Optional.empty();
        }
        String storedStem = matcher.group(2);

        Path normalizedRoot = destinationRoot.toAbsolutePath().normalize();
        Path normalizedDestination = destinationFile.toAbsolutePath().normalize();
        if (!normalizedDestination.startsWith(normalizedRoot)) {
            return Optional.empty();
        }
        Path relativeFolder = normalizedRoot.relativize(normalizedDestination).getParent();
        Path sourceBase = sourceRoot.toAbsolutePath().normalize();
        Path sourceFolder = relativeFolder == null ? sourceBase : sourceBase.resolve(relativeFolder);
        if (!Files.isDirectory(sourceFolder)) {
            return Optional.empty();
        }

        List<Path> sameDate = sameDateCandidates(sourceFolder, destinationDate.get());
        if (sameDate.isEmpty()) {
            return Optional.empty();
        }
        if (sameDate.size() == 1) {
            return Optional.of(SourceFile.of(sourceBase, sameDate.get(0)));
        }
        return Optional.of(SourceFile.of(sourceBase, pickByName(sameDate, storedStem)));
    }

    private List<Path> sameDateCandidates(Path sourceFolder, FullDate date) throws IOException {
        try (Stream<Path> entries = Files.list(sourceFolder)) {
            return entries
                    .filter(Files::isRegularFile)
                    .filter(path -> SourceFileType.fromPath(path).isPresent())
                    .filter(path -> dateResolver.resolveFullDateFromFilename(path.getFileName().toString())
                            .filter(date::equals)
                            .isPresent())
                    .sorted(Comparator.comparing(path -> path.getFileName().toString()))
                    .toList();
        }
    }

    private Path pickByName(List<Path> candidates, String storedStem) {
        for (Path candidate : candidates) {
            if (sanitizedStem(candidate).equals(storedStem)) {
                return candidate;
            }
        }
        if (!storedStem.isEmpty()) {
            for (Path candidate : candidates) {
                String sanitized = sanitizedStem(candidate);
                if (!sanitized.isEmpty() && (sanitized.startsWith(storedStem) || storedStem.startsWith(sanitized))) {
                    return candidate;
                }
            }
            String storedPrefix = loosePrefix(storedStem);
            for (Path candidate : candidates) {
                String candidatePrefix = loosePrefix(sanitizedStem(candidate));
                if (!candidatePrefix.isEmpty() && candidatePrefix.equals(storedPrefix)) {
                    return candidate;
                }
            }
        }
        log.debug("No name match among {} same-date candidates for stem '{}'; using first", candidates.size(), storedStem);
        return candidates.get(0);
    }

    private String sanitizedStem(Path candidate) {
        String stem = DestinationPathBuilder.stemOf(candidate.getFileName().toString());
        return sanitizer.sanitize(stem, DestinationPathBuilder.UNBOUNDED_STEM_LENGTH);
    }

    private static String loosePrefix(String stem) {
        String lowered = stem.toLowerCase(Locale.ROOT);
        return lowered.length() <= LOOSE_PREFIX_LENGTH ? lowered : lowered.substring(0, LOOSE_PREFIX_LENGTH);
    }
}
