package com.williamcallahan.newsingest.service.date;

import com.williamcallahan.newsingest.domain.date.FullDate;
import com.williamcallahan.newsingest.domain.date.PartialDate;
import com.williamcallahan.newsingest.domain.date.ResolvedDate;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Resolves publication dates from filenames and document bodies through ordered rule chains.
 *
 * <p>The first rule that yields a validated date wins; lower-priority rules are not consulted.
 * Out-of-range candidates never abort resolution, they fall through to the next rule.</p>
 */
@Service
public class DateResolver {
    private static final Logger log = LoggerFactory.getLogger(DateResolver.class);

    private final List<DateRule> filenameRules;
    private final List<DateRule> contentRules;

    /**
     * Creates a resolver with the standard filename and content conventions.
     */
    public DateResolver() {
        this(FilenameDateRules.defaults(), ContentDateRules.defaults());
    }

    /**
     * Creates a resolver with custom rule chains, highest priority first.
     *
     * @param filenameRules rules applied to file names
     * @param contentRules rules applied to document text
     */
    public DateResolver(List<DateRule> filenameRules, List<DateRule> contentRules) {
        this.filenameRules = List.copyOf(Objects.requireNonNull(filenameRules, "filenameRules"));
        this.contentRules = List.copyOf(Objects.requireNonNull(contentRules, "contentRules"));
    }

    /**
     * Resolves a date from a file name.
     *
     * @param fileName file name, with or without extension
     * @return the resolved date, or empty when no rule matches
     */
    public Optional<ResolvedDate> resolveFromFilename(String fileName) {
        return firstMatch(filenameRules, fileName);
    }

    /**
     * Resolves a complete date from a file name, the form used to stamp normalized documents.
     *
     * @param fileName file name, with or without extension
     * @return the full date, or empty when no rule yields a complete date
     */
    public Optional<FullDate> resolveFullDateFromFilename(String fileName) {
        Optional<ResolvedDate> resolved = resolveFromFilename(fileName);
        if (resolved.isPresent() && resolved.get() instanceof FullDate fullDate) {
            return Optional.of(fullDate);
        }
        return Optional.empty();
    }

    /**
     * Resolves a date from document text.
     *
     * @param text document body
     * @param preferred date whose year completes a partial result, or {@code null}
     * @return a full date, a partial date when no year was found and none was preferred, or empty
     */
    public Optional<ResolvedDate> resolveFromContent(String text, FullDate preferred) {
        Optional<ResolvedDate> resolved = firstMatch(contentRules, text);
        if (resolved.isPresent() && preferred != null && resolved.get() instanceof PartialDate partialDate) {
            FullDate completed = partialDate.completeWith(preferred.year());
            log.debug("Completed partial content date {} with year {}", partialDate, preferred.year());
            return Optional.of(completed);
        }
        return resolved;
    }

    List<DateRule> filenameRules() {
        return filenameRules;
    }

    List<DateRule> contentRules() {
        return contentRules;
    }

    private static Optional<ResolvedDate> firstMatch(List<DateRule> rules, String input) {
        if (input == null || input.isBlank()) {
            return Optional.empty();
        }
        for (DateRule rule : rules) {
            Optional<ResolvedDate> resolved = rule.resolve(input);
            if (resolved.isPresent()) {
                log.debug("Date rule {} resolved {}", rule.name(), resolved.get());
                return resolved;
            }
        }
        return Optional.empty();
    }
}
