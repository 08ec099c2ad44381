package com.williamcallahan.newsingest.service.date;

import com.williamcallahan.newsingest.domain.date.ResolvedDate;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Function;
import java.util.regex.MatchResult;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Date rule backed by a regular expression and an extractor that validates each match.
 *
 * <p>Every match of the pattern is offered to the extractor in order; the first one that
 * validates wins. When no match validates the rule reports no date and the chain moves on.</p>
 *
 * @param name rule identifier
 * @param pattern candidate pattern
 * @param extractor validates and canonicalizes a match
 */
public record PatternDateRule(String name, Pattern pattern, Function<MatchResult, Optional<ResolvedDate>> extractor)
        implements DateRule {

    public PatternDateRule {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(pattern, "pattern");
        Objects.requireNonNull(extractor, "extractor");
    }

    @Override
    public Optional<ResolvedDate> resolve(CharSequence input) {
        if (input == null || input.length() == 0) {
            return Optional.empty();
        }
        Matcher matcher = pattern.matcher(input);
        while (matcher.find()) {
            Optional<ResolvedDate> candidate = extractor.apply(matcher.toMatchResult());
            if (candidate.isPresent()) {
                return candidate;
            }
        }
        return Optional.empty();
    }
}
