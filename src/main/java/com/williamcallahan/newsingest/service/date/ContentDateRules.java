package com.williamcallahan.newsingest.service.date;

import static com.williamcallahan.newsingest.service.date.DateParts.disambiguated;
import static com.williamcallahan.newsingest.service.date.DateParts.expandTwoDigitYear;
import static com.williamcallahan.newsingest.service.date.DateParts.full;
import static com.williamcallahan.newsingest.service.date.DateParts.namedMonth;
import static com.williamcallahan.newsingest.service.date.DateParts.number;
import static com.williamcallahan.newsingest.service.date.DateParts.partial;

import com.williamcallahan.newsingest.domain.date.ResolvedDate;
import java.util.List;
import java.util.Optional;
import java.util.OptionalInt;
import java.util.regex.MatchResult;
import java.util.regex.Pattern;

/**
 * Document-body date conventions in priority order.
 *
 * <p>Broadcast transcripts often state only weekday, month and day; that rule yields a
 * {@link com.williamcallahan.newsingest.domain.date.PartialDate} which the caller completes
 * with a year from the filename.</p>
 */
public final class ContentDateRules {

    private static final String ORDINAL_SUFFIX = "(?:st|nd|rd|th)?";

    public static final DateRule DATE_FIELD = new PatternDateRule(
            "date-field",
            Pattern.compile("(?<![a-z])date:\\s*(\\d{4})-(\\d{2})-(\\d{2})(?!\\d)", Pattern.CASE_INSENSITIVE),
            match -> full(number(match.group(1)), number(match.group(2)), number(match.group(3))));

    public static final DateRule SLASHED = new PatternDateRule(
            "slashed",
            Pattern.compile("(?<![\\d/])(\\d{1,2})/(\\d{1,2})/(\\d{4}|\\d{2})(?![\\d/])"),
            ContentDateRules::slashed);

    public static final DateRule DAY_MONTH_NAME_YEAR = new PatternDateRule(
            "day-month-name-year",
            Pattern.compile(
                    "(?<!\\d)(\\d{1,2})" + ORDINAL_SUFFIX + "\\s+(" + MonthNames.MONTH_ALTERNATION
                            + ")(?![a-z])\\.?,?\\s+(\\d{4})(?!\\d)",
                    Pattern.CASE_INSENSITIVE),
            match -> namedMonth(match.group(2), number(match.group(3)), number(match.group(1))));

    public static final DateRule MONTH_NAME_DAY_YEAR = new PatternDateRule(
            "month-name-day-year",
            Pattern.compile(
                    "(?<![a-z])(" + MonthNames.MONTH_ALTERNATION + ")(?![a-z])\\.?\\s+(\\d{1,2})" + ORDINAL_SUFFIX
                            + ",?\\s+(\\d{4})(?!\\d)",
                    Pattern.CASE_INSENSITIVE),
            match -> namedMonth(match.group(1), number(match.group(3)), number(match.group(2))));

    public static final DateRule UPDATED_OR_PUBLISHED = new PatternDateRule(
            "updated-or-published",
            Pattern.compile(
                    "(?<![a-z])(?:updated|published)\\s*:?\\s*(?:on\\s+)?(\\d{4})[-/.](\\d{1,2})[-/.](\\d{1,2})(?!\\d)",
                    Pattern.CASE_INSENSITIVE),
            match -> full(number(match.group(1)), number(match.group(2)), number(match.group(3))));

    public static final DateRule BROADCAST = new PatternDateRule(
            "broadcast",
            Pattern.compile(
                    "(?<![a-z])broadcast\\s*:\\s*(?:" + MonthNames.WEEKDAY_ALTERNATION + ")(?![a-z])\\.?,?\\s+("
                            + MonthNames.MONTH_ALTERNATION + ")(?![a-z])\\.?\\s+(\\d{1,2})" + ORDINAL_SUFFIX
                            + "(?!\\d)(?:,?\\s+(\\d{4})(?!\\d))?",
                    Pattern.CASE_INSENSITIVE),
            ContentDateRules::broadcast);

    private ContentDateRules() {}

    /**
     * Returns the content rules, highest priority first.
     */
    public static List<DateRule> defaults() {
        return List.of(DATE_FIELD, SLASHED, DAY_MONTH_NAME_YEAR, MONTH_NAME_DAY_YEAR, UPDATED_OR_PUBLISHED, BROADCAST);
    }

    private static Optional<ResolvedDate> slashed(MatchResult match) {
        String yearText = match.group(3);
        int year = yearText.length() == 2 ? expandTwoDigitYear(number(yearText)) : number(yearText);
        return disambiguated(number(match.group(1)), number(match.group(2)), year);
    }

    private static Optional<ResolvedDate> broadcast(MatchResult match) {
        int day = number(match.group(2));
        String yearText = match.group(3);
        if (yearText != null) {
            return namedMonth(match.group(1), number(yearText), day);
        }
        OptionalInt month = MonthNames.monthNumber(match.group(1));
        return month.isPresent() ? partial(month.getAsInt(), day) : Optional.empty();
    }
}
