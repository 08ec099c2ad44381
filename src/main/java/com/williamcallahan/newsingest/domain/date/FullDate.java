package com.williamcallahan.newsingest.domain.date;

import java.util.Locale;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Validated year/month/day triple rendered as {@code YYYY-MM-DD}.
 *
 * <p>Only the month (1-12) and day (1-31) ranges are enforced; calendar validity such as
 * February 30 is deliberately not checked.</p>
 *
 * @param year four-digit year
 * @param month month of year, 1-12
 * @param day day of month, 1-31
 */
public record FullDate(int year, int month, int day) implements ResolvedDate {

    private static final Pattern CANONICAL = Pattern.compile("(\\d{4})-(\\d{2})-(\\d{2})");
    private static final int MIN_YEAR = 1;
    private static final int MAX_YEAR = 9999;

    public FullDate {
        if (year < MIN_YEAR || year > MAX_YEAR) {
            throw new IllegalArgumentException("Year out of range: " + year);
        }
        if (!ResolvedDate.isValidMonth(month)) {
            throw new IllegalArgumentException("Month out of range: " + month);
        }
        if (!ResolvedDate.isValidDay(day)) {
            throw new IllegalArgumentException("Day out of range: " + day);
        }
    }

    /**
     * Builds a date when all components are in range.
     *
     * @param year candidate year
     * @param month candidate month
     * @param day candidate day
     * @return the date, or empty when any component is out of range
     */
    public static Optional<FullDate> ofValidated(int year, int month, int day) {
        if (year < MIN_YEAR || year > MAX_YEAR
                || !ResolvedDate.isValidMonth(month)
                || !ResolvedDate.isValidDay(day)) {
            return Optional.empty();
        }
        return Optional.of(new FullDate(year, month, day));
    }

    /**
     * Parses an exact {@code YYYY-MM-DD} string.
     *
     * @param canonical date text
     * @return the parsed date, or empty when the text is not a valid canonical date
     */
    public static Optional<FullDate> parseCanonical(String canonical) {
        if (canonical == null) {
            return Optional.empty();
        }
        Matcher matcher = CANONICAL.matcher(canonical.trim());
        if (!matcher.matches()) {
            return Optional.empty();
        }
        return ofValidated(
                Integer.parseInt(matcher.group(1)),
                Integer.parseInt(matcher.group(2)),
                Integer.parseInt(matcher.group(3)));
    }

    /**
     * Renders the date as {@code YYYY-MM-DD}.
     */
    public String canonical() {
        return String.format(Locale.ROOT, "%04d-%02d-%02d", year, month, day);
    }

    @Override
    public String toString() {
        return canonical();
    }
}
