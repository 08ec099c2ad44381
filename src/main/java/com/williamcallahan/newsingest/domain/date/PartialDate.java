package com.williamcallahan.newsingest.domain.date;

import java.util.Locale;

/**
 * Month/day pair found without a year, e.g. a broadcast line reading "Monday, April 5".
 *
 * @param month month of year, 1-12
 * @param day day of month, 1-31
 */
public record PartialDate(int month, int day) implements ResolvedDate {

    public PartialDate {
        if (!ResolvedDate.isValidMonth(month)) {
            throw new IllegalArgumentException("Month out of range: " + month);
        }
        if (!ResolvedDate.isValidDay(day)) {
            throw new IllegalArgumentException("Day out of range: " + day);
        }
    }

    /**
     * Completes this date with a year borrowed from another source.
     *
     * @param year year taken from the filename or another trusted source
     * @return the full date
     */
    public FullDate completeWith(int year) {
        return new FullDate(year, month, day);
    }

    @Override
    public String toString() {
        return String.format(Locale.ROOT, "--%02d-%02d", month, day);
    }
}
