package com.williamcallahan.newsingest.domain.date;

/**
 * Calendar date recovered from a filename or a document body.
 *
 * <p>A {@link FullDate} is authoritative on its own. A {@link PartialDate} lacks a year and must be
 * completed from a second source (normally the filename) before it can stamp a document.</p>
 */
public sealed interface ResolvedDate permits FullDate, PartialDate {

    int MIN_MONTH = 1;
    int MAX_MONTH = 12;
    int MIN_DAY = 1;
    int MAX_DAY = 31;

    int month();

    int day();

    /**
     * Checks a month value against the 1-12 range.
     *
     * @param month candidate month
     * @return true when the month is in range
     */
    static boolean isValidMonth(int month) {
        return month >= MIN_MONTH && month <= MAX_MONTH;
    }

    /**
     * Checks a day value against the 1-31 range.
     *
     * @param day candidate day of month
     * @return true when the day is in range
     */
    static boolean isValidDay(int day) {
        return day >= MIN_DAY && day <= MAX_DAY;
    }
}
