package com.williamcallahan.newsingest.service.date;

import com.williamcallahan.newsingest.domain.date.FullDate;
import com.williamcallahan.newsingest.domain.date.PartialDate;
import com.williamcallahan.newsingest.domain.date.ResolvedDate;
import java.util.Optional;
import java.util.OptionalInt;

/**
 * Validation and canonicalization helpers for rule extractors.
 */
final class DateParts {

    static final int TWO_DIGIT_YEAR_PIVOT = 50;

    private DateParts() {}

    static Optional<ResolvedDate> full(int year, int month, int day) {
        return FullDate.ofValidated(year, month, day).map(ResolvedDate.class::cast);
    }

    static Optional<ResolvedDate> partial(int month, int day) {
        if (!ResolvedDate.isValidMonth(month) || !ResolvedDate.isValidDay(day)) {
            return Optional.empty();
        }
        return Optional.of(new PartialDate(month, day));
    }

    /**
     * Orders two numeric tokens into month and day.
     *
     * <p>The first token is the month when it is a valid month. Otherwise the second token is the
     * month when it is valid. Otherwise the pair is rejected.</p>
     */
    static Optional<ResolvedDate> disambiguated(int first, int second, int year) {
        if (ResolvedDate.isValidMonth(first)) {
            return full(year, first, second);
        }
        if (ResolvedDate.isValidMonth(second)) {
            return full(year, second, first);
        }
        return Optional.empty();
    }

    /**
     * Expands a two-digit year: below 50 is 20yy, otherwise 19yy.
     */
    static int expandTwoDigitYear(int twoDigitYear) {
        return twoDigitYear < TWO_DIGIT_YEAR_PIVOT ? 2000 + twoDigitYear : 1900 + twoDigitYear;
    }

    static Optional<ResolvedDate> namedMonth(String monthToken, int year, int day) {
        OptionalInt month = MonthNames.monthNumber(monthToken);
        return month.isPresent() ? full(year, month.getAsInt(), day) : Optional.empty();
    }

    static int number(String digits) {
        return Integer.parseInt(digits);
    }
}
