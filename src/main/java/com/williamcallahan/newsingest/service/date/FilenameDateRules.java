package com.williamcallahan.newsingest.service.date;

import static com.williamcallahan.newsingest.service.date.DateParts.disambiguated;
import static com.williamcallahan.newsingest.service.date.DateParts.expandTwoDigitYear;
import static com.williamcallahan.newsingest.service.date.DateParts.full;
import static com.williamcallahan.newsingest.service.date.DateParts.namedMonth;
import static com.williamcallahan.newsingest.service.date.DateParts.number;

import java.util.List;
import java.util.regex.Pattern;

/**
 * Filename date conventions in priority order.
 *
 * <p>Filenames come from several independent conventions, so the order matters: the canonical
 * {@code YYYY-MM-DD_} prefix is trusted first and month-only forms are tried last. Insert new
 * conventions at the position that reflects how much they should be trusted.</p>
 */
public final class FilenameDateRules {

    private static final int DEFAULT_DAY = 1;

    public static final DateRule CANONICAL_PREFIX = new PatternDateRule(
            "canonical-prefix",
            Pattern.compile("^(\\d{4})-(\\d{2})-(\\d{2})_"),
            match -> full(number(match.group(1)), number(match.group(2)), number(match.group(3))));

    public static final DateRule YEAR_MONTH_DAY = new PatternDateRule(
            "year-month-day",
            Pattern.compile("(?<!\\d)(\\d{4})[-_.](\\d{2})[-_.](\\d{2})(?!\\d)"),
            match -> full(number(match.group(1)), number(match.group(2)), number(match.group(3))));

    public static final DateRule MONTH_DAY_YEAR = new PatternDateRule(
            "month-day-year",
            Pattern.compile("(?<!\\d)(\\d{1,2})[-_](\\d{1,2})[-_](\\d{4})(?!\\d)"),
            match -> disambiguated(number(match.group(1)), number(match.group(2)), number(match.group(3))));

    public static final DateRule MONTH_DAY_SHORT_YEAR = new PatternDateRule(
            "month-day-short-year",
            Pattern.compile("(?<!\\d)(\\d{1,2})[-_](\\d{1,2})[-_](\\d{2})(?!\\d)"),
            match -> disambiguated(
                    number(match.group(1)), number(match.group(2)), expandTwoDigitYear(number(match.group(3)))));

    public static final DateRule MONTH_NAME_DAY_YEAR = new PatternDateRule(
            "month-name-day-year",
            Pattern.compile(
                    "(?<![a-z])(" + MonthNames.MONTH_ALTERNATION + ")(?![a-z])\\.?\\s+(\\d{1,2}),?\\s+(\\d{4})(?!\\d)",
                    Pattern.CASE_INSENSITIVE),
            match -> namedMonth(match.group(1), number(match.group(3)), number(match.group(2))));

    public static final DateRule MONTH_NAME_YEAR = new PatternDateRule(
            "month-name-year",
            Pattern.compile(
                    "(?<![a-z])(" + MonthNames.MONTH_ALTERNATION + ")(?![a-z])\\.?[-_](\\d{4})(?!\\d)",
                    Pattern.CASE_INSENSITIVE),
            match -> namedMonth(match.group(1), number(match.group(2)), DEFAULT_DAY));

    public static final DateRule MONTH_YEAR = new PatternDateRule(
            "month-year",
            Pattern.compile("(?<!\\d)(\\d{1,2})[-_](\\d{4})(?!\\d)"),
            match -> full(number(match.group(2)), number(match.group(1)), DEFAULT_DAY));

    public static final DateRule YEAR_MONTH = new PatternDateRule(
            "year-month",
            Pattern.compile("(?<!\\d)(\\d{4})[-_.](\\d{2})(?!\\d)"),
            match -> full(number(match.group(1)), number(match.group(2)), DEFAULT_DAY));

    private FilenameDateRules() {}

    /**
     * Returns the filename rules, highest priority first.
     */
    public static List<DateRule> defaults() {
        return List.of(
                CANONICAL_PREFIX,
                YEAR_MONTH_DAY,
                MONTH_DAY_YEAR,
                MONTH_DAY_SHORT_YEAR,
                MONTH_NAME_DAY_YEAR,
                MONTH_NAME_YEAR,
                MONTH_YEAR,
                YEAR_MONTH);
    }
}
