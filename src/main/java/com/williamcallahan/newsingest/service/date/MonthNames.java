package com.williamcallahan.newsingest.service.date;

import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.OptionalInt;
import java.util.stream.Collectors;

/**
 * English month and weekday dictionaries shared by the filename and content rules.
 */
final class MonthNames {

    private static final List<String> FULL_NAMES = List.of(
            "january", "february", "march", "april", "may", "june",
            "july", "august", "september", "october", "november", "december");

    private static final Map<String, Integer> MONTHS = buildMonths();

    private static final List<String> WEEKDAYS = List.of(
            "monday", "tuesday", "wednesday", "thursday", "friday", "saturday", "sunday",
            "mon", "tue", "tues", "wed", "thu", "thur", "thurs", "fri", "sat", "sun");

    /** Regex alternation over every month spelling, longest first. Use with CASE_INSENSITIVE. */
    static final String MONTH_ALTERNATION = alternation(List.copyOf(MONTHS.keySet()));

    /** Regex alternation over every weekday spelling, longest first. Use with CASE_INSENSITIVE. */
    static final String WEEKDAY_ALTERNATION = alternation(WEEKDAYS);

    private MonthNames() {}

    /**
     * Looks up a month by full name or abbreviation, ignoring case and a trailing period.
     *
     * @param token month text such as "Apr." or "september"
     * @return month number 1-12, or empty when the token is not a month
     */
    static OptionalInt monthNumber(String token) {
        if (token == null) {
            return OptionalInt.empty();
        }
        String normalized = token.trim().toLowerCase(Locale.ROOT);
        if (normalized.endsWith(".")) {
            normalized = normalized.substring(0, normalized.length() - 1);
        }
        Integer month = MONTHS.get(normalized);
        return month == null ? OptionalInt.empty() : OptionalInt.of(month);
    }

    private static Map<String, Integer> buildMonths() {
        Map<String, Integer> months = new LinkedHashMap<>();
        for (int index = 0; index < FULL_NAMES.size(); index++) {
            String fullName = FULL_NAMES.get(index);
            months.put(fullName, index + 1);
            months.put(fullName.substring(0, 3), index + 1);
        }
        months.put("sept", 9);
        return Map.copyOf(months);
    }

    private static String alternation(List<String> words) {
        return words.stream()
                .sorted(Comparator.comparingInt(String::length).reversed().thenComparing(Comparator.naturalOrder()))
                .collect(Collectors.joining("|"));
    }
}
