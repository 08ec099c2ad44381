package com.williamcallahan.newsingest.service.naming;

import java.util.regex.Pattern;
import org.springframework.stereotype.Component;

/**
 * Reduces an arbitrary file stem to a filesystem-safe, length-capped token.
 *
 * <p>Output contains only Unicode letters and digits, hyphens and single underscores. Combining marks
 * and connector punctuation other than the underscore are replaced. The result never starts or ends
 * with an underscore and is stable under re-sanitization at the same length.</p>
 */
@Component
public class NameSanitizer {

    private static final Pattern DISALLOWED = Pattern.compile("(?U)[^\\p{L}\\p{N}_\\s-]");
    private static final Pattern SEPARATOR_RUN = Pattern.compile("(?U)[\\s_]+");
    private static final String SEPARATOR = "_";

    /**
     * Sanitizes a stem.
     *
     * @param stem file name without extension
     * @param maxLength maximum length in code points
     * @return the sanitized stem, possibly empty
     * @throws IllegalArgumentException when {@code maxLength} is negative
     */
    public String sanitize(String stem, int maxLength) {
        if (maxLength < 0) {
            throw new IllegalArgumentException("maxLength must not be negative: " + maxLength);
        }
        if (stem == null || stem.isEmpty()) {
            return "";
        }
        String restricted = DISALLOWED.matcher(stem).replaceAll(SEPARATOR);
        String collapsed = SEPARATOR_RUN.matcher(restricted).replaceAll(SEPARATOR);
        String trimmed = stripSeparators(collapsed, true);
        if (trimmed.codePointCount(0, trimmed.length()) > maxLength) {
            trimmed = trimmed.substring(0, trimmed.offsetByCodePoints(0, maxLength));
        }
        return stripSeparators(trimmed, false);
    }

    private static String stripSeparators(String value, boolean leading) {
        int start = 0;
        int end = value.length();
        if (leading) {
            while (start < end && value.charAt(start) == '_') {
                start++;
            }
        }
        while (end > start && value.charAt(end - 1) == '_') {
            end--;
        }
        return value.substring(start, end);
    }
}
