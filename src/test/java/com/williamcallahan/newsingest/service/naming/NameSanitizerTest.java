package com.williamcallahan.newsingest.service.naming;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.List;
import org.junit.jupiter.api.Test;

/**
 * Verifies character restriction, separator collapsing, truncation, and idempotence.
 */
class NameSanitizerTest {

    private final NameSanitizer sanitizer = new NameSanitizer();

    @Test
    void replacesPunctuationAndCollapsesSeparators() {
        assertEquals("Apr_15_2021_post", sanitizer.sanitize("Apr. 15, 2021_post", 1000));
        assertEquals("I_just_want_to_see_things", sanitizer.sanitize("_I just want to see things__", 1000));
        assertEquals("Tomorrow - over 800".replace(' ', '_'), sanitizer.sanitize("Tomorrow - over 800", 1000));
    }

    @Test
    void keepsUnicodeLettersAndDigits() {
        assertEquals("Città_über_2021", sanitizer.sanitize("Città: über 2021!", 1000));
    }

    @Test
    void replacesCombiningMarksAndConnectorPunctuation() {
        assertEquals("Cafe_noir", sanitizer.sanitize("Cafe\u0301 noir", 1000));
        assertEquals("under_tie", sanitizer.sanitize("under\u203Ftie", 1000));
        assertEquals("Caf\u00e9", sanitizer.sanitize("Caf\u00e9\u0301", 1000));
    }

    @Test
    void truncatesAndStripsTrailingSeparator() {
        assertEquals("abc", sanitizer.sanitize("abc def", 4));
        assertEquals("abc_d", sanitizer.sanitize("abc def", 5));
        assertEquals("", sanitizer.sanitize("abc", 0));
        assertEquals("", sanitizer.sanitize("!!!", 10));
    }

    @Test
    void truncationNeverSplitsSurrogatePairs() {
        String stem = "𝐀𝐁𝐂 title";

        assertEquals("𝐀𝐁", sanitizer.sanitize(stem, 2));
    }

    @Test
    void isIdempotentAtFixedLength() {
        List<String> stems = List.of(
                "Apr. 15, 2021_post",
                "  __weird -- name__  ",
                "Jun_2020_A few weeks ago, my wife and I saw a post about Solve Oregon _ r_Portland",
                "a_b_c_d_e_f",
                "Città: über 2021!",
                "Cafe\u0301 noir",
                "𝐀𝐁𝐂 title",
                "");
        for (String stem : stems) {
            for (int length : new int[] {0, 1, 3, 7, 20, 50, 1000}) {
                String once = sanitizer.sanitize(stem, length);
                assertEquals(once, sanitizer.sanitize(once, length), () -> "stem '" + stem + "' at " + length);
            }
        }
    }

    @Test
    void rejectsNegativeLengths() {
        assertThrows(IllegalArgumentException.class, () -> sanitizer.sanitize("x", -1));
    }
}
