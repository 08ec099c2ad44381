package com.williamcallahan.newsingest.service.date;

import com.williamcallahan.newsingest.domain.date.ResolvedDate;
import java.util.Optional;

/**
 * One entry in an ordered date-resolution chain.
 *
 * <p>A rule either produces a validated date or reports no match; it never throws for
 * malformed input. Chains stop at the first rule that produces a date.</p>
 */
public interface DateRule {

    /**
     * Returns a short identifier used in logs and tests.
     */
    String name();

    /**
     * Attempts to resolve a date from the input.
     *
     * @param input filename or document text
     * @return the validated date, or empty when the rule does not apply
     */
    Optional<ResolvedDate> resolve(CharSequence input);
}
