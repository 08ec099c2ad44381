package com.williamcallahan.newsingest.domain.date;

import java.util.Objects;
import java.util.Optional;

/**
 * Result of comparing the date a filename carries against the date found in the document body.
 *
 * @param fileName name that was resolved
 * @param filenameDate date resolved from the filename, if any
 * @param contentDate date resolved from the content (already completed with the filename year), if any
 */
public record DateCrossCheck(String fileName, Optional<FullDate> filenameDate, Optional<FullDate> contentDate) {

    public DateCrossCheck {
        Objects.requireNonNull(fileName, "fileName");
        Objects.requireNonNull(filenameDate, "filenameDate");
        Objects.requireNonNull(contentDate, "contentDate");
    }

    /**
     * Returns the date that should stamp the document: the content date wins over the filename date.
     */
    public Optional<FullDate> effectiveDate() {
        return contentDate.isPresent() ? contentDate : filenameDate;
    }

    /**
     * Returns true when both sources produced a date and the dates differ.
     */
    public boolean disagreement() {
        return filenameDate.isPresent()
                && contentDate.isPresent()
                && !filenameDate.get().equals(contentDate.get());
    }
}
