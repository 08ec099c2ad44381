package com.williamcallahan.newsingest.domain.ingestion;

/**
 * Why a source file did not produce a normalized document.
 */
public enum RejectionReason {
    /** No filename rule produced a date. */
    NO_DATE("no_date"),
    /** Text extraction or conversion produced nothing usable. */
    CONVERSION_FAILED("conversion_failed"),
    /** The file vanished between enumeration and processing. */
    SOURCE_MISSING("source_missing"),
    /** Any other per-file failure; the ledger tag carries the message. */
    ERROR("error"),
    /** Never reported by its task; found only by the reconciliation pass. */
    MISSING("missing");

    private final String tag;

    RejectionReason(String tag) {
        this.tag = tag;
    }

    public String tag() {
        return tag;
    }
}
