package com.williamcallahan.newsingest.domain.ingestion;

/**
 * One line of the rejection ledger.
 *
 * @param relativePath source path relative to the source root, slash-separated
 * @param tag reason tag such as {@code no_date} or {@code error:<message>}
 */
public record LedgerEntry(String relativePath, String tag) {

    private static final int MAX_MESSAGE_LENGTH = 160;

    public LedgerEntry {
        if (relativePath == null || relativePath.isBlank()) {
            throw new IllegalArgumentException("Ledger entry path is required");
        }
        if (tag == null || tag.isBlank()) {
            throw new IllegalArgumentException("Ledger entry tag is required");
        }
    }

    /**
     * Builds an entry for a rejection, flattening the message onto one line for {@code error} tags.
     *
     * @param relativePath slash-separated relative path
     * @param reason rejection category
     * @param detail failure message
     * @return the ledger entry
     */
    public static LedgerEntry of(String relativePath, RejectionReason reason, String detail) {
        if (reason != RejectionReason.ERROR) {
            return new LedgerEntry(relativePath, reason.tag());
        }
        String message = detail == null ? "" : detail.replaceAll("\\s*[\\r\\n\\t]+\\s*", " ").trim();
        if (message.length() > MAX_MESSAGE_LENGTH) {
            message = message.substring(0, MAX_MESSAGE_LENGTH);
        }
        return new LedgerEntry(relativePath, reason.tag() + ":" + message);
    }

    /**
     * Renders the entry as a ledger line.
     */
    public String toLine() {
        return relativePath + "\t" + tag;
    }
}
