package com.williamcallahan.newsingest.domain.ingestion;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.nio.file.Path;
import java.util.List;
import org.junit.jupiter.api.Test;

/**
 * Verifies ledger ordering, de-duplication, and tag rendering.
 */
class RejectionLedgerTest {

    @Test
    void keepsEntriesSortedAndUniqueByPath() {
        RejectionLedger ledger = new RejectionLedger();

        assertTrue(ledger.record(new LedgerEntry("reddit/b.pdf", "no_date")));
        assertTrue(ledger.record(new LedgerEntry("news/a.txt", "conversion_failed")));
        assertFalse(ledger.record(new LedgerEntry("reddit/b.pdf", "missing")));

        assertEquals(List.of("news/a.txt", "reddit/b.pdf"),
                ledger.entries().stream().map(LedgerEntry::relativePath).toList());
        assertEquals("no_date", ledger.entries().get(1).tag());
    }

    @Test
    void flattensErrorMessagesOntoOneLine() {
        LedgerEntry entry = LedgerEntry.of("news/a.txt", RejectionReason.ERROR, "write: IOException:\n disk\tfull");

        assertEquals("news/a.txt\terror:write: IOException: disk full", entry.toLine());
    }

    @Test
    void rejectedOutcomeCarriesItsLedgerTag() {
        SourceFile source = new SourceFile(
                Path.of("/data/raw/news/a.pdf").toAbsolutePath(), Path.of("news", "a.pdf"), SourceFileType.PDF);

        FileNormalizationOutcome outcome =
                FileNormalizationOutcome.rejectedFile(source, RejectionReason.CONVERSION_FAILED, "extract: empty");

        assertFalse(outcome.accepted());
        assertEquals("news/a.pdf\tconversion_failed", outcome.ledgerEntry().orElseThrow().toLine());
    }

    @Test
    void reconciliationReportListsMissingFilesSorted() {
        ReconciliationReport report = new ReconciliationReport(
                java.util.Set.of("a", "b", "c"), java.util.Set.of("b"), List.of("c", "a"));

        assertFalse(report.balanced());
        assertEquals(List.of("a", "c"), report.trulyMissing());
        assertEquals("a\tmissing", report.missingEntries().get(0).toLine());
    }
}
