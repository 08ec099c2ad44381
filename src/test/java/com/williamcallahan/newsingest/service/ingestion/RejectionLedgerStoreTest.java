package com.williamcallahan.newsingest.service.ingestion;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.williamcallahan.newsingest.config.AppProperties;
import com.williamcallahan.newsingest.domain.ingestion.LedgerEntry;
import com.williamcallahan.newsingest.domain.ingestion.RejectionLedger;
import com.williamcallahan.newsingest.domain.ingestion.SourceSelectionRules;
import com.williamcallahan.newsingest.service.extraction.FileOperationsService;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Set;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class RejectionLedgerStoreTest {

    @TempDir
    Path tempDir;

    private final RejectionLedgerStore store = new RejectionLedgerStore(new FileOperationsService());

    @Test
    void writesSortedEntriesAfterHeader() throws IOException {
        RejectionLedger ledger = new RejectionLedger();
        ledger.record(new LedgerEntry("reddit/z.pdf", "conversion_failed"));
        ledger.record(new LedgerEntry("news/a.txt", "no_date"));
        Path ledgerPath = tempDir.resolve("failed_date_parsing.txt");

        int written = store.write(ledgerPath, new AppProperties.Ingestion().selectionRules(), ledger);

        List<String> lines = Files.readAllLines(ledgerPath);
        assertEquals(2, written);
        assertTrue(lines.get(0).startsWith("#"));
        assertEquals(List.of("news/a.txt\tno_date", "reddit/z.pdf\tconversion_failed"),
                lines.subList(lines.size() - 2, lines.size()));
    }

    @Test
    void headerStatesWhenNothingIsExcluded() {
        SourceSelectionRules rules = new SourceSelectionRules(Set.of("news"), List.of(), List.of(), List.of());

        assertTrue(RejectionLedgerStore.header(rules).contains("# Excluded files: none"));
    }

    @Test
    void readsBackWhatWasWritten() throws IOException {
        RejectionLedger ledger = new RejectionLedger();
        ledger.record(new LedgerEntry("news/a b.txt", "error:write: disk full"));
        ledger.record(new LedgerEntry("news/c.txt", "missing"));
        Path ledgerPath = tempDir.resolve("ledger.txt");
        store.write(ledgerPath, new AppProperties.Ingestion().selectionRules(), ledger);

        assertEquals(ledger.entries(), store.read(ledgerPath).entries());
    }

    @Test
    void untaggedLinesReadAsUnknown() throws IOException {
        Path ledgerPath = Files.writeString(tempDir.resolve("legacy.txt"), "# old format\n\nnews/plain.txt\n");

        assertEquals(List.of(new LedgerEntry("news/plain.txt", "unknown")), store.read(ledgerPath).entries());
    }
}
