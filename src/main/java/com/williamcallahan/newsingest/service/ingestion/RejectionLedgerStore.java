package com.williamcallahan.newsingest.service.ingestion;

import com.williamcallahan.newsingest.domain.ingestion.LedgerEntry;
import com.williamcallahan.newsingest.domain.ingestion.RejectionLedger;
import com.williamcallahan.newsingest.domain.ingestion.SourceSelectionRules;
import com.williamcallahan.newsingest.service.extraction.FileOperationsService;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;
import org.springframework.stereotype.Service;

/**
 * Persists the rejection ledger as a commented, sorted, tab-separated text file.
 *
 * <p>The header names the exclusion rules in force so a reader can tell intentionally excluded
 * files from genuine failures by re-checking paths against the same rules.</p>
 */
@Service
public class RejectionLedgerStore {

    static final String COMMENT_PREFIX = "#";
    static final String UNKNOWN_TAG = "unknown";

    private final FileOperationsService fileOps;

    public RejectionLedgerStore(FileOperationsService fileOps) {
        this.fileOps = fileOps;
    }

    /**
     * Writes the ledger, replacing any previous run's file.
     *
     * @param ledgerPath target file
     * @param rules selection rules in force for the run
     * @param ledger entries to write
     * @return number of entry lines written
     * @throws IOException if the file cannot be written
     */
    public int write(Path ledgerPath, SourceSelectionRules rules, RejectionLedger ledger) throws IOException {
        List<String> lines = new ArrayList<>(header(rules));
        for (LedgerEntry entry : ledger.entries()) {
            lines.add(entry.toLine());
        }
        fileOps.saveTextFile(ledgerPath, String.join("\n", lines) + "\n");
        return ledger.size();
    }

    /**
     * Reads a ledger, skipping comment and blank lines.
     *
     * @param ledgerPath ledger file
     * @return the ledger; lines without a tag are tagged {@code unknown}
     * @throws IOException if the file cannot be read
     */
    public RejectionLedger read(Path ledgerPath) throws IOException {
        RejectionLedger ledger = new RejectionLedger();
        for (String line : Files.readAllLines(ledgerPath, StandardCharsets.UTF_8)) {
            if (line.isBlank() || line.startsWith(COMMENT_PREFIX)) {
                continue;
            }
            int tab = line.indexOf('\t');
            if (tab < 0) {
                ledger.record(new LedgerEntry(line.trim(), UNKNOWN_TAG));
            } else {
                String tag = line.substring(tab + 1).trim();
                ledger.record(new LedgerEntry(line.substring(0, tab), tag.isEmpty() ? UNKNOWN_TAG : tag));
            }
        }
        return ledger;
    }

    static List<String> header(SourceSelectionRules rules) {
        List<String> header = new ArrayList<>();
        header.add("# Source files that were not normalized (failed date parsing, conversion, or went missing)");
        header.add("# Format: relative/path<TAB>reason (no_date, conversion_failed, source_missing, error:<message>, missing)");
        header.add("# Included top-level folders: "
                + rules.includedFolders().stream().sorted().collect(Collectors.joining(", ")));
        List<String> exclusions = rules.describe();
        if (exclusions.isEmpty()) {
            header.add("# Excluded files: none");
        } else {
            header.add("# Excluded files (intentionally skipped, not listed below):");
            for (String exclusion : exclusions) {
                header.add("#   " + exclusion);
            }
        }
        return header;
    }
}
