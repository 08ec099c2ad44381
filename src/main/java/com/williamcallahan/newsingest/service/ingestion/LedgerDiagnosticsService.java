package com.williamcallahan.newsingest.service.ingestion;

import com.williamcallahan.newsingest.domain.date.FullDate;
import com.williamcallahan.newsingest.domain.ingestion.LedgerEntry;
import com.williamcallahan.newsingest.domain.ingestion.RejectionLedger;
import com.williamcallahan.newsingest.domain.ingestion.RejectionReason;
import com.williamcallahan.newsingest.service.date.DateResolver;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Explains why each ledger entry is there by re-checking it against the current source tree.
 */
@Service
public class LedgerDiagnosticsService {
    private static final Logger log = LoggerFactory.getLogger(LedgerDiagnosticsService.class);

    /**
     * What a ledger entry looks like now.
     */
    public enum Finding {
        /** The source file no longer exists. */
        SOURCE_GONE,
        /** The source exists and its name still carries no date. */
        NO_FILENAME_DATE,
        /** The entry was rejected for lacking a date and its name now resolves, so a rerun should accept it. */
        DATE_NOW_RESOLVES,
        /** The name carries a date and the file failed at a later stage. */
        FAILED_AFTER_DATING
    }

    /**
     * Diagnosis for a single ledger entry.
     *
     * @param entry the ledger entry
     * @param finding current state of the source
     * @param filenameDate date the filename resolves to now, if any
     */
    public record Diagnosis(LedgerEntry entry, Finding finding, Optional<FullDate> filenameDate) {}

    private final RejectionLedgerStore ledgerStore;
    private final DateResolver dateResolver;

    public LedgerDiagnosticsService(RejectionLedgerStore ledgerStore, DateResolver dateResolver) {
        this.ledgerStore = ledgerStore;
        this.dateResolver = dateResolver;
    }

    /**
     * Reads a ledger and diagnoses every entry.
     *
     * @param ledgerPath ledger file
     * @param sourceRoot root the ledger paths are relative to
     * @return diagnoses in ledger order
     * @throws IOException if the ledger cannot be read
     */
    public List<Diagnosis> diagnose(Path ledgerPath, Path sourceRoot) throws IOException {
        RejectionLedger ledger = ledgerStore.read(ledgerPath);
        List<Diagnosis> diagnoses = new ArrayList<>(ledger.size());
        for (LedgerEntry entry : ledger.entries()) {
            diagnoses.add(diagnose(entry, sourceRoot));
        }
        Map<Finding, Long> byFinding = diagnoses.stream()
                .collect(Collectors.groupingBy(Diagnosis::finding, () -> new EnumMap<>(Finding.class),
                        Collectors.counting()));
        log.info("Diagnosed {} ledger entries: {}", diagnoses.size(), byFinding);
        return diagnoses;
    }

    Diagnosis diagnose(LedgerEntry entry, Path sourceRoot) {
        Path source = sourceRoot.resolve(entry.relativePath());
        if (!Files.exists(source)) {
            return new Diagnosis(entry, Finding.SOURCE_GONE, Optional.empty());
        }
        Path fileName = source.getFileName();
        Optional<FullDate> date = fileName == null
                ? Optional.empty()
                : dateResolver.resolveFullDateFromFilename(fileName.toString());
        if (date.isEmpty()) {
            return new Diagnosis(entry, Finding.NO_FILENAME_DATE, date);
        }
        boolean rejectedForDate = RejectionReason.NO_DATE.tag().equals(entry.tag());
        return new Diagnosis(entry, rejectedForDate ? Finding.DATE_NOW_RESOLVES : Finding.FAILED_AFTER_DATING, date);
    }
}
