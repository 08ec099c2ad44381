package com.williamcallahan.newsingest.domain.ingestion;

import java.util.List;
import java.util.Set;

/**
 * Result of diffing the source universe against what the batch accounted for.
 *
 * @param universe relative keys of every included source file
 * @param accounted relative keys that were accepted, rejected, or found in the destination tree
 * @param trulyMissing relative keys in the universe that nothing accounted for, sorted
 */
public record ReconciliationReport(Set<String> universe, Set<String> accounted, List<String> trulyMissing) {

    public ReconciliationReport {
        universe = Set.copyOf(universe);
        accounted = Set.copyOf(accounted);
        trulyMissing = trulyMissing.stream().sorted().toList();
    }

    /**
     * Returns true when every source file is accounted for.
     */
    public boolean balanced() {
        return trulyMissing.isEmpty();
    }

    /**
     * Returns the missing files as ledger entries tagged {@code missing}.
     */
    public List<LedgerEntry> missingEntries() {
        return trulyMissing.stream()
                .map(key -> new LedgerEntry(key, RejectionReason.MISSING.tag()))
                .toList();
    }
}
