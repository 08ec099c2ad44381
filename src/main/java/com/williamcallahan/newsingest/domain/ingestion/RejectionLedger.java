package com.williamcallahan.newsingest.domain.ingestion;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;

/**
 * Sorted, duplicate-free record of every source file that did not reach the destination tree.
 *
 * <p>Entries are keyed by relative path; the first tag recorded for a path wins.</p>
 */
public final class RejectionLedger {

    private final Map<String, LedgerEntry> entriesByPath = new TreeMap<>();

    /**
     * Records an entry unless its path is already present.
     *
     * @param entry ledger entry
     * @return true when the entry was added
     */
    public boolean record(LedgerEntry entry) {
        Objects.requireNonNull(entry, "entry");
        return entriesByPath.putIfAbsent(entry.relativePath(), entry) == null;
    }

    public void recordAll(Collection<LedgerEntry> entries) {
        entries.forEach(this::record);
    }

    /**
     * Returns entries sorted lexicographically by path.
     */
    public List<LedgerEntry> entries() {
        return List.copyOf(new ArrayList<>(entriesByPath.values()));
    }

    public int size() {
        return entriesByPath.size();
    }
}
