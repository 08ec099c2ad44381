package com.williamcallahan.newsingest.domain.ingestion;

import java.nio.file.Path;
import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;

/**
 * Summary of a normalization batch so operators can assess partial failures.
 *
 * @param candidates number of included source files
 * @param accepted number of files present in the destination tree after the run
 * @param rejectedByReason rejection counts per reason, including {@link RejectionReason#MISSING}
 * @param ledgerSize number of lines written to the ledger
 * @param parallel whether the batch fanned out across a worker pool
 * @param workers number of workers used
 * @param ledgerPath where the ledger was written
 */
public record NormalizationRunSummary(
        int candidates,
        int accepted,
        Map<RejectionReason, Integer> rejectedByReason,
        int ledgerSize,
        boolean parallel,
        int workers,
        Path ledgerPath) {

    public NormalizationRunSummary {
        if (candidates < 0 || accepted < 0 || ledgerSize < 0) {
            throw new IllegalArgumentException("Counts must be non-negative");
        }
        Objects.requireNonNull(ledgerPath, "ledgerPath");
        EnumMap<RejectionReason, Integer> counts = new EnumMap<>(RejectionReason.class);
        if (rejectedByReason != null) {
            counts.putAll(rejectedByReason);
        }
        rejectedByReason = Map.copyOf(counts);
    }

    public int rejected(RejectionReason reason) {
        return rejectedByReason.getOrDefault(reason, 0);
    }

    public int trulyMissing() {
        return rejected(RejectionReason.MISSING);
    }

    public int totalRejected() {
        return rejectedByReason.values().stream().mapToInt(Integer::intValue).sum();
    }

    /**
     * Returns "success" when nothing was rejected, otherwise "partial-success".
     */
    public String status() {
        return totalRejected() == 0 ? "success" : "partial-success";
    }
}
