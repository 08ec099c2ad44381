package com.williamcallahan.newsingest.service.ingestion;

import com.williamcallahan.newsingest.config.AppProperties;

/**
 * Sequential-or-parallel decision for a batch.
 *
 * <p>Pool startup dominates for small batches, so work fans out only when the candidate count
 * exceeds the threshold and more than one worker is available.</p>
 *
 * @param candidates number of files in the batch
 * @param workers worker count, 1 for sequential runs
 * @param parallel whether tasks run on a worker pool
 */
public record ExecutionPlan(int candidates, int workers, boolean parallel) {

    public ExecutionPlan {
        if (candidates < 0) {
            throw new IllegalArgumentException("candidates must be non-negative");
        }
        if (workers < 1) {
            throw new IllegalArgumentException("workers must be positive");
        }
    }

    /**
     * Plans a batch.
     *
     * @param candidates number of files in the batch
     * @param availableProcessors processors reported by the runtime
     * @param settings ingestion settings (threshold, worker fraction, explicit bound)
     * @return the plan
     */
    public static ExecutionPlan plan(int candidates, int availableProcessors, AppProperties.Ingestion settings) {
        int bound = settings.getMaxWorkers() > 0
                ? settings.getMaxWorkers()
                : Math.max(1, (int) Math.floor(availableProcessors * settings.getWorkerFraction()));
        int workers = Math.max(1, Math.min(bound, candidates));
        boolean parallel = candidates > settings.getParallelThreshold() && workers > 1;
        return new ExecutionPlan(candidates, parallel ? workers : 1, parallel);
    }

    public String mode() {
        return parallel ? "parallel" : "sequential";
    }
}
