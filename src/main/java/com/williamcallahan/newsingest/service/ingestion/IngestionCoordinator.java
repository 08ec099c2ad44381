package com.williamcallahan.newsingest.service.ingestion;

import com.google.common.util.concurrent.MoreExecutors;
import com.google.common.util.concurrent.ThreadFactoryBuilder;
import com.williamcallahan.newsingest.config.AppProperties;
import com.williamcallahan.newsingest.domain.ingestion.FileNormalizationOutcome;
import com.williamcallahan.newsingest.domain.ingestion.NormalizationRunSummary;
import com.williamcallahan.newsingest.domain.ingestion.ReconciliationReport;
import com.williamcallahan.newsingest.domain.ingestion.RejectionLedger;
import com.williamcallahan.newsingest.domain.ingestion.RejectionReason;
import com.williamcallahan.newsingest.domain.ingestion.SourceFile;
import com.williamcallahan.newsingest.domain.ingestion.SourceSelectionRules;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.HashSet;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletionService;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorCompletionService;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.function.IntSupplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

/**
 * Runs a normalization batch over the source tree and reconciles the result.
 *
 * <p>Files are enumerated once, fanned out one task per file, and merged on the calling thread
 * in source-path order. After the merge the reconciliation pass recomputes the source universe
 * and folds anything unreported into the ledger, so every included source file ends up either in
 * the destination tree or in the ledger. Only setup problems escape as exceptions.</p>
 */
@Service
public class IngestionCoordinator {
    private static final Logger log = LoggerFactory.getLogger(IngestionCoordinator.class);
    private static final Logger INGESTION_LOG = LoggerFactory.getLogger("INGESTION");

    private static final String WORKER_NAME_FORMAT = "normalize-%d";

    private final AppProperties appProperties;
    private final SourceTreeScanner scanner;
    private final SourceFileNormalizer normalizer;
    private final ReconciliationService reconciliationService;
    private final RejectionLedgerStore ledgerStore;
    private final IntSupplier availableProcessors;

    @Autowired
    public IngestionCoordinator(
            AppProperties appProperties,
            SourceTreeScanner scanner,
            SourceFileNormalizer normalizer,
            ReconciliationService reconciliationService,
            RejectionLedgerStore ledgerStore) {
        this(appProperties, scanner, normalizer, reconciliationService, ledgerStore,
                () -> Runtime.getRuntime().availableProcessors());
    }

    IngestionCoordinator(
            AppProperties appProperties,
            SourceTreeScanner scanner,
            SourceFileNormalizer normalizer,
            ReconciliationService reconciliationService,
            RejectionLedgerStore ledgerStore,
            IntSupplier availableProcessors) {
        this.appProperties = Objects.requireNonNull(appProperties, "appProperties");
        this.scanner = Objects.requireNonNull(scanner, "scanner");
        this.normalizer = Objects.requireNonNull(normalizer, "normalizer");
        this.reconciliationService = Objects.requireNonNull(reconciliationService, "reconciliationService");
        this.ledgerStore = Objects.requireNonNull(ledgerStore, "ledgerStore");
        this.availableProcessors = Objects.requireNonNull(availableProcessors, "availableProcessors");
    }

    /**
     * Runs a batch over the configured source and destination roots.
     *
     * @return batch summary
     * @throws IngestionSetupException if the batch cannot start
     */
    public NormalizationRunSummary run() {
        AppProperties.Ingestion settings = appProperties.getIngestion();
        return run(settings.sourceRootPath(), settings.destinationRootPath());
    }

    /**
     * Runs a batch over explicit roots.
     *
     * @param sourceRoot root of the source tree
     * @param destinationRoot root of the normalized tree, created when absent
     * @return batch summary
     * @throws IngestionSetupException if the batch cannot start
     */
    public NormalizationRunSummary run(Path sourceRoot, Path destinationRoot) {
        Path source = sourceRoot.toAbsolutePath().normalize();
        Path destination = destinationRoot.toAbsolutePath().normalize();
        prepareRoots(source, destination);

        AppProperties.Ingestion settings = appProperties.getIngestion();
        SourceSelectionRules rules = settings.selectionRules();
        List<SourceFile> candidates;
        try {
            candidates = scanner.scan(source, rules);
        } catch (IOException scanException) {
            throw new IngestionSetupException("Cannot enumerate source tree " + source, scanException);
        } catch (UncheckedIOException scanException) {
            throw new IngestionSetupException("Cannot enumerate source tree " + source, scanException.getCause());
        }

        ExecutionPlan plan = ExecutionPlan.plan(candidates.size(), availableProcessors.getAsInt(), settings);
        INGESTION_LOG.info(
                "[INGESTION] {} candidate files under {} ({} mode, {} workers)",
                candidates.size(), source, plan.mode(), plan.workers());

        List<FileNormalizationOutcome> outcomes = new ArrayList<>();
        List<SourceFile> work = claimDestinations(candidates, destination, outcomes);
        outcomes.addAll(execute(work, destination, plan));
        if (outcomes.size() != candidates.size()) {
            log.warn("!!! Expected {} per-file results but received {}; {} file(s) were dropped without a report."
                            + " Inspect the reconciliation output in the ledger.",
                    candidates.size(), outcomes.size(), candidates.size() - outcomes.size());
        }
        outcomes.sort(Comparator.comparing(outcome -> outcome.source().relativeKey()));

        Set<String> acceptedKeys = new HashSet<>();
        Set<String> rejectedKeys = new HashSet<>();
        RejectionLedger ledger = new RejectionLedger();
        Map<RejectionReason, Integer> rejectedByReason = new EnumMap<>(RejectionReason.class);
        for (FileNormalizationOutcome outcome : outcomes) {
            if (outcome.accepted()) {
                acceptedKeys.add(outcome.source().relativeKey());
            } else {
                rejectedKeys.add(outcome.source().relativeKey());
                FileNormalizationOutcome.Rejected rejected = (FileNormalizationOutcome.Rejected) outcome;
                rejectedByReason.merge(rejected.reason(), 1, Integer::sum);
                outcome.ledgerEntry().ifPresent(ledger::record);
            }
        }

        Optional<ReconciliationReport> report = reconcile(source, destination, rules, acceptedKeys, rejectedKeys);
        if (report.isPresent() && !report.get().balanced()) {
            List<String> trulyMissing = report.get().trulyMissing();
            log.warn("!!! Reconciliation found {} source file(s) missing from both the destination tree and the"
                    + " per-file results: {}", trulyMissing.size(), trulyMissing);
            ledger.recordAll(report.get().missingEntries());
            rejectedByReason.put(RejectionReason.MISSING, trulyMissing.size());
        }

        Path ledgerPath = ledgerPath(destination);
        int ledgerSize;
        try {
            ledgerSize = ledgerStore.write(ledgerPath, rules, ledger);
        } catch (IOException ledgerException) {
            throw new IngestionSetupException("Cannot write rejection ledger " + ledgerPath, ledgerException);
        }

        NormalizationRunSummary summary = new NormalizationRunSummary(
                candidates.size(), acceptedKeys.size(), rejectedByReason, ledgerSize, plan.parallel(), plan.workers(),
                ledgerPath);
        INGESTION_LOG.info(
                "[INGESTION] Batch {}: {} accepted, {} rejected ({}), ledger {} ({} entries)",
                summary.status(), summary.accepted(), summary.totalRejected(), summary.rejectedByReason(),
                ledgerPath, ledgerSize);
        return summary;
    }

    /**
     * Returns where the ledger for a destination root is written: beside the root, not inside it.
     *
     * @param destinationRoot root of the normalized tree
     * @return ledger path
     */
    public Path ledgerPath(Path destinationRoot) {
        Path root = destinationRoot.toAbsolutePath().normalize();
        Path parent = root.getParent() == null ? root : root.getParent();
        return parent.resolve(appProperties.getIngestion().getLedgerFileName());
    }

    /**
     * Runs reconciliation; a failure here must not discard the per-file results already gathered.
     */
    private Optional<ReconciliationReport> reconcile(
            Path source, Path destination, SourceSelectionRules rules, Set<String> acceptedKeys,
            Set<String> rejectedKeys) {
        try {
            return Optional.of(reconciliationService.reconcile(source, destination, rules, acceptedKeys, rejectedKeys));
        } catch (IOException | UncheckedIOException reconcileException) {
            log.warn("!!! Reconciliation could not walk the trees; the ledger holds per-file results only and"
                    + " files dropped without a result are not listed", reconcileException);
            return Optional.empty();
        }
    }

    private void prepareRoots(Path source, Path destination) {
        if (!Files.isDirectory(source)) {
            throw new IngestionSetupException("Source root does not exist or is not a directory: " + source);
        }
        try {
            Files.createDirectories(destination);
        } catch (IOException createException) {
            throw new IngestionSetupException("Cannot create destination root " + destination, createException);
        }
    }

    /**
     * Rejects the later of any two sources that would write the same destination in this run.
     */
    private List<SourceFile> claimDestinations(
            List<SourceFile> candidates, Path destination, List<FileNormalizationOutcome> outcomes) {
        Map<Path, SourceFile> owners = new HashMap<>();
        List<SourceFile> work = new ArrayList<>(candidates.size());
        for (SourceFile candidate : candidates) {
            Optional<Path> planned;
            try {
                planned = normalizer.plannedDestination(candidate, destination);
            } catch (RuntimeException planningException) {
                // The task itself will report the failure
                log.debug("Could not pre-plan {}: {}", candidate.relativeKey(), planningException.toString());
                planned = Optional.empty();
            }
            SourceFile owner = planned.map(path -> owners.putIfAbsent(path, candidate)).orElse(null);
            if (owner != null) {
                INGESTION_LOG.warn(
                        "[INGESTION] {} maps to the same destination as {}", candidate.relativeKey(), owner.relativeKey());
                outcomes.add(FileNormalizationOutcome.rejectedFile(
                        candidate, RejectionReason.ERROR, "destination collision with " + owner.relativeKey()));
            } else {
                work.add(candidate);
            }
        }
        return work;
    }

    private List<FileNormalizationOutcome> execute(List<SourceFile> files, Path destination, ExecutionPlan plan) {
        ExecutorService executor = plan.parallel()
                ? Executors.newFixedThreadPool(
                        plan.workers(),
                        new ThreadFactoryBuilder().setNameFormat(WORKER_NAME_FORMAT).setDaemon(true).build())
                : MoreExecutors.newDirectExecutorService();
        try {
            CompletionService<FileNormalizationOutcome> completion = new ExecutorCompletionService<>(executor);
            Map<Future<FileNormalizationOutcome>, SourceFile> pending = new IdentityHashMap<>();
            for (SourceFile file : files) {
                pending.put(completion.submit(() -> normalizer.normalize(file, destination)), file);
            }
            List<FileNormalizationOutcome> results = new ArrayList<>(files.size());
            for (int drained = 0; drained < files.size(); drained++) {
                Future<FileNormalizationOutcome> done = completion.take();
                try {
                    results.add(done.get());
                } catch (ExecutionException taskFailure) {
                    // Reconciliation reports this file as missing
                    log.error("Worker for {} died without reporting a result",
                            pending.get(done).relativeKey(), taskFailure.getCause());
                }
            }
            return results;
        } catch (InterruptedException interrupted) {
            Thread.currentThread().interrupt();
            throw new IngestionSetupException("Interrupted while waiting for normalization results", interrupted);
        } finally {
            executor.shutdown();
        }
    }
}
