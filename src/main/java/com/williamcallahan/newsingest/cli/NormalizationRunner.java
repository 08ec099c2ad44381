package com.williamcallahan.newsingest.cli;

import com.williamcallahan.newsingest.config.AppProperties;
import com.williamcallahan.newsingest.domain.date.DateCrossCheck;
import com.williamcallahan.newsingest.domain.ingestion.NormalizationRunSummary;
import com.williamcallahan.newsingest.service.date.DocumentDateCrossValidator;
import com.williamcallahan.newsingest.service.ingestion.CorpusStatisticsService;
import com.williamcallahan.newsingest.service.ingestion.IngestionCoordinator;
import com.williamcallahan.newsingest.service.ingestion.LedgerDiagnosticsService;
import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.CommandLineRunner;
import org.springframework.stereotype.Component;

/**
 * Runs one normalization batch at startup, then the optional audit and statistics steps.
 */
@Component
public class NormalizationRunner implements CommandLineRunner {
    private static final Logger log = LoggerFactory.getLogger(NormalizationRunner.class);

    private final AppProperties appProperties;
    private final IngestionCoordinator coordinator;
    private final DocumentDateCrossValidator crossValidator;
    private final CorpusStatisticsService statisticsService;
    private final LedgerDiagnosticsService ledgerDiagnostics;

    public NormalizationRunner(
            AppProperties appProperties,
            IngestionCoordinator coordinator,
            DocumentDateCrossValidator crossValidator,
            CorpusStatisticsService statisticsService,
            LedgerDiagnosticsService ledgerDiagnostics) {
        this.appProperties = appProperties;
        this.coordinator = coordinator;
        this.crossValidator = crossValidator;
        this.statisticsService = statisticsService;
        this.ledgerDiagnostics = ledgerDiagnostics;
    }

    @Override
    public void run(String... args) throws IOException {
        AppProperties.Ingestion settings = appProperties.getIngestion();
        if (!settings.isRunOnStartup()) {
            log.info("Normalization batch disabled (app.ingestion.run-on-startup=false)");
            return;
        }
        Path destinationRoot = settings.destinationRootPath();

        log.info("===============================================");
        log.info("Starting document normalization");
        log.info("===============================================");
        log.info("Source root: {}", settings.sourceRootPath());
        log.info("Destination root: {}", destinationRoot);
        log.info("Included folders: {}", settings.getIncludedFolders());

        long startMillis = System.currentTimeMillis();
        NormalizationRunSummary summary = coordinator.run();
        long durationMillis = System.currentTimeMillis() - startMillis;

        log.info("-----------------------------------------------");
        log.info("Candidates: {}", summary.candidates());
        log.info("Accepted: {}", summary.accepted());
        log.info("Rejected: {} {}", summary.totalRejected(), summary.rejectedByReason());
        if (summary.trulyMissing() > 0) {
            log.warn("Truly missing (dropped without a result): {}", summary.trulyMissing());
        }
        log.info("Ledger: {} ({} entries)", summary.ledgerPath(), summary.ledgerSize());
        log.info("Finished in {} ms ({}, {} workers)", durationMillis,
                summary.parallel() ? "parallel" : "sequential", summary.workers());

        if (summary.ledgerSize() > 0) {
            ledgerDiagnostics.diagnose(summary.ledgerPath(), settings.sourceRootPath());
        }

        if (settings.isAuditContentDates()) {
            List<DateCrossCheck> disagreements = crossValidator.auditTree(destinationRoot);
            log.info("Content-date audit: {} disagreements", disagreements.size());
        }
        if (settings.isWriteStatistics()) {
            statisticsService.writeFileCounts(destinationRoot);
        }
        log.info("===============================================");
    }
}
