package com.williamcallahan.newsingest.config;

import com.williamcallahan.newsingest.domain.ingestion.SourceSelectionRules;
import jakarta.annotation.PostConstruct;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Component
@ConfigurationProperties(prefix = "app")
public class AppProperties {

    private static final String INGESTION_PREFIX = "app.ingestion.";

    private Ingestion ingestion = new Ingestion();

    public Ingestion getIngestion() {
        return ingestion;
    }

    public void setIngestion(Ingestion ingestion) {
        this.ingestion = ingestion;
    }

    /**
     * Validates bound settings and fails startup on values the batch cannot run with.
     *
     * @throws IllegalArgumentException when a setting is missing or out of range
     */
    @PostConstruct
    public void validateConfiguration() {
        if (ingestion == null) {
            throw new IllegalArgumentException("app.ingestion must be configured");
        }
        requireText(ingestion.getSourceRoot(), "source-root");
        requireText(ingestion.getDestinationRoot(), "destination-root");
        requireText(ingestion.getLedgerFileName(), "ledger-file-name");
        if (ingestion.getIncludedFolders() == null || ingestion.getIncludedFolders().stream()
                .noneMatch(folder -> folder != null && !folder.isBlank())) {
            throw new IllegalArgumentException(INGESTION_PREFIX + "included-folders must name at least one folder");
        }
        if (ingestion.getParallelThreshold() <= 0) {
            throw new IllegalArgumentException(INGESTION_PREFIX + "parallel-threshold must be positive");
        }
        if (!(ingestion.getWorkerFraction() > 0.0) || ingestion.getWorkerFraction() > 1.0) {
            throw new IllegalArgumentException(INGESTION_PREFIX + "worker-fraction must be in (0, 1]");
        }
        if (ingestion.getMaxWorkers() < 0) {
            throw new IllegalArgumentException(INGESTION_PREFIX + "max-workers must be zero or positive");
        }
        if (ingestion.getMaxPathLength() <= 0) {
            throw new IllegalArgumentException(INGESTION_PREFIX + "max-path-length must be positive");
        }
    }

    private static void requireText(String value, String key) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException(INGESTION_PREFIX + key + " must not be blank");
        }
    }

    public static class Ingestion {
        private String sourceRoot = "data/raw_txt";
        private String destinationRoot = "data/filtered_data";
        private List<String> includedFolders = new ArrayList<>(List.of("news", "reddit", "transcripts"));
        private List<String> excludedFolderNames = new ArrayList<>(List.of("_files"));
        private List<String> excludedFilePrefixes = new ArrayList<>(List.of("fig_", "~$"));
        private List<String> excludedPathSubstrings = new ArrayList<>();
        private int parallelThreshold = 10;
        private double workerFraction = 0.7;
        private int maxWorkers = 0;
        private int maxPathLength = 200;
        private String ledgerFileName = "failed_date_parsing.txt";
        private boolean runOnStartup = true;
        private boolean auditContentDates = false;
        private boolean writeStatistics = true;

        /**
         * Builds the selection rules for the configured allow-list and block-lists.
         */
        public SourceSelectionRules selectionRules() {
            List<String> folders = includedFolders == null ? List.of() : includedFolders;
            LinkedHashSet<String> allowed = new LinkedHashSet<>();
            for (String folder : folders) {
                if (folder != null && !folder.isBlank()) {
                    allowed.add(folder.trim());
                }
            }
            return new SourceSelectionRules(allowed, excludedFolderNames, excludedFilePrefixes, excludedPathSubstrings);
        }

        public Path sourceRootPath() {
            return Path.of(sourceRoot).toAbsolutePath().normalize();
        }

        public Path destinationRootPath() {
            return Path.of(destinationRoot).toAbsolutePath().normalize();
        }

        public String getSourceRoot() { return sourceRoot; }
        public void setSourceRoot(String sourceRoot) { this.sourceRoot = sourceRoot; }

        public String getDestinationRoot() { return destinationRoot; }
        public void setDestinationRoot(String destinationRoot) { this.destinationRoot = destinationRoot; }

        public List<String> getIncludedFolders() { return includedFolders; }
        public void setIncludedFolders(List<String> includedFolders) { this.includedFolders = includedFolders; }

        public List<String> getExcludedFolderNames() { return excludedFolderNames; }
        public void setExcludedFolderNames(List<String> excludedFolderNames) {
            this.excludedFolderNames = excludedFolderNames;
        }

        public List<String> getExcludedFilePrefixes() { return excludedFilePrefixes; }
        public void setExcludedFilePrefixes(List<String> excludedFilePrefixes) {
            this.excludedFilePrefixes = excludedFilePrefixes;
        }

        public List<String> getExcludedPathSubstrings() { return excludedPathSubstrings; }
        public void setExcludedPathSubstrings(List<String> excludedPathSubstrings) {
            this.excludedPathSubstrings = excludedPathSubstrings;
        }

        public int getParallelThreshold() { return parallelThreshold; }
        public void setParallelThreshold(int parallelThreshold) { this.parallelThreshold = parallelThreshold; }

        public double getWorkerFraction() { return workerFraction; }
        public void setWorkerFraction(double workerFraction) { this.workerFraction = workerFraction; }

        public int getMaxWorkers() { return maxWorkers; }
        public void setMaxWorkers(int maxWorkers) { this.maxWorkers = maxWorkers; }

        public int getMaxPathLength() { return maxPathLength; }
        public void setMaxPathLength(int maxPathLength) { this.maxPathLength = maxPathLength; }

        public String getLedgerFileName() { return ledgerFileName; }
        public void setLedgerFileName(String ledgerFileName) { this.ledgerFileName = ledgerFileName; }

        public boolean isRunOnStartup() { return runOnStartup; }
        public void setRunOnStartup(boolean runOnStartup) { this.runOnStartup = runOnStartup; }

        public boolean isAuditContentDates() { return auditContentDates; }
        public void setAuditContentDates(boolean auditContentDates) { this.auditContentDates = auditContentDates; }

        public boolean isWriteStatistics() { return writeStatistics; }
        public void setWriteStatistics(boolean writeStatistics) { this.writeStatistics = writeStatistics; }
    }
}
