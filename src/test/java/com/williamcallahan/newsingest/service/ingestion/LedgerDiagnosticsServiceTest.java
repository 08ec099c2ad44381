package com.williamcallahan.newsingest.service.ingestion;

import static org.junit.jupiter.api.Assertions.assertEquals;

import com.williamcallahan.newsingest.domain.date.FullDate;
import com.williamcallahan.newsingest.service.date.DateResolver;
import com.williamcallahan.newsingest.service.extraction.FileOperationsService;
import com.williamcallahan.newsingest.service.ingestion.LedgerDiagnosticsService.Diagnosis;
import com.williamcallahan.newsingest.service.ingestion.LedgerDiagnosticsService.Finding;
import com.williamcallahan.newsingest.support.TestDocuments;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

/**
 * Verifies ledger entries are re-checked against the current source tree.
 */
class LedgerDiagnosticsServiceTest {

    @TempDir
    Path workspace;

    @Test
    void classifiesEachEntry() throws IOException {
        Path sourceRoot = Files.createDirectories(workspace.resolve("raw_txt"));
        TestDocuments.text(sourceRoot.resolve("news/undated.txt"), "x");
        TestDocuments.text(sourceRoot.resolve("news/Jan 5, 2021 recap.txt"), "x");
        Path ledger = Files.writeString(workspace.resolve("failed_date_parsing.txt"), String.join("\n",
                "# header",
                "news/Jan 5, 2021 recap.txt\tno_date",
                "news/deleted.txt\tsource_missing",
                "news/undated.txt\tno_date",
                ""));
        LedgerDiagnosticsService diagnostics = new LedgerDiagnosticsService(
                new RejectionLedgerStore(new FileOperationsService()), new DateResolver());

        List<Diagnosis> diagnoses = diagnostics.diagnose(ledger, sourceRoot);

        assertEquals(List.of(Finding.DATE_NOW_RESOLVES, Finding.SOURCE_GONE, Finding.NO_FILENAME_DATE),
                diagnoses.stream().map(Diagnosis::finding).toList());
        assertEquals(Optional.of(FullDate.parseCanonical("2021-01-05").orElseThrow()), diagnoses.get(0).filenameDate());
    }

    @Test
    void datedFilesThatFailedLaterAreNotReportedAsResolvable() throws IOException {
        Path sourceRoot = Files.createDirectories(workspace.resolve("raw_txt"));
        TestDocuments.text(sourceRoot.resolve("news/2021-01-05_scan.pdf"), "not a pdf");
        TestDocuments.text(sourceRoot.resolve("news/2021-01-06_a.txt"), "x");
        TestDocuments.text(sourceRoot.resolve("news/2021-01-07_b.txt"), "x");
        TestDocuments.text(sourceRoot.resolve("news/crashed.txt"), "x");
        Path ledger = Files.writeString(workspace.resolve("failed_date_parsing.txt"), String.join("\n",
                "news/2021-01-05_scan.pdf\tconversion_failed",
                "news/2021-01-06_a.txt\terror:destination collision with news/2021-01-06_A.txt",
                "news/2021-01-07_b.txt\tmissing",
                "news/crashed.txt\tmissing",
                ""));
        LedgerDiagnosticsService diagnostics = new LedgerDiagnosticsService(
                new RejectionLedgerStore(new FileOperationsService()), new DateResolver());

        List<Diagnosis> diagnoses = diagnostics.diagnose(ledger, sourceRoot);

        assertEquals(List.of(Finding.FAILED_AFTER_DATING, Finding.FAILED_AFTER_DATING, Finding.FAILED_AFTER_DATING,
                        Finding.NO_FILENAME_DATE),
                diagnoses.stream().map(Diagnosis::finding).toList());
    }
}
