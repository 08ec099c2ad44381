package com.williamcallahan.newsingest.service.ingestion;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.williamcallahan.newsingest.service.extraction.FileOperationsService;
import com.williamcallahan.newsingest.support.TestDocuments;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class CorpusStatisticsServiceTest {

    @TempDir
    Path workspace;

    private final CorpusStatisticsService statistics = new CorpusStatisticsService(new FileOperationsService());

    @Test
    void countsTextFilesPerTopLevelFolder() throws IOException {
        Path destinationRoot = workspace.resolve("filtered_data");
        TestDocuments.text(destinationRoot.resolve("reddit/2021/2021-01-01_a.txt"), "x");
        TestDocuments.text(destinationRoot.resolve("news/2020-01-01_a.txt"), "x");
        TestDocuments.text(destinationRoot.resolve("news/deep/2020-01-02_b.txt"), "x");
        TestDocuments.text(destinationRoot.resolve("news/notes.md"), "x");
        TestDocuments.text(destinationRoot.resolve("stray.txt"), "x");

        Map<String, Long> counts = statistics.countFiles(destinationRoot);

        assertEquals(List.of("news", "reddit"), List.copyOf(counts.keySet()));
        assertEquals(2L, counts.get("news"));
        assertEquals(1L, counts.get("reddit"));
    }

    @Test
    void writesCsvBesideDestinationRoot() throws IOException {
        Path destinationRoot = workspace.resolve("filtered_data");
        TestDocuments.text(destinationRoot.resolve("news/2020-01-01_a.txt"), "x");
        TestDocuments.text(destinationRoot.resolve("a,b/2020-01-01_a.txt"), "x");

        Path csv = statistics.writeFileCounts(destinationRoot);

        assertEquals(workspace.resolve("statistics/file_counts.csv"), csv);
        assertEquals(List.of("Folder,File_Count", "\"a,b\",1", "news,1"), Files.readAllLines(csv));
    }

    @Test
    void quotesFolderNamesContainingQuotes() throws IOException {
        Path destinationRoot = workspace.resolve("filtered_data");
        TestDocuments.text(destinationRoot.resolve("say \"hi\"/2020-01-01_a.txt"), "x");

        Path csv = statistics.writeFileCounts(destinationRoot);

        assertEquals("Folder,File_Count\n\"say \"\"hi\"\"\",1\n", Files.readString(csv));
    }

    @Test
    void emptyTreeWritesHeaderOnly() throws IOException {
        Path destinationRoot = Files.createDirectories(workspace.resolve("filtered_data"));

        assertEquals("Folder,File_Count\n", Files.readString(statistics.writeFileCounts(destinationRoot)));
    }

    @Test
    void missingDestinationHasNoCounts() throws IOException {
        assertTrue(statistics.countFiles(workspace.resolve("absent")).isEmpty());
    }
}
