package com.williamcallahan.newsingest.service.ingestion;

import com.williamcallahan.newsingest.service.extraction.FileOperationsService;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.stream.Stream;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVPrinter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Counts normalized documents per top-level folder and writes them as CSV.
 */
@Service
public class CorpusStatisticsService {
    private static final Logger log = LoggerFactory.getLogger(CorpusStatisticsService.class);

    static final String STATISTICS_DIRECTORY = "statistics";
    static final String FILE_COUNTS_NAME = "file_counts.csv";
    static final String[] CSV_HEADER = {"Folder", "File_Count"};
    private static final CSVFormat FILE_COUNTS_FORMAT = CSVFormat.DEFAULT.builder()
            .setHeader(CSV_HEADER)
            .setRecordSeparator('\n')
            .build();

    private final FileOperationsService fileOps;

    public CorpusStatisticsService(FileOperationsService fileOps) {
        this.fileOps = fileOps;
    }

    /**
     * Counts {@code .txt} files recursively under each top-level folder of the normalized tree.
     *
     * @param destinationRoot root of the normalized tree
     * @return counts keyed by folder name, sorted by name
     * @throws IOException if the tree cannot be walked
     */
    public Map<String, Long> countFiles(Path destinationRoot) throws IOException {
        Map<String, Long> counts = new LinkedHashMap<>();
        if (!Files.isDirectory(destinationRoot)) {
            return counts;
        }
        List<Path> folders;
        try (Stream<Path> children = Files.list(destinationRoot)) {
            folders = children.filter(Files::isDirectory).sorted().toList();
        }
        for (Path folder : folders) {
            try (Stream<Path> files = Files.walk(folder)) {
                long count = files.filter(Files::isRegularFile)
                        .filter(path -> path.getFileName().toString().toLowerCase(Locale.ROOT).endsWith(".txt"))
                        .count();
                counts.put(folder.getFileName().toString(), count);
            }
        }
        return counts;
    }

    /**
     * Writes {@code <destination parent>/statistics/file_counts.csv}.
     *
     * @param destinationRoot root of the normalized tree
     * @return the CSV path
     * @throws IOException if counting or writing fails
     */
    public Path writeFileCounts(Path destinationRoot) throws IOException {
        Path root = destinationRoot.toAbsolutePath().normalize();
        Path parent = root.getParent() == null ? root : root.getParent();
        Path csv = parent.resolve(STATISTICS_DIRECTORY).resolve(FILE_COUNTS_NAME);

        Map<String, Long> counts = countFiles(root);
        StringBuilder content = new StringBuilder();
        try (CSVPrinter printer = new CSVPrinter(content, FILE_COUNTS_FORMAT)) {
            for (Map.Entry<String, Long> folderCount : counts.entrySet()) {
                printer.printRecord(folderCount.getKey(), folderCount.getValue());
            }
        }
        fileOps.saveTextFile(csv, content.toString());
        counts.forEach((folder, count) -> log.info("{}: {} files", folder, count));
        log.info("Statistics saved to {}", csv);
        return csv;
    }
}
