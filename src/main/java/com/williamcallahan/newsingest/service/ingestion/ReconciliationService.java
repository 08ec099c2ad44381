package com.williamcallahan.newsingest.service.ingestion;

import com.williamcallahan.newsingest.domain.ingestion.ReconciliationReport;
import com.williamcallahan.newsingest.domain.ingestion.SourceFile;
import com.williamcallahan.newsingest.domain.ingestion.SourceSelectionRules;
import com.williamcallahan.newsingest.service.naming.ReverseSourceResolver;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;
import java.util.stream.Collectors;
import java.util.stream.Stream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Diffs the full source universe against everything a batch accounted for.
 *
 * <p>A file is accounted for when the batch accepted or rejected it, or when a normalized document
 * in the destination tree reverse-resolves to it. Whatever is left was dropped without a report,
 * for example by a worker that died, and is returned as truly missing.</p>
 *
 * <p>Reverse resolution runs only for documents in folders that still hold unaccounted files, and
 * stops once every file is accounted for.</p>
 */
@Service
public class ReconciliationService {
    private static final Logger log = LoggerFactory.getLogger(ReconciliationService.class);

    private static final Pattern NORMALIZED_NAME = Pattern.compile("^\\d{4}-\\d{2}-\\d{2}_.*\\.txt$");

    private final SourceTreeScanner scanner;
    private final ReverseSourceResolver reverseResolver;

    public ReconciliationService(SourceTreeScanner scanner, ReverseSourceResolver reverseResolver) {
        this.scanner = scanner;
        this.reverseResolver = reverseResolver;
    }

    /**
     * Reconciles a finished batch.
     *
     * @param sourceRoot root of the source tree
     * @param destinationRoot root of the normalized tree
     * @param rules the selection rules the batch ran with
     * @param acceptedKeys relative keys of accepted files
     * @param rejectedKeys relative keys of rejected files
     * @return the reconciliation report
     * @throws IOException if either tree cannot be walked
     */
    public ReconciliationReport reconcile(
            Path sourceRoot,
            Path destinationRoot,
            SourceSelectionRules rules,
            Set<String> acceptedKeys,
            Set<String> rejectedKeys) throws IOException {
        Set<String> universe = scanner.scan(sourceRoot, rules).stream()
                .map(SourceFile::relativeKey)
                .collect(Collectors.toCollection(LinkedHashSet::new));

        Set<String> accounted = new HashSet<>(acceptedKeys);
        accounted.addAll(rejectedKeys);
        Map<String, Integer> pendingByFolder = new HashMap<>();
        for (String key : universe) {
            if (!accounted.contains(key)) {
                pendingByFolder.merge(folderOf(key), 1, Integer::sum);
            }
        }
        int recovered = 0;
        int resolved = 0;
        if (!pendingByFolder.isEmpty()) {
            Path normalizedRoot = destinationRoot.toAbsolutePath().normalize();
            for (Path normalized : normalizedDocuments(destinationRoot)) {
                // a document only resolves to a source in the mirrored folder
                Path relative = normalizedRoot.relativize(normalized.toAbsolutePath().normalize());
                String folder = folderOf(SourceFile.toKey(relative));
                if (!pendingByFolder.containsKey(folder)) {
                    continue;
                }
                resolved++;
                String key = reverseResolver.findSource(normalized, destinationRoot, sourceRoot)
                        .map(SourceFile::relativeKey)
                        .orElse(null);
                if (key != null && universe.contains(key) && accounted.add(key)) {
                    recovered++;
                    pendingByFolder.computeIfPresent(folderOf(key), (ignored, count) -> count > 1 ? count - 1 : null);
                    if (pendingByFolder.isEmpty()) {
                        break;
                    }
                }
            }
        }
        accounted.retainAll(universe);

        List<String> missing = universe.stream().filter(key -> !accounted.contains(key)).toList();
        log.debug("Reconciled {} source files: {} accounted ({} recovered from {} reverse-resolved documents), {} missing",
                universe.size(), accounted.size(), recovered, resolved, missing.size());
        return new ReconciliationReport(universe, accounted, missing);
    }

    private static String folderOf(String relativeKey) {
        int slash = relativeKey.lastIndexOf('/');
        return slash < 0 ? "" : relativeKey.substring(0, slash);
    }

    private static List<Path> normalizedDocuments(Path destinationRoot) throws IOException {
        if (!Files.isDirectory(destinationRoot)) {
            return List.of();
        }
        try (Stream<Path> paths = Files.walk(destinationRoot)) {
            return paths.filter(Files::isRegularFile)
                    .filter(path -> NORMALIZED_NAME.matcher(path.getFileName().toString()).matches())
                    .sorted()
                    .toList();
        }
    }
}
