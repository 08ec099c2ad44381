package com.williamcallahan.newsingest.service.ingestion;

import com.williamcallahan.newsingest.domain.ingestion.SourceFile;
import com.williamcallahan.newsingest.domain.ingestion.SourceFileType;
import com.williamcallahan.newsingest.domain.ingestion.SourceSelectionRules;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.stream.Stream;
import org.springframework.stereotype.Service;

/**
 * Enumerates the source files a batch covers.
 *
 * <p>The same scan defines both the work list and the reconciliation universe, so the two can
 * never disagree about which files were in scope.</p>
 */
@Service
public class SourceTreeScanner {

    /**
     * Lists supported files under the allowed top-level folders that no exclusion rule matches.
     *
     * @param sourceRoot root of the source tree
     * @param rules selection rules
     * @return source files sorted by relative path
     * @throws IOException if walking the tree fails
     */
    public List<SourceFile> scan(Path sourceRoot, SourceSelectionRules rules) throws IOException {
        Path root = sourceRoot.toAbsolutePath().normalize();
        List<SourceFile> files = new ArrayList<>();
        for (String folder : rules.includedFolders()) {
            Path topLevel = root.resolve(folder);
            if (!Files.isDirectory(topLevel)) {
                continue;
            }
            try (Stream<Path> paths = Files.walk(topLevel)) {
                paths.filter(Files::isRegularFile)
                        .filter(path -> SourceFileType.fromPath(path).isPresent())
                        .filter(path -> rules.includes(root.relativize(path)))
                        .map(path -> SourceFile.of(root, path))
                        .forEach(files::add);
            }
        }
        files.sort(Comparator.comparing(SourceFile::relativeKey));
        return List.copyOf(files);
    }
}
