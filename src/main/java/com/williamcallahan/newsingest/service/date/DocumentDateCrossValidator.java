package com.williamcallahan.newsingest.service.date;

import com.williamcallahan.newsingest.domain.date.DateCrossCheck;
import com.williamcallahan.newsingest.domain.date.FullDate;
import com.williamcallahan.newsingest.domain.date.ResolvedDate;
import com.williamcallahan.newsingest.domain.ingestion.SourceFileType;
import com.williamcallahan.newsingest.service.extraction.DocumentTextExtractor;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.stream.Stream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Compares the date a filename carries with the date stated in the document body.
 *
 * <p>The content date wins when both exist. A year-less content date borrows the filename's
 * year. Disagreements are warnings, never errors.</p>
 */
@Service
public class DocumentDateCrossValidator {
    private static final Logger log = LoggerFactory.getLogger(DocumentDateCrossValidator.class);

    private final DateResolver dateResolver;
    private final DocumentTextExtractor textExtractor;

    public DocumentDateCrossValidator(DateResolver dateResolver, DocumentTextExtractor textExtractor) {
        this.dateResolver = dateResolver;
        this.textExtractor = textExtractor;
    }

    /**
     * Resolves both dates for a document and flags a disagreement.
     *
     * @param fileName document file name
     * @param text document body
     * @return the cross-check result
     */
    public DateCrossCheck crossCheck(String fileName, String text) {
        Optional<FullDate> filenameDate = dateResolver.resolveFullDateFromFilename(fileName);
        Optional<ResolvedDate> content = dateResolver.resolveFromContent(text, filenameDate.orElse(null));
        Optional<FullDate> contentDate = Optional.empty();
        if (content.isPresent() && content.get() instanceof FullDate full) {
            contentDate = Optional.of(full);
        } else if (content.isPresent()) {
            log.debug("Content of {} has a year-less date {} and no filename year to complete it", fileName, content.get());
        }
        DateCrossCheck check = new DateCrossCheck(fileName, filenameDate, contentDate);
        if (check.disagreement()) {
            log.warn("Date disagreement for {}: filename says {}, content says {}; stamping {}",
                    fileName, filenameDate.get(), contentDate.get(), check.effectiveDate().orElseThrow());
        }
        return check;
    }

    /**
     * Cross-checks every normalized document under a tree.
     *
     * @param normalizedRoot root of the normalized tree
     * @return checks where filename and content dates disagree, sorted by file name
     * @throws IOException if the tree cannot be walked
     */
    public List<DateCrossCheck> auditTree(Path normalizedRoot) throws IOException {
        List<Path> documents;
        try (Stream<Path> paths = Files.walk(normalizedRoot)) {
            documents = paths.filter(Files::isRegularFile)
                    .filter(path -> SourceFileType.fromPath(path).filter(SourceFileType.TEXT::equals).isPresent())
                    .sorted()
                    .toList();
        }
        List<DateCrossCheck> disagreements = new ArrayList<>();
        for (Path document : documents) {
            String text;
            try {
                text = textExtractor.extractText(document, SourceFileType.TEXT);
            } catch (IOException readException) {
                log.warn("Skipping unreadable document {}: {}", document, readException.toString());
                continue;
            }
            DateCrossCheck check = crossCheck(document.getFileName().toString(), text);
            if (check.disagreement()) {
                disagreements.add(check);
            }
        }
        log.info("Audited {} documents under {}; {} date disagreements", documents.size(), normalizedRoot,
                disagreements.size());
        return disagreements;
    }
}
