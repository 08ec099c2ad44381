package com.williamcallahan.newsingest.service.ingestion;

import com.williamcallahan.newsingest.domain.date.FullDate;
import com.williamcallahan.newsingest.domain.ingestion.FileLifecycleState;
import com.williamcallahan.newsingest.domain.ingestion.FileNormalizationOutcome;
import com.williamcallahan.newsingest.domain.ingestion.RejectionReason;
import com.williamcallahan.newsingest.domain.ingestion.SourceFile;
import com.williamcallahan.newsingest.service.date.DateResolver;
import com.williamcallahan.newsingest.service.extraction.DocumentTextExtractor;
import com.williamcallahan.newsingest.service.extraction.FileOperationsService;
import com.williamcallahan.newsingest.service.naming.DestinationPathBuilder;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Normalizes one source file into a date-prefixed UTF-8 text document.
 *
 * <p>Runs resolve date, build destination, extract text, then write. Every exception is converted
 * into a rejected outcome so one bad file cannot abort the batch. The task shares no mutable state
 * with other tasks.</p>
 */
@Service
public class SourceFileNormalizer {
    private static final Logger log = LoggerFactory.getLogger(SourceFileNormalizer.class);
    private static final Logger INGESTION_LOG = LoggerFactory.getLogger("INGESTION");

    private final DateResolver dateResolver;
    private final DestinationPathBuilder pathBuilder;
    private final DocumentTextExtractor textExtractor;
    private final FileOperationsService fileOps;
    private final NormalizationFailureFactory failureFactory;

    /**
     * Wires the per-file pipeline stages.
     *
     * @param dateResolver filename date resolution
     * @param pathBuilder destination naming
     * @param textExtractor format-specific text extraction
     * @param fileOps destination writes
     * @param failureFactory builds rejected outcomes with diagnostics
     */
    public SourceFileNormalizer(
            DateResolver dateResolver,
            DestinationPathBuilder pathBuilder,
            DocumentTextExtractor textExtractor,
            FileOperationsService fileOps,
            NormalizationFailureFactory failureFactory) {
        this.dateResolver = Objects.requireNonNull(dateResolver, "dateResolver");
        this.pathBuilder = Objects.requireNonNull(pathBuilder, "pathBuilder");
        this.textExtractor = Objects.requireNonNull(textExtractor, "textExtractor");
        this.fileOps = Objects.requireNonNull(fileOps, "fileOps");
        this.failureFactory = Objects.requireNonNull(failureFactory, "failureFactory");
    }

    /**
     * Computes where a source file would be written, without touching the filesystem.
     *
     * @param source source file
     * @param destinationRoot root of the normalized tree
     * @return the destination, or empty when the filename carries no date
     */
    public Optional<Path> plannedDestination(SourceFile source, Path destinationRoot) {
        return dateResolver.resolveFullDateFromFilename(source.fileName())
                .map(date -> pathBuilder.buildDestination(source.relativePath(), date, destinationRoot));
    }

    /**
     * Normalizes a single file and returns a typed outcome.
     *
     * @param source source file
     * @param destinationRoot root of the normalized tree
     * @return accepted or rejected outcome
     */
    public FileNormalizationOutcome normalize(SourceFile source, Path destinationRoot) {
        FileLifecycleState state = FileLifecycleState.DISCOVERED;
        try {
            Optional<FullDate> date = dateResolver.resolveFullDateFromFilename(source.fileName());
            if (date.isEmpty()) {
                state = advance(source, state, FileLifecycleState.DATE_UNRESOLVED);
                advance(source, state, FileLifecycleState.REJECTED);
                INGESTION_LOG.info("[INGESTION] No filename date: {}", source.relativeKey());
                return FileNormalizationOutcome.rejectedFile(source, RejectionReason.NO_DATE, "no filename date");
            }
            state = advance(source, state, FileLifecycleState.DATE_RESOLVED);
            Path destination = pathBuilder.buildDestination(source.relativePath(), date.get(), destinationRoot);

            if (!Files.exists(source.absolutePath())) {
                advance(source, state, FileLifecycleState.REJECTED);
                INGESTION_LOG.warn("[INGESTION] Source vanished before processing: {}", source.relativeKey());
                return FileNormalizationOutcome.rejectedFile(source, RejectionReason.SOURCE_MISSING, "file not found");
            }

            final String text;
            try {
                text = textExtractor.extractText(source.absolutePath(), source.type());
            } catch (IOException extractionException) {
                if (!Files.exists(source.absolutePath())) {
                    advance(source, state, FileLifecycleState.REJECTED);
                    return failureFactory.failure(source, RejectionReason.SOURCE_MISSING, "extract", extractionException);
                }
                state = advance(source, state, FileLifecycleState.CONVERSION_FAILED);
                advance(source, state, FileLifecycleState.REJECTED);
                INGESTION_LOG.warn(
                        "[INGESTION] Conversion failed for {}: {}",
                        source.relativeKey(),
                        failureFactory.describe(extractionException));
                return failureFactory.failure(
                        source, RejectionReason.CONVERSION_FAILED, "extract", extractionException);
            }
            state = advance(source, state, FileLifecycleState.CONVERTED);

            final boolean written;
            try {
                written = fileOps.writeIfAbsent(destination, text);
            } catch (IOException writeException) {
                advance(source, state, FileLifecycleState.REJECTED);
                INGESTION_LOG.warn(
                        "[INGESTION] Write failed for {}: {}", source.relativeKey(), failureFactory.describe(writeException));
                return failureFactory.failure(source, RejectionReason.ERROR, "write", writeException);
            }
            advance(source, state, FileLifecycleState.ACCEPTED);
            if (!written) {
                log.debug("Destination already present, left untouched: {}", destination);
            }
            return FileNormalizationOutcome.acceptedFile(source, destination, written);
        } catch (RuntimeException unexpected) {
            log.warn("Unexpected failure normalizing {} in state {}", source.relativeKey(), state, unexpected);
            return failureFactory.failure(source, RejectionReason.ERROR, state.name().toLowerCase(Locale.ROOT), unexpected);
        }
    }

    private static FileLifecycleState advance(SourceFile source, FileLifecycleState from, FileLifecycleState to) {
        FileLifecycleState next = from.transitionTo(to);
        log.debug("{}: {} -> {}", source.relativeKey(), from, next);
        return next;
    }
}
