package com.williamcallahan.newsingest.service.ingestion;

import com.williamcallahan.newsingest.domain.ingestion.FileNormalizationOutcome;
import com.williamcallahan.newsingest.domain.ingestion.RejectionReason;
import com.williamcallahan.newsingest.domain.ingestion.SourceFile;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import org.springframework.stereotype.Service;

/**
 * Builds rejected outcomes with exception-specific diagnostic hints for normalization runs.
 */
@Service
public class NormalizationFailureFactory {

    private static final Map<Class<? extends Exception>, String> HINTS = new ConcurrentHashMap<>();

    static {
        register(java.io.FileNotFoundException.class, "file not found or inaccessible");
        register(java.nio.file.AccessDeniedException.class, "permission denied");
        register(java.nio.charset.MalformedInputException.class, "file encoding issue - not valid UTF-8");
        register(java.nio.file.NoSuchFileException.class, "file does not exist");
        register(java.nio.file.FileSystemException.class, "filesystem rejected the operation");
        register(java.util.zip.ZipException.class, "corrupt or non-zip container");
    }

    static void register(Class<? extends Exception> exceptionType, String hint) {
        HINTS.put(exceptionType, hint);
    }

    /**
     * Creates a rejected outcome with exception-specific diagnostic context.
     *
     * @param source the file that failed processing
     * @param reason rejection category
     * @param phase the processing phase where failure occurred
     * @param exception the exception that caused the failure
     * @return rejected outcome with detailed diagnostics
     */
    public FileNormalizationOutcome failure(
            SourceFile source, RejectionReason reason, String phase, Exception exception) {
        Objects.requireNonNull(source, "source");
        Objects.requireNonNull(reason, "reason");
        Objects.requireNonNull(phase, "phase");
        Objects.requireNonNull(exception, "exception");
        return FileNormalizationOutcome.rejectedFile(source, reason, phase + ": " + describe(exception));
    }

    /**
     * Describes an exception as {@code SimpleName: message [hint]}.
     *
     * @param exception failure to describe
     * @return single-line description
     */
    public String describe(Exception exception) {
        StringBuilder details = new StringBuilder();
        details.append(exception.getClass().getSimpleName());

        String message = exception.getMessage();
        if (message != null && !message.isBlank()) {
            details.append(": ").append(message);
        }

        String diagnosticHint = HINTS.get(exception.getClass());
        if (diagnosticHint != null) {
            details.append(" [").append(diagnosticHint).append("]");
        } else if (exception.getCause() != null) {
            details.append(" [caused by: ")
                    .append(exception.getCause().getClass().getSimpleName())
                    .append("]");
        }
        return details.toString();
    }
}
