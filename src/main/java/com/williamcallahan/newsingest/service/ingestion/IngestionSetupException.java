package com.williamcallahan.newsingest.service.ingestion;

/**
 * Raised when a normalization batch cannot start, before any file is processed.
 */
public class IngestionSetupException extends RuntimeException {

    public IngestionSetupException(String message) {
        super(message);
    }

    public IngestionSetupException(String message, Throwable cause) {
        super(message, cause);
    }
}
