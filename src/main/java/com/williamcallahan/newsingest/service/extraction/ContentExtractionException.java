package com.williamcallahan.newsingest.service.extraction;

import java.io.IOException;

/**
 * Signals that a document could be opened but did not yield usable text.
 */
public class ContentExtractionException extends IOException {

    public ContentExtractionException(String message) {
        super(message);
    }

    public ContentExtractionException(String message, Throwable cause) {
        super(message, cause);
    }
}
