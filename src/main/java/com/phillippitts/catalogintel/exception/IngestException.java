package com.phillippitts.catalogintel.exception;

import java.util.Objects;

/**
 * Thrown by an image ingestor when the image cannot be resolved or cached.
 */
public class IngestException extends CatalogIntelException {

    private final StageErrorType errorType;

    public IngestException(StageErrorType errorType, String message) {
        super(message);
        this.errorType = Objects.requireNonNull(errorType, "errorType must not be null");
    }

    public IngestException(StageErrorType errorType, String message, Throwable cause) {
        super(message, cause);
        this.errorType = Objects.requireNonNull(errorType, "errorType must not be null");
    }

    public StageErrorType getErrorType() {
        return errorType;
    }
}
