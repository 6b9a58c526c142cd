package com.phillippitts.catalogintel.exception;

import java.util.Objects;

/**
 * Thrown by an attribute extractor on malformed input or an unreachable resource.
 */
public class ExtractionException extends CatalogIntelException {

    private final StageErrorType errorType;

    public ExtractionException(StageErrorType errorType, String message) {
        super(message);
        this.errorType = Objects.requireNonNull(errorType, "errorType must not be null");
    }

    public ExtractionException(StageErrorType errorType, String message, Throwable cause) {
        super(message, cause);
        this.errorType = Objects.requireNonNull(errorType, "errorType must not be null");
    }

    public StageErrorType getErrorType() {
        return errorType;
    }
}
