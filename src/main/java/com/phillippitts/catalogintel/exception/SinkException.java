package com.phillippitts.catalogintel.exception;

/**
 * Thrown when an output sink cannot validate or deliver predictions.
 * Never reaches the caller of a prediction request.
 */
public class SinkException extends CatalogIntelException {

    public SinkException(String message) {
        super(message);
    }

    public SinkException(String message, Throwable cause) {
        super(message, cause);
    }
}
