package com.phillippitts.catalogintel.exception;

/**
 * Base exception for all catalog-intel application-specific errors.
 * All domain exceptions should extend this class to enable centralized error handling.
 */
public class CatalogIntelException extends RuntimeException {

    public CatalogIntelException(String message) {
        super(message);
    }

    public CatalogIntelException(String message, Throwable cause) {
        super(message, cause);
    }
}
