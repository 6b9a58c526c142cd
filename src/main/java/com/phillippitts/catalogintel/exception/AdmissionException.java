package com.phillippitts.catalogintel.exception;

import java.util.Objects;

/**
 * Thrown when the admission guard refuses a request.
 * Nothing has been fetched or extracted when this is raised.
 */
public class AdmissionException extends CatalogIntelException {

    private final AdmissionErrorType errorType;
    private final String productId;

    public AdmissionException(AdmissionErrorType errorType, String message) {
        this(errorType, null, message);
    }

    public AdmissionException(AdmissionErrorType errorType, String productId, String message) {
        super(message);
        this.errorType = Objects.requireNonNull(errorType, "errorType must not be null");
        this.productId = productId;
    }

    public AdmissionErrorType getErrorType() {
        return errorType;
    }

    /**
     * @return offending product id, or {@code null} for request-level rejections
     */
    public String getProductId() {
        return productId;
    }
}
