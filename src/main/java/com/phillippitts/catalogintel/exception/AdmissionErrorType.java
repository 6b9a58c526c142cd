package com.phillippitts.catalogintel.exception;

/**
 * Reasons a request or batch item is refused before any extraction work.
 */
public enum AdmissionErrorType {
    RATE_LIMITED("rate_limited"),
    BATCH_LIMIT_EXCEEDED("batch_limit_exceeded"),
    TEXT_LIMIT_EXCEEDED("text_limit_exceeded"),
    DUPLICATE_PRODUCT_ID("duplicate_product_id");

    private final String wireName;

    AdmissionErrorType(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }

    @Override
    public String toString() {
        return wireName;
    }
}
