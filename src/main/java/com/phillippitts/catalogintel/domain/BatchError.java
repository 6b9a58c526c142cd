package com.phillippitts.catalogintel.domain;

import java.util.Objects;

/**
 * Failure of one record in a batch.
 *
 * @param index     position of the record in the original request
 * @param productId product identifier of the failed record
 * @param stage     stage that failed
 * @param errorType wire name of the error classification
 * @param message   diagnostic message
 */
public record BatchError(
        int index,
        String productId,
        PipelineStage stage,
        String errorType,
        String message
) {

    public BatchError {
        if (index < 0) {
            throw new IllegalArgumentException("index must be >= 0, got: " + index);
        }
        Objects.requireNonNull(stage, "stage must not be null");
        Objects.requireNonNull(errorType, "errorType must not be null");
        productId = productId == null ? "" : productId;
        message = message == null ? "" : message;
    }
}
