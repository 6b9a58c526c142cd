package com.phillippitts.catalogintel.exception;

import com.phillippitts.catalogintel.domain.BatchError;
import com.phillippitts.catalogintel.domain.PipelineStage;

import java.util.Objects;

/**
 * Thrown when one record fails in a pipeline stage. Never affects sibling records.
 */
public class StageException extends CatalogIntelException {

    private final String productId;
    private final PipelineStage stage;
    private final StageErrorType errorType;

    public StageException(String productId, PipelineStage stage, StageErrorType errorType, String message) {
        super(message);
        this.productId = productId;
        this.stage = Objects.requireNonNull(stage, "stage must not be null");
        this.errorType = Objects.requireNonNull(errorType, "errorType must not be null");
    }

    public StageException(String productId, PipelineStage stage, StageErrorType errorType, String message,
                          Throwable cause) {
        super(message, cause);
        this.productId = productId;
        this.stage = Objects.requireNonNull(stage, "stage must not be null");
        this.errorType = Objects.requireNonNull(errorType, "errorType must not be null");
    }

    public String getProductId() {
        return productId;
    }

    public PipelineStage getStage() {
        return stage;
    }

    public StageErrorType getErrorType() {
        return errorType;
    }

    /**
     * Converts this failure into a batch error entry at the given request position.
     */
    public BatchError toBatchError(int index) {
        return new BatchError(index, productId, stage, errorType.wireName(), getMessage());
    }
}
