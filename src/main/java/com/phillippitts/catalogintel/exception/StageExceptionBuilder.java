package com.phillippitts.catalogintel.exception;

import com.phillippitts.catalogintel.domain.PipelineStage;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Fluent builder for constructing StageException with rich contextual information.
 *
 * <p><b>Usage Examples:</b>
 * <pre>
 * throw StageExceptionBuilder.create("Stage exceeded record deadline")
 *         .product("sku-1")
 *         .stage(PipelineStage.ENRICH)
 *         .errorType(StageErrorType.TIMEOUT)
 *         .durationMs(8004)
 *         .build();
 * </pre>
 */
public final class StageExceptionBuilder {

    private final String message;
    private String productId;
    private PipelineStage stage;
    private StageErrorType errorType = StageErrorType.STAGE_FAILURE;
    private Throwable cause;
    private Long durationMs;
    private final Map<String, String> metadata = new LinkedHashMap<>();

    private StageExceptionBuilder(String message) {
        this.message = message;
    }

    /**
     * Creates a new builder with the base error message.
     *
     * @param message base error message (must not be null)
     * @return new builder instance
     */
    public static StageExceptionBuilder create(String message) {
        if (message == null || message.isEmpty()) {
            throw new IllegalArgumentException("message must not be null or empty");
        }
        return new StageExceptionBuilder(message);
    }

    public StageExceptionBuilder product(String productId) {
        this.productId = productId;
        return this;
    }

    public StageExceptionBuilder stage(PipelineStage stage) {
        this.stage = stage;
        return this;
    }

    public StageExceptionBuilder errorType(StageErrorType errorType) {
        this.errorType = errorType;
        return this;
    }

    public StageExceptionBuilder cause(Throwable cause) {
        this.cause = cause;
        return this;
    }

    public StageExceptionBuilder durationMs(long durationMs) {
        this.durationMs = durationMs;
        return this;
    }

    /**
     * Adds a metadata key-value pair to the exception message. Null keys or values are ignored.
     */
    public StageExceptionBuilder metadata(String key, Object value) {
        if (key != null && value != null) {
            this.metadata.put(key, String.valueOf(value));
        }
        return this;
    }

    /**
     * Builds the exception. The message format is
     * {@code {message} (durationMs={ms}, {key1}={val1}, ...)}.
     *
     * @throws IllegalStateException if no stage was set
     */
    public StageException build() {
        if (stage == null) {
            throw new IllegalStateException("stage must be set");
        }
        String detailedMessage = buildDetailedMessage();
        if (cause != null) {
            return new StageException(productId, stage, errorType, detailedMessage, cause);
        }
        return new StageException(productId, stage, errorType, detailedMessage);
    }

    private String buildDetailedMessage() {
        if (durationMs == null && metadata.isEmpty()) {
            return message;
        }
        StringBuilder sb = new StringBuilder(message).append(" (");
        boolean first = true;
        if (durationMs != null) {
            sb.append("durationMs=").append(durationMs);
            first = false;
        }
        for (Map.Entry<String, String> entry : metadata.entrySet()) {
            if (!first) {
                sb.append(", ");
            }
            sb.append(entry.getKey()).append("=").append(entry.getValue());
            first = false;
        }
        return sb.append(")").toString();
    }
}
