package com.phillippitts.catalogintel.exception;

/**
 * Classification of a failure inside a pipeline stage.
 */
public enum StageErrorType {
    FETCH_FAILED("fetch_failed"),
    MALFORMED_INPUT("malformed_input"),
    UNREACHABLE_RESOURCE("unreachable_resource"),
    TIMEOUT("timeout"),
    UNSUPPORTED_FORMAT("unsupported_format"),
    /** Unexpected runtime error raised by stage code. */
    STAGE_FAILURE("stage_failure");

    private final String wireName;

    StageErrorType(String wireName) {
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
