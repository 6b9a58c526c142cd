package com.phillippitts.catalogintel.service.pipeline;

import com.phillippitts.catalogintel.domain.PipelineStage;

/**
 * Lifecycle of one record inside the pipeline.
 *
 * <pre>
 * ADMITTED → INGESTED → ENRICHED → VISION_SCORED → FUSED → SUCCEEDED
 * any non-terminal state → FAILED
 * </pre>
 */
public enum PipelineState {
    ADMITTED(PipelineStage.INGEST),
    INGESTED(PipelineStage.ENRICH),
    ENRICHED(PipelineStage.VISION),
    VISION_SCORED(PipelineStage.FUSE),
    FUSED(null),
    SUCCEEDED(null),
    FAILED(null);

    private final PipelineStage nextStage;

    PipelineState(PipelineStage nextStage) {
        this.nextStage = nextStage;
    }

    /**
     * Stage that runs from this state, or {@code null} when no stage is left.
     */
    public PipelineStage nextStage() {
        return nextStage;
    }

    public boolean isTerminal() {
        return this == SUCCEEDED || this == FAILED;
    }
}
