package com.phillippitts.catalogintel.service.pipeline;

import com.phillippitts.catalogintel.domain.PipelineStage;

/**
 * Tracks one record's progress through {@link PipelineState}. Owned by a single pipeline run,
 * so not thread-safe.
 */
final class RecordStateMachine {

    private PipelineState current = PipelineState.ADMITTED;
    private PipelineStage failedStage;

    PipelineState current() {
        return current;
    }

    /**
     * @throws IllegalStateException when no stage is left to run
     */
    PipelineStage nextStage() {
        PipelineStage stage = current.nextStage();
        if (stage == null) {
            throw new IllegalStateException("No stage to run from state " + current);
        }
        return stage;
    }

    /**
     * Moves past the stage that just completed.
     */
    void complete(PipelineStage stage) {
        if (current.nextStage() != stage) {
            throw new IllegalStateException("Cannot complete " + stage + " from state " + current);
        }
        current = PipelineState.values()[current.ordinal() + 1];
    }

    void succeed() {
        if (current != PipelineState.FUSED) {
            throw new IllegalStateException("Cannot succeed from state " + current);
        }
        current = PipelineState.SUCCEEDED;
    }

    void fail(PipelineStage stage) {
        if (current.isTerminal()) {
            throw new IllegalStateException("Cannot fail from terminal state " + current);
        }
        failedStage = stage;
        current = PipelineState.FAILED;
    }

    /**
     * Stage reported with the failure, or {@code null} unless FAILED.
     */
    PipelineStage failedStage() {
        return failedStage;
    }
}
