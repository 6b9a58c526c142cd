package com.phillippitts.catalogintel.service.pipeline;

import com.phillippitts.catalogintel.domain.PredictionRecord;
import com.phillippitts.catalogintel.domain.StageTimings;

import java.util.Objects;

/**
 * A record's prediction together with the time each stage took.
 */
public record PipelineResult(PredictionRecord prediction, StageTimings timings) {

    public PipelineResult {
        Objects.requireNonNull(prediction, "prediction must not be null");
        timings = Objects.requireNonNullElse(timings, StageTimings.empty());
    }
}
