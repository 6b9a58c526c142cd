package com.phillippitts.catalogintel.service.orchestration.event;

import com.phillippitts.catalogintel.domain.PredictionRecord;

import java.time.Instant;
import java.util.List;

/**
 * Emitted when a request finishes and its predictions are ready for the output sinks.
 *
 * @param predictions successful predictions in request order
 * @param timestamp   when the request completed
 * @param route       request route, e.g. {@code predict} or {@code predict_batch}
 */
public record PredictionsCompletedEvent(
        List<PredictionRecord> predictions,
        Instant timestamp,
        String route
) {
    public PredictionsCompletedEvent {
        predictions = predictions == null ? List.of() : List.copyOf(predictions);
    }
}
