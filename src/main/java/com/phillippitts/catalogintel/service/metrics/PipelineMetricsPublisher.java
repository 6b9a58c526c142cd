package com.phillippitts.catalogintel.service.metrics;

import com.phillippitts.catalogintel.domain.DecisionLogEntry;
import com.phillippitts.catalogintel.domain.PipelineStage;
import com.phillippitts.catalogintel.domain.PredictionRecord;
import com.phillippitts.catalogintel.domain.StageTimings;
import com.phillippitts.catalogintel.exception.StageException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.stereotype.Component;

import java.util.Map;

/**
 * Null-safe facade over {@link PipelineMetrics} used by the pipeline, service and sinks.
 *
 * <p>All methods are no-ops when constructed without metrics, which keeps unit tests free
 * of a registry.
 */
@Component
public final class PipelineMetricsPublisher {

    private static final Logger LOG = LogManager.getLogger(PipelineMetricsPublisher.class);

    /**
     * Shared no-op instance for tests and manual wiring.
     */
    public static final PipelineMetricsPublisher NOOP = new PipelineMetricsPublisher(null);

    private final PipelineMetrics metrics;

    /**
     * @param metrics metrics service (nullable for test mode)
     */
    public PipelineMetricsPublisher(PipelineMetrics metrics) {
        this.metrics = metrics;
        if (metrics == null) {
            LOG.debug("PipelineMetricsPublisher created without metrics (test mode)");
        }
    }

    /**
     * Records stage latencies, the success count and one fusion decision per attribute.
     */
    public void recordSuccess(PredictionRecord prediction, StageTimings timings) {
        if (metrics == null) {
            return;
        }
        recordTimings(timings);
        metrics.incrementSuccess();
        for (DecisionLogEntry entry : prediction.decisionLog().values()) {
            metrics.recordFusionDecision(entry.chosenSource());
        }
    }

    /**
     * Records latencies of the stages that ran, including the failing one, and the failure count.
     */
    public void recordFailure(StageException failure, StageTimings timings) {
        if (metrics == null) {
            return;
        }
        recordTimings(timings);
        metrics.incrementFailure(failure.getStage().wireName(), failure.getErrorType().wireName());
    }

    public void recordAdmissionRejected(String errorType) {
        if (metrics == null) {
            return;
        }
        metrics.incrementAdmissionRejected(errorType);
    }

    public void recordSinkFailure(String sink) {
        if (metrics == null) {
            return;
        }
        metrics.incrementSinkFailure(sink);
    }

    public boolean isEnabled() {
        return metrics != null;
    }

    private void recordTimings(StageTimings timings) {
        for (Map.Entry<PipelineStage, Long> entry : timings.asMap().entrySet()) {
            metrics.recordStageLatency(entry.getKey().wireName(), entry.getValue());
        }
    }
}
