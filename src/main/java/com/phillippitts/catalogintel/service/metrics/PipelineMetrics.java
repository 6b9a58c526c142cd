package com.phillippitts.catalogintel.service.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

import java.util.concurrent.TimeUnit;

/**
 * Micrometer instrumentation for the prediction pipeline.
 *
 * <p>Provides:
 * <ul>
 *   <li>Per-stage latency (ingest, enrich, vision, fuse)</li>
 *   <li>Record success and failure counts, failures tagged by stage and error type</li>
 *   <li>Fusion decisions by chosen source</li>
 *   <li>Admission rejections and sink delivery failures</li>
 * </ul>
 *
 * <p>All metrics are exposed at /actuator/prometheus.
 */
@Component
public class PipelineMetrics {

    private static final String METRIC_PREFIX = "catalog";

    private final MeterRegistry registry;

    public PipelineMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    public void recordStageLatency(String stage, long durationNanos) {
        Timer.builder(METRIC_PREFIX + ".pipeline.stage.latency")
                .description("Time spent in one pipeline stage for one record")
                .tag("stage", stage)
                .register(registry)
                .record(durationNanos, TimeUnit.NANOSECONDS);
    }

    public void incrementSuccess() {
        Counter.builder(METRIC_PREFIX + ".pipeline.record.success")
                .description("Records that produced a prediction")
                .register(registry)
                .increment();
    }

    public void incrementFailure(String stage, String errorType) {
        Counter.builder(METRIC_PREFIX + ".pipeline.record.failure")
                .description("Records that failed in a stage")
                .tag("stage", stage)
                .tag("error_type", errorType)
                .register(registry)
                .increment();
    }

    public void recordFusionDecision(String chosenSource) {
        Counter.builder(METRIC_PREFIX + ".fusion.decision")
                .description("Fused attributes by chosen source")
                .tag("chosen_source", chosenSource)
                .register(registry)
                .increment();
    }

    public void incrementAdmissionRejected(String errorType) {
        Counter.builder(METRIC_PREFIX + ".admission.rejected")
                .description("Requests or items refused by admission")
                .tag("error_type", errorType)
                .register(registry)
                .increment();
    }

    public void incrementSinkFailure(String sink) {
        Counter.builder(METRIC_PREFIX + ".sink.failure")
                .description("Failed deliveries to an output sink")
                .tag("sink", sink)
                .register(registry)
                .increment();
    }
}
