package com.phillippitts.catalogintel.service.orchestration;

import com.phillippitts.catalogintel.domain.BatchError;
import com.phillippitts.catalogintel.domain.BatchItem;
import com.phillippitts.catalogintel.domain.BatchResult;
import com.phillippitts.catalogintel.domain.PipelineStage;
import com.phillippitts.catalogintel.domain.PredictionRecord;
import com.phillippitts.catalogintel.domain.ProductRecord;
import com.phillippitts.catalogintel.domain.StageTimings;
import com.phillippitts.catalogintel.exception.AdmissionException;
import com.phillippitts.catalogintel.exception.StageException;
import com.phillippitts.catalogintel.service.admission.AdmissionGuard;
import com.phillippitts.catalogintel.service.admission.AdmittedBatch;
import com.phillippitts.catalogintel.service.batch.BatchOrchestrator;
import com.phillippitts.catalogintel.service.metrics.PipelineMetricsPublisher;
import com.phillippitts.catalogintel.service.orchestration.event.PredictionsCompletedEvent;
import com.phillippitts.catalogintel.service.pipeline.PipelineResult;
import com.phillippitts.catalogintel.service.pipeline.RecordPipeline;
import com.phillippitts.catalogintel.util.TimeUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.apache.logging.log4j.ThreadContext;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.UUID;

/**
 * Entry point for prediction requests: admission, pipeline or batch run, then output hand-off.
 *
 * <p>Completed predictions are announced with a {@link PredictionsCompletedEvent}; sink
 * delivery happens asynchronously and cannot change the returned result. Each request ends
 * with one summary log line carrying per-stage milliseconds.
 */
@Service
public class CatalogPredictionService {

    private static final Logger LOG = LogManager.getLogger(CatalogPredictionService.class);

    static final String ROUTE_PREDICT = "POST /v1/predict";
    static final String ROUTE_PREDICT_BATCH = "POST /v1/predict/batch";
    static final String BATCH_ID_KEY = "batchId";

    private final AdmissionGuard admissionGuard;
    private final RecordPipeline pipeline;
    private final BatchOrchestrator batchOrchestrator;
    private final ApplicationEventPublisher eventPublisher;
    private final PipelineMetricsPublisher metricsPublisher;

    public CatalogPredictionService(AdmissionGuard admissionGuard,
                                    RecordPipeline pipeline,
                                    BatchOrchestrator batchOrchestrator,
                                    ApplicationEventPublisher eventPublisher,
                                    PipelineMetricsPublisher metricsPublisher) {
        this.admissionGuard = Objects.requireNonNull(admissionGuard, "admissionGuard must not be null");
        this.pipeline = Objects.requireNonNull(pipeline, "pipeline must not be null");
        this.batchOrchestrator = Objects.requireNonNull(batchOrchestrator, "batchOrchestrator must not be null");
        this.eventPublisher = Objects.requireNonNull(eventPublisher, "eventPublisher must not be null");
        this.metricsPublisher = metricsPublisher != null ? metricsPublisher : PipelineMetricsPublisher.NOOP;
    }

    /**
     * Predicts attributes for one record.
     *
     * @throws AdmissionException when rate limited or the text is too long
     * @throws StageException     when a stage fails or the record deadline passes
     */
    public PredictionRecord predictOne(ProductRecord record) {
        long start = System.nanoTime();
        admit(() -> admissionGuard.admit(record));

        PipelineResult result;
        try {
            result = pipeline.run(record);
        } catch (StageException e) {
            logSummary(ROUTE_PREDICT, 1, 1, StageTimings.empty(), start);
            throw e;
        }
        publishOutputs(List.of(result.prediction()), ROUTE_PREDICT);
        logSummary(ROUTE_PREDICT, 1, 0, result.timings(), start);
        return result.prediction();
    }

    /**
     * Predicts attributes for a batch. Per-record failures are returned as errors.
     *
     * @throws AdmissionException when the whole request is refused
     */
    public BatchResult predictBatch(List<ProductRecord> records) {
        long start = System.nanoTime();
        ThreadContext.put(BATCH_ID_KEY, UUID.randomUUID().toString().substring(0, 8));
        try {
            AdmittedBatch admitted = admit(() -> admissionGuard.admitBatch(records));
            for (BatchError rejected : admitted.rejected()) {
                metricsPublisher.recordAdmissionRejected(rejected.errorType());
            }

            BatchResult result = batchOrchestrator.runBatch(admitted);

            List<PredictionRecord> predictions = new ArrayList<>(result.items().size());
            for (BatchItem item : result.items()) {
                predictions.add(item.prediction());
            }
            publishOutputs(predictions, ROUTE_PREDICT_BATCH);
            logSummary(ROUTE_PREDICT_BATCH, records.size(), result.errors().size(), result.timings(), start);
            logErrorBreakdown(result.errors());
            return result;
        } finally {
            ThreadContext.remove(BATCH_ID_KEY);
        }
    }

    private <T> T admit(AdmissionStep<T> step) {
        try {
            return step.run();
        } catch (AdmissionException e) {
            metricsPublisher.recordAdmissionRejected(e.getErrorType().wireName());
            LOG.info("Request rejected at admission: {} ({})", e.getErrorType(), e.getMessage());
            throw e;
        }
    }

    private void publishOutputs(List<PredictionRecord> predictions, String route) {
        if (predictions.isEmpty()) {
            return;
        }
        eventPublisher.publishEvent(new PredictionsCompletedEvent(predictions, Instant.now(), route));
    }

    private static void logSummary(String route, int total, int errors, StageTimings timings, long start) {
        LOG.info("route={} total={} errors={} ingest_ms={} enrich_ms={} vision_ms={} fuse_ms={} total_ms={} wall_ms={}",
                route, total, errors,
                timings.millis(PipelineStage.INGEST),
                timings.millis(PipelineStage.ENRICH),
                timings.millis(PipelineStage.VISION),
                timings.millis(PipelineStage.FUSE),
                TimeUtils.nanosToMillis(timings.totalNanos()),
                TimeUtils.elapsedMillis(start));
    }

    private static void logErrorBreakdown(List<BatchError> errors) {
        for (BatchError error : errors) {
            LOG.debug("Batch error index={} product={} stage={} type={}",
                    error.index(), error.productId(), error.stage(), error.errorType());
        }
    }

    @FunctionalInterface
    private interface AdmissionStep<T> {
        T run();
    }
}
