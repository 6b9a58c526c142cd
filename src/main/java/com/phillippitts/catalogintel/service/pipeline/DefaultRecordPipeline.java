package com.phillippitts.catalogintel.service.pipeline;

import com.phillippitts.catalogintel.domain.AttributeCandidate;
import com.phillippitts.catalogintel.domain.IngestedRecord;
import com.phillippitts.catalogintel.domain.PipelineStage;
import com.phillippitts.catalogintel.domain.PredictionRecord;
import com.phillippitts.catalogintel.domain.ProductRecord;
import com.phillippitts.catalogintel.domain.StageTimings;
import com.phillippitts.catalogintel.exception.StageException;
import com.phillippitts.catalogintel.service.extract.AttributeExtractor;
import com.phillippitts.catalogintel.service.fusion.FusionEngine;
import com.phillippitts.catalogintel.service.ingest.ImageIngestor;
import com.phillippitts.catalogintel.service.metrics.PipelineMetricsPublisher;
import com.phillippitts.catalogintel.util.Deadline;
import com.phillippitts.catalogintel.util.LogSanitizer;
import com.phillippitts.catalogintel.util.TimeUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.apache.logging.log4j.ThreadContext;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Default record pipeline: ingest, enrich (text), vision, then fuse.
 *
 * <p><b>Thread Model:</b> ingest, enrich and vision calls run on the stage executor so an
 * overdue call can be abandoned; fusion never suspends and runs on the calling thread. The
 * product id is placed in the log {@link ThreadContext} for the duration of the run.
 *
 * <p><b>Candidate boundary:</b> candidates whose source does not match the extractor that
 * returned them are dropped before fusion.
 */
public class DefaultRecordPipeline implements RecordPipeline {

    private static final Logger LOG = LogManager.getLogger(DefaultRecordPipeline.class);

    static final String PRODUCT_ID_KEY = "productId";

    private final ImageIngestor ingestor;
    private final AttributeExtractor textExtractor;
    private final AttributeExtractor visionExtractor;
    private final FusionEngine fusionEngine;
    private final StageRunner stageRunner;
    private final Duration recordTimeout;
    private final PipelineMetricsPublisher metricsPublisher;

    /**
     * @param recordTimeout per-record time budget, or {@code null} for no deadline
     */
    public DefaultRecordPipeline(ImageIngestor ingestor,
                                 AttributeExtractor textExtractor,
                                 AttributeExtractor visionExtractor,
                                 FusionEngine fusionEngine,
                                 StageRunner stageRunner,
                                 Duration recordTimeout,
                                 PipelineMetricsPublisher metricsPublisher) {
        this.ingestor = Objects.requireNonNull(ingestor, "ingestor must not be null");
        this.textExtractor = Objects.requireNonNull(textExtractor, "textExtractor must not be null");
        this.visionExtractor = Objects.requireNonNull(visionExtractor, "visionExtractor must not be null");
        this.fusionEngine = Objects.requireNonNull(fusionEngine, "fusionEngine must not be null");
        this.stageRunner = Objects.requireNonNull(stageRunner, "stageRunner must not be null");
        this.recordTimeout = recordTimeout;
        this.metricsPublisher = metricsPublisher != null ? metricsPublisher : PipelineMetricsPublisher.NOOP;
    }

    @Override
    public PipelineResult run(ProductRecord record) {
        return run(record, Deadline.after(recordTimeout));
    }

    @Override
    public PipelineResult run(ProductRecord record, Deadline deadline) {
        Objects.requireNonNull(record, "record must not be null");
        Objects.requireNonNull(deadline, "deadline must not be null");

        String productId = record.productId();
        String previousProductId = ThreadContext.get(PRODUCT_ID_KEY);
        ThreadContext.put(PRODUCT_ID_KEY, productId);

        RecordStateMachine state = new RecordStateMachine();
        StageTimings timings = StageTimings.empty();
        long start = System.nanoTime();
        try {
            LOG.debug("Pipeline start: title='{}' {}", LogSanitizer.preview(record.title()), deadline);

            PipelineStage stage = state.nextStage();
            start = System.nanoTime();
            IngestedRecord ingested = stageRunner.run(stage, productId, deadline,
                    () -> ingestor.ingest(record, deadline));
            timings = timings.with(stage, System.nanoTime() - start);
            state.complete(stage);

            stage = state.nextStage();
            start = System.nanoTime();
            List<AttributeCandidate> textCandidates = stageRunner.run(stage, productId, deadline,
                    () -> textExtractor.extract(ingested, deadline));
            timings = timings.with(stage, System.nanoTime() - start);
            state.complete(stage);

            stage = state.nextStage();
            start = System.nanoTime();
            List<AttributeCandidate> visionCandidates = stageRunner.run(stage, productId, deadline,
                    () -> visionExtractor.extract(ingested, deadline));
            timings = timings.with(stage, System.nanoTime() - start);
            state.complete(stage);

            List<AttributeCandidate> candidates = new ArrayList<>();
            addFrom(textExtractor, textCandidates, candidates, productId);
            addFrom(visionExtractor, visionCandidates, candidates, productId);

            stage = state.nextStage();
            start = System.nanoTime();
            PredictionRecord prediction = stageRunner.runInline(stage, productId, deadline,
                    () -> fusionEngine.fuse(productId, record.title(), candidates));
            timings = timings.with(stage, System.nanoTime() - start);
            state.complete(stage);
            state.succeed();

            metricsPublisher.recordSuccess(prediction, timings);
            LOG.debug("Pipeline succeeded with {} attributes in {} ms ({})",
                    prediction.finalPredictions().size(), TimeUtils.nanosToMillis(timings.totalNanos()), timings);
            return new PipelineResult(prediction, timings);
        } catch (StageException e) {
            state.fail(e.getStage());
            // The failing stage's own time counts toward the record's total.
            timings = timings.with(e.getStage(), System.nanoTime() - start);
            metricsPublisher.recordFailure(e, timings);
            LOG.warn("Pipeline failed in stage {} ({}): {}", state.failedStage(), e.getErrorType(), e.getMessage());
            throw e;
        } finally {
            if (previousProductId != null) {
                ThreadContext.put(PRODUCT_ID_KEY, previousProductId);
            } else {
                ThreadContext.remove(PRODUCT_ID_KEY);
            }
        }
    }

    private static void addFrom(AttributeExtractor extractor, List<AttributeCandidate> produced,
                                List<AttributeCandidate> out, String productId) {
        if (produced == null) {
            return;
        }
        for (AttributeCandidate candidate : produced) {
            if (candidate == null) {
                continue;
            }
            if (candidate.source() != extractor.source()) {
                LOG.warn("Dropping {} candidate '{}' for {} from {} extractor",
                        candidate.source(), candidate.attributeName(), productId, extractor.source());
                continue;
            }
            out.add(candidate);
        }
    }
}
