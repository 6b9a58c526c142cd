package com.phillippitts.catalogintel.config;

import com.phillippitts.catalogintel.config.properties.GuardrailProperties;
import com.phillippitts.catalogintel.config.properties.PipelineProperties;
import com.phillippitts.catalogintel.service.admission.AdmissionGuard;
import com.phillippitts.catalogintel.service.admission.TokenBucketRateLimiter;
import com.phillippitts.catalogintel.service.batch.BatchOrchestrator;
import com.phillippitts.catalogintel.service.batch.DefaultBatchOrchestrator;
import com.phillippitts.catalogintel.service.extract.DimensionParser;
import com.phillippitts.catalogintel.service.extract.HashingVisionLabelProvider;
import com.phillippitts.catalogintel.service.extract.TextAttributeExtractor;
import com.phillippitts.catalogintel.service.extract.VisionAttributeExtractor;
import com.phillippitts.catalogintel.service.extract.VisionLabelProvider;
import com.phillippitts.catalogintel.service.fusion.ConfidenceFusionEngine;
import com.phillippitts.catalogintel.service.fusion.FusionEngine;
import com.phillippitts.catalogintel.service.ingest.CachingImageIngestor;
import com.phillippitts.catalogintel.service.ingest.ImageIngestor;
import com.phillippitts.catalogintel.service.metrics.PipelineMetricsPublisher;
import com.phillippitts.catalogintel.service.pipeline.DefaultRecordPipeline;
import com.phillippitts.catalogintel.service.pipeline.RecordPipeline;
import com.phillippitts.catalogintel.service.pipeline.StageRunner;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.nio.file.Paths;
import java.util.concurrent.Executor;

/**
 * Wires admission, extractors, fusion, the record pipeline and the batch orchestrator explicitly
 * so both extractor beans reach the pipeline in the right slot.
 */
@Configuration
public class PipelineConfig {

    private static final Logger LOG = LogManager.getLogger(PipelineConfig.class);

    private final GuardrailProperties guardrails;
    private final PipelineProperties pipelineProperties;

    public PipelineConfig(GuardrailProperties guardrails, PipelineProperties pipelineProperties) {
        this.guardrails = guardrails;
        this.pipelineProperties = pipelineProperties;
    }

    /**
     * Process-wide admission guard. One token bucket is shared by every request.
     */
    @Bean
    public AdmissionGuard admissionGuard() {
        TokenBucketRateLimiter limiter = null;
        if (guardrails.isRateLimitEnabled()) {
            limiter = new TokenBucketRateLimiter(guardrails.getRateLimitCapacity(),
                    guardrails.getRateLimitRefillPerMinute());
        } else {
            LOG.info("Rate limiting disabled (catalog.guardrails.rate-limit-capacity=0)");
        }
        return new AdmissionGuard(guardrails.getMaxBatchItems(), guardrails.getMaxTextChars(), limiter);
    }

    @Bean
    public FusionEngine fusionEngine() {
        return new ConfidenceFusionEngine();
    }

    @Bean
    public ImageIngestor imageIngestor() {
        return new CachingImageIngestor(Paths.get(pipelineProperties.getImageCacheDir()),
                pipelineProperties.ingestTimeout());
    }

    @Bean
    public TextAttributeExtractor textAttributeExtractor() {
        return new TextAttributeExtractor(new DimensionParser());
    }

    @Bean
    public VisionLabelProvider visionLabelProvider() {
        return new HashingVisionLabelProvider();
    }

    @Bean
    public VisionAttributeExtractor visionAttributeExtractor(VisionLabelProvider visionLabelProvider) {
        return new VisionAttributeExtractor(visionLabelProvider, pipelineProperties.getVisionQualityPenalty());
    }

    @Bean
    public StageRunner stageRunner(@Qualifier("stageExecutor") Executor stageExecutor) {
        return new StageRunner(stageExecutor);
    }

    @Bean
    public RecordPipeline recordPipeline(ImageIngestor imageIngestor,
                                         TextAttributeExtractor textAttributeExtractor,
                                         VisionAttributeExtractor visionAttributeExtractor,
                                         FusionEngine fusionEngine,
                                         StageRunner stageRunner,
                                         PipelineMetricsPublisher metricsPublisher) {
        return new DefaultRecordPipeline(imageIngestor, textAttributeExtractor, visionAttributeExtractor,
                fusionEngine, stageRunner, pipelineProperties.recordTimeout(), metricsPublisher);
    }

    @Bean
    public BatchOrchestrator batchOrchestrator(RecordPipeline recordPipeline,
                                               @Qualifier("recordExecutor") Executor recordExecutor) {
        return new DefaultBatchOrchestrator(recordPipeline, recordExecutor);
    }
}
