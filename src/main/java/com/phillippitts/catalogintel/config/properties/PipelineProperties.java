package com.phillippitts.catalogintel.config.properties;

import com.phillippitts.catalogintel.util.TimeUtils;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.ConstructorBinding;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

/**
 * Per-record pipeline settings.
 */
@Validated
@ConfigurationProperties(prefix = "catalog.pipeline")
public class PipelineProperties {

    /** Whole-record deadline in milliseconds; 0 disables it. */
    @Min(0)
    private final long recordTimeoutMs;

    /** Upper bound for one image download in milliseconds. */
    @Min(1)
    private final long ingestTimeoutMs;

    /** Where downloaded images are cached. */
    @NotBlank
    private final String imageCacheDir;

    /** Confidence subtracted from vision candidates of low-quality images (0..1). */
    @DecimalMin("0.0")
    @DecimalMax("1.0")
    private final double visionQualityPenalty;

    @ConstructorBinding
    public PipelineProperties(Long recordTimeoutMs, Long ingestTimeoutMs, String imageCacheDir,
                              Double visionQualityPenalty) {
        this.recordTimeoutMs = recordTimeoutMs == null ? 8_000L : recordTimeoutMs;
        if (this.recordTimeoutMs < 0) {
            throw new IllegalArgumentException("catalog.pipeline.record-timeout-ms must be >= 0");
        }
        this.ingestTimeoutMs = ingestTimeoutMs == null ? 10_000L : ingestTimeoutMs;
        if (this.ingestTimeoutMs <= 0) {
            throw new IllegalArgumentException("catalog.pipeline.ingest-timeout-ms must be > 0");
        }
        this.imageCacheDir = imageCacheDir == null || imageCacheDir.isBlank() ? ".cache/images" : imageCacheDir;
        double penalty = visionQualityPenalty == null ? 0.15 : visionQualityPenalty;
        if (penalty < 0.0 || penalty > 1.0) {
            throw new IllegalArgumentException("catalog.pipeline.vision-quality-penalty must be in [0,1]");
        }
        this.visionQualityPenalty = penalty;
    }

    public long getRecordTimeoutMs() {
        return recordTimeoutMs;
    }

    /**
     * @return the record timeout, or {@code null} when disabled
     */
    public Duration recordTimeout() {
        return TimeUtils.millisOrNull(recordTimeoutMs);
    }

    public long getIngestTimeoutMs() {
        return ingestTimeoutMs;
    }

    public Duration ingestTimeout() {
        return Duration.ofMillis(ingestTimeoutMs);
    }

    public String getImageCacheDir() {
        return imageCacheDir;
    }

    public double getVisionQualityPenalty() {
        return visionQualityPenalty;
    }
}
