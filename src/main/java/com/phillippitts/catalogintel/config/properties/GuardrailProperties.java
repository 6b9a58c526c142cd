package com.phillippitts.catalogintel.config.properties;

import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.ConstructorBinding;
import org.springframework.validation.annotation.Validated;

/**
 * Admission limits and the shared rate budget.
 */
@Validated
@ConfigurationProperties(prefix = "catalog.guardrails")
public class GuardrailProperties {

    /** Largest accepted batch. */
    @Min(1)
    private final int maxBatchItems;

    /** Largest accepted title + description length per record. */
    @Min(1)
    private final int maxTextChars;

    /** Token bucket capacity; 0 disables rate limiting. */
    @Min(0)
    private final int rateLimitCapacity;

    /** Tokens added per minute. */
    @DecimalMin("0.0")
    private final double rateLimitRefillPerMinute;

    @ConstructorBinding
    public GuardrailProperties(Integer maxBatchItems, Integer maxTextChars, Integer rateLimitCapacity,
                               Double rateLimitRefillPerMinute) {
        this.maxBatchItems = maxBatchItems == null ? 50 : maxBatchItems;
        if (this.maxBatchItems < 1) {
            throw new IllegalArgumentException("catalog.guardrails.max-batch-items must be >= 1");
        }
        this.maxTextChars = maxTextChars == null ? 10_000 : maxTextChars;
        if (this.maxTextChars < 1) {
            throw new IllegalArgumentException("catalog.guardrails.max-text-chars must be >= 1");
        }
        this.rateLimitCapacity = rateLimitCapacity == null ? 120 : rateLimitCapacity;
        if (this.rateLimitCapacity < 0) {
            throw new IllegalArgumentException("catalog.guardrails.rate-limit-capacity must be >= 0");
        }
        this.rateLimitRefillPerMinute = rateLimitRefillPerMinute == null
                ? this.rateLimitCapacity : rateLimitRefillPerMinute;
        if (this.rateLimitRefillPerMinute < 0) {
            throw new IllegalArgumentException("catalog.guardrails.rate-limit-refill-per-minute must be >= 0");
        }
    }

    public int getMaxBatchItems() {
        return maxBatchItems;
    }

    public int getMaxTextChars() {
        return maxTextChars;
    }

    public int getRateLimitCapacity() {
        return rateLimitCapacity;
    }

    public double getRateLimitRefillPerMinute() {
        return rateLimitRefillPerMinute;
    }

    public boolean isRateLimitEnabled() {
        return rateLimitCapacity > 0;
    }
}
