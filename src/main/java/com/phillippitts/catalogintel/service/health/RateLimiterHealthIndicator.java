package com.phillippitts.catalogintel.service.health;

import com.phillippitts.catalogintel.service.admission.AdmissionGuard;
import com.phillippitts.catalogintel.service.admission.TokenBucketRateLimiter;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

/**
 * Reports the shared rate limiter's remaining tokens.
 *
 * <p>Always UP: an empty bucket is load, not a fault. Exposed via /actuator/health.
 */
@Component
public class RateLimiterHealthIndicator implements HealthIndicator {

    private final AdmissionGuard admissionGuard;

    public RateLimiterHealthIndicator(AdmissionGuard admissionGuard) {
        this.admissionGuard = admissionGuard;
    }

    @Override
    public Health health() {
        Health.Builder builder = Health.up()
                .withDetail("maxBatchItems", admissionGuard.maxBatchItems())
                .withDetail("maxTextChars", admissionGuard.maxTextChars());
        TokenBucketRateLimiter limiter = admissionGuard.rateLimiter();
        if (limiter == null) {
            return builder.withDetail("rateLimit", "disabled").build();
        }
        return builder
                .withDetail("rateLimit", "enabled")
                .withDetail("availableTokens", (long) Math.floor(limiter.availableTokens()))
                .withDetail("capacity", limiter.capacity())
                .build();
    }
}
