package com.phillippitts.catalogintel.service.admission;

import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.LongSupplier;

/**
 * Process-wide token bucket refilled lazily from elapsed time on every check.
 *
 * <p>Token count and last-refill timestamp are guarded by one lock; no background
 * thread is involved.
 *
 * <p><b>Thread Safety:</b> This class is thread-safe.
 */
public final class TokenBucketRateLimiter {

    private static final double NANOS_PER_MINUTE = 60_000_000_000.0;

    private final Lock lock = new ReentrantLock();
    private final int capacity;
    private final double refillPerNano;
    private final LongSupplier nanoClock;

    private double tokens;
    private long lastRefillNanos;

    public TokenBucketRateLimiter(int capacity, double refillPerMinute) {
        this(capacity, refillPerMinute, System::nanoTime);
    }

    /**
     * @param capacity        maximum tokens held, must be positive
     * @param refillPerMinute tokens added per minute, must not be negative
     * @param nanoClock       monotonic nanosecond clock
     */
    public TokenBucketRateLimiter(int capacity, double refillPerMinute, LongSupplier nanoClock) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("capacity must be > 0, got: " + capacity);
        }
        if (refillPerMinute < 0 || Double.isNaN(refillPerMinute)) {
            throw new IllegalArgumentException("refillPerMinute must be >= 0, got: " + refillPerMinute);
        }
        this.capacity = capacity;
        this.refillPerNano = refillPerMinute / NANOS_PER_MINUTE;
        this.nanoClock = nanoClock;
        this.tokens = capacity;
        this.lastRefillNanos = nanoClock.getAsLong();
    }

    /**
     * Takes one token if available.
     *
     * @return false when the bucket is empty
     */
    public boolean tryConsume() {
        lock.lock();
        try {
            refill();
            if (tokens < 1.0) {
                return false;
            }
            tokens -= 1.0;
            return true;
        } finally {
            lock.unlock();
        }
    }

    public double availableTokens() {
        lock.lock();
        try {
            refill();
            return tokens;
        } finally {
            lock.unlock();
        }
    }

    public int capacity() {
        return capacity;
    }

    // Caller holds the lock.
    private void refill() {
        long now = nanoClock.getAsLong();
        long elapsed = now - lastRefillNanos;
        if (elapsed <= 0) {
            return;
        }
        tokens = Math.min(capacity, tokens + elapsed * refillPerNano);
        lastRefillNanos = now;
    }
}
