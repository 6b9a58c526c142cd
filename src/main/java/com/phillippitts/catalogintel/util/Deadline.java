package com.phillippitts.catalogintel.util;

import java.time.Duration;
import java.util.Objects;
import java.util.function.LongSupplier;

/**
 * A point in time computed once and threaded through every stage of a record's pipeline.
 *
 * <p>Backed by a monotonic nanosecond clock. An unbounded deadline never expires.
 */
public final class Deadline {

    private static final Deadline NONE = new Deadline(Long.MAX_VALUE, System::nanoTime, false);

    private final long expiresAtNanos;
    private final LongSupplier nanoClock;
    private final boolean bounded;

    private Deadline(long expiresAtNanos, LongSupplier nanoClock, boolean bounded) {
        this.expiresAtNanos = expiresAtNanos;
        this.nanoClock = nanoClock;
        this.bounded = bounded;
    }

    /**
     * Deadline {@code timeout} from now; a null timeout yields {@link #none()}.
     */
    public static Deadline after(Duration timeout) {
        return after(timeout, System::nanoTime);
    }

    public static Deadline after(Duration timeout, LongSupplier nanoClock) {
        Objects.requireNonNull(nanoClock, "nanoClock must not be null");
        if (timeout == null) {
            return NONE;
        }
        if (timeout.isNegative()) {
            throw new IllegalArgumentException("timeout must be >= 0, got: " + timeout);
        }
        return new Deadline(nanoClock.getAsLong() + timeout.toNanos(), nanoClock, true);
    }

    public static Deadline none() {
        return NONE;
    }

    public boolean isBounded() {
        return bounded;
    }

    public boolean isExpired() {
        return bounded && expiresAtNanos - nanoClock.getAsLong() <= 0;
    }

    /**
     * Nanoseconds left, never negative; {@link Long#MAX_VALUE} when unbounded.
     */
    public long remainingNanos() {
        if (!bounded) {
            return Long.MAX_VALUE;
        }
        return Math.max(0L, expiresAtNanos - nanoClock.getAsLong());
    }

    /**
     * The smaller of {@code limit} and the time left.
     */
    public Duration cap(Duration limit) {
        Objects.requireNonNull(limit, "limit must not be null");
        if (!bounded) {
            return limit;
        }
        Duration remaining = Duration.ofNanos(remainingNanos());
        return remaining.compareTo(limit) < 0 ? remaining : limit;
    }

    @Override
    public String toString() {
        return bounded ? "Deadline[remainingMs=" + TimeUtils.nanosToMillis(remainingNanos()) + "]" : "Deadline[none]";
    }
}
