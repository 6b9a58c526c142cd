package com.phillippitts.catalogintel.service.admission;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class TokenBucketRateLimiterTest {

    private final AtomicLong clock = new AtomicLong(0);

    @Test
    void startsFullAndRejectsWhenEmpty() {
        var limiter = new TokenBucketRateLimiter(3, 60, clock::get);

        assertThat(limiter.tryConsume()).isTrue();
        assertThat(limiter.tryConsume()).isTrue();
        assertThat(limiter.tryConsume()).isTrue();
        assertThat(limiter.tryConsume()).isFalse();
    }

    @Test
    void refillsLazilyFromElapsedTime() {
        var limiter = new TokenBucketRateLimiter(2, 60, clock::get); // one token per second
        limiter.tryConsume();
        limiter.tryConsume();
        assertThat(limiter.tryConsume()).isFalse();

        clock.addAndGet(TimeUnit.MILLISECONDS.toNanos(999));
        assertThat(limiter.tryConsume()).isFalse();

        clock.addAndGet(TimeUnit.MILLISECONDS.toNanos(1));
        assertThat(limiter.tryConsume()).isTrue();
    }

    @Test
    void refillIsClampedToCapacity() {
        var limiter = new TokenBucketRateLimiter(5, 600, clock::get);
        limiter.tryConsume();

        clock.addAndGet(TimeUnit.MINUTES.toNanos(10));

        assertThat(limiter.availableTokens()).isCloseTo(5.0, within(1e-9));
    }

    @Test
    void zeroRefillNeverRecovers() {
        var limiter = new TokenBucketRateLimiter(1, 0, clock::get);
        assertThat(limiter.tryConsume()).isTrue();

        clock.addAndGet(TimeUnit.HOURS.toNanos(1));

        assertThat(limiter.tryConsume()).isFalse();
    }

    @Test
    void rejectsInvalidConfiguration() {
        assertThatThrownBy(() -> new TokenBucketRateLimiter(0, 10))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("capacity");
        assertThatThrownBy(() -> new TokenBucketRateLimiter(10, -1))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("refillPerMinute");
    }

    @Test
    void concurrentCallersNeverOverdraw() throws InterruptedException {
        var limiter = new TokenBucketRateLimiter(50, 0, clock::get);
        AtomicInteger granted = new AtomicInteger();
        CountDownLatch start = new CountDownLatch(1);
        CountDownLatch done = new CountDownLatch(8);
        List<Thread> threads = new ArrayList<>();

        for (int t = 0; t < 8; t++) {
            Thread thread = new Thread(() -> {
                try {
                    start.await();
                    for (int i = 0; i < 20; i++) {
                        if (limiter.tryConsume()) {
                            granted.incrementAndGet();
                        }
                    }
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                } finally {
                    done.countDown();
                }
            });
            threads.add(thread);
            thread.start();
        }
        start.countDown();

        assertThat(done.await(5, TimeUnit.SECONDS)).isTrue();
        assertThat(granted.get()).isEqualTo(50);
    }
}
