package com.phillippitts.catalogintel.util;

import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicLong;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class UtilTest {

    @Test
    void deadlineExpiresOnFakeClock() {
        AtomicLong clock = new AtomicLong(1_000L);
        Deadline deadline = Deadline.after(Duration.ofMillis(5), clock::get);

        assertThat(deadline.isExpired()).isFalse();
        assertThat(deadline.remainingNanos()).isEqualTo(5_000_000L);
        assertThat(deadline.cap(Duration.ofSeconds(1))).isEqualTo(Duration.ofMillis(5));

        clock.addAndGet(5_000_000L);
        assertThat(deadline.isExpired()).isTrue();
        assertThat(deadline.remainingNanos()).isZero();
        assertThat(deadline.cap(Duration.ofSeconds(1))).isEqualTo(Duration.ZERO);
    }

    @Test
    void unboundedDeadlineNeverExpires() {
        Deadline none = Deadline.after(null);

        assertThat(none).isSameAs(Deadline.none());
        assertThat(none.isBounded()).isFalse();
        assertThat(none.isExpired()).isFalse();
        assertThat(none.cap(Duration.ofSeconds(3))).isEqualTo(Duration.ofSeconds(3));
        assertThat(none.toString()).isEqualTo("Deadline[none]");
        assertThatThrownBy(() -> Deadline.after(Duration.ofMillis(-1)))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void timeUtilsConversions() {
        assertThat(TimeUtils.nanosToMillis(2_999_999L)).isEqualTo(2L);
        assertThat(TimeUtils.millisOrNull(0)).isNull();
        assertThat(TimeUtils.millisOrNull(250)).isEqualTo(Duration.ofMillis(250));
        assertThat(TimeUtils.elapsedMillis(System.nanoTime())).isGreaterThanOrEqualTo(0L);
    }

    @Test
    void logSanitizerTruncatesAndFlattens() {
        assertThat(LogSanitizer.truncate(null, 10)).isEmpty();
        assertThat(LogSanitizer.truncate("abcdef", 3)).isEqualTo("abc...");
        assertThat(LogSanitizer.truncate("abc", 3)).isEqualTo("abc");
        assertThat(LogSanitizer.preview("line one\nline two")).isEqualTo("line one line two");
        assertThat(LogSanitizer.preview("x".repeat(60))).hasSize(LogSanitizer.TITLE_PREVIEW_CHARS + 3);
    }

    @Test
    void sha1IsStableHex() {
        assertThat(Digests.sha1Hex("abc")).isEqualTo("a9993e364706816aba3e25717850c26c9cd0d89d");
        assertThat(Digests.sha1Hex("abc".getBytes(java.nio.charset.StandardCharsets.UTF_8)))
                .isEqualTo(Digests.sha1Hex("abc"));
    }
}
