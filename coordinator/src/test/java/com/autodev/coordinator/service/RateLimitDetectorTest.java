package com.autodev.coordinator.service;

import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;

class RateLimitDetectorTest {

    static final Duration FALLBACK = Duration.ofHours(1);

    @Test
    void resetLaterToday() {
        Instant now = Instant.parse("2026-03-01T10:00:00Z");

        assertThat(RateLimitDetector.detect("You've hit your limit · resets 5pm (UTC)", now, FALLBACK))
                .contains(Instant.parse("2026-03-01T17:00:00Z"));
    }

    @Test
    void resetTimeAlreadyPassed_meansTomorrow() {
        Instant now = Instant.parse("2026-03-01T18:30:00Z");

        assertThat(RateLimitDetector.detect("You've hit your limit · resets 5pm (UTC)", now, FALLBACK))
                .contains(Instant.parse("2026-03-02T17:00:00Z"));
    }

    @Test
    void minutesAndMidnight() {
        Instant now = Instant.parse("2026-03-01T23:00:00Z");

        assertThat(RateLimitDetector.detect("hit your limit, resets 12:30am UTC", now, FALLBACK))
                .contains(Instant.parse("2026-03-02T00:30:00Z"));
    }

    @Test
    void limitWithoutParseableTime_usesFallback() {
        Instant now = Instant.parse("2026-03-01T10:00:00Z");

        assertThat(RateLimitDetector.detect("HTTP 429 Too Many Requests", now, FALLBACK))
                .contains(now.plus(FALLBACK));
    }

    @Test
    void ordinaryFailure_isNotALimit() {
        assertThat(RateLimitDetector.detect("error: tests failed", Instant.now(), FALLBACK)).isEmpty();
        assertThat(RateLimitDetector.isRateLimited(null)).isFalse();
    }
}
