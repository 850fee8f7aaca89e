package com.delta.mailverify.verify.util;

import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;

class FullJitterBackoffTest {

    @Test
    void ceilingDoublesPerAttemptUntilCap() {
        assertEquals(1_000L, FullJitterBackoff.ceilingMs(0, 1_000L, 30_000L));
        assertEquals(4_000L, FullJitterBackoff.ceilingMs(2, 1_000L, 30_000L));
        assertEquals(30_000L, FullJitterBackoff.ceilingMs(5, 1_000L, 30_000L));
        assertEquals(30_000L, FullJitterBackoff.ceilingMs(200, 1_000L, 30_000L));
    }

    @Test
    void delayIsUniformWithinCeiling() {
        for (int attempt = 0; attempt <= 6; attempt++) {
            long ceiling = FullJitterBackoff.ceilingMs(attempt, 500L, 10_000L);
            for (int i = 0; i < 50; i++) {
                Duration delay = FullJitterBackoff.delay(attempt, 500L, 10_000L);
                assertThat(delay.toMillis()).isBetween(0L, ceiling);
            }
        }
    }

    @Test
    void zeroBaseMeansNoDelay() {
        assertEquals(Duration.ZERO, FullJitterBackoff.delay(3, 0L, 10_000L));
    }
}
