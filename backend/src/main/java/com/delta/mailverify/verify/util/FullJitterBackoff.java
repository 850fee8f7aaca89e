package com.delta.mailverify.verify.util;

import java.time.Duration;
import java.util.concurrent.ThreadLocalRandom;

/**
 * Exponential backoff with full jitter: a uniform delay in {@code [0, min(cap, base * 2^attempt)]}.
 */
public final class FullJitterBackoff {

    private FullJitterBackoff() {}

    public static long ceilingMs(int attempt, long baseMs, long capMs) {
        int exponent = Math.max(0, Math.min(attempt, 30));
        long raw = baseMs * (1L << exponent);
        if (raw < 0) {
            return capMs;
        }
        return Math.min(capMs, raw);
    }

    public static Duration delay(int attempt, long baseMs, long capMs) {
        long ceiling = ceilingMs(attempt, baseMs, capMs);
        if (ceiling <= 0) {
            return Duration.ZERO;
        }
        return Duration.ofMillis(ThreadLocalRandom.current().nextLong(ceiling + 1));
    }
}
