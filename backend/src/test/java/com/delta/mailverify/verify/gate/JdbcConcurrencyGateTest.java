package com.delta.mailverify.verify.gate;

import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.test.context.ActiveProfiles;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;

@SpringBootTest
@ActiveProfiles("test")
class JdbcConcurrencyGateTest {

    @Autowired
    private NamedParameterJdbcTemplate jdbc;

    @Test
    void acquireHonoursLimitAcrossThreads() throws Exception {
        JdbcConcurrencyGate gate = new JdbcConcurrencyGate(jdbc, Duration.ofMinutes(2));
        String key = "sem:mx:" + UUID.randomUUID();
        int threads = 12;
        ExecutorService executor = Executors.newFixedThreadPool(threads);
        CountDownLatch start = new CountDownLatch(1);
        try {
            List<Future<Boolean>> results = new ArrayList<>();
            for (int i = 0; i < threads; i++) {
                Callable<Boolean> task = () -> {
                    start.await();
                    return gate.acquire(key, 3);
                };
                results.add(executor.submit(task));
            }
            start.countDown();
            int granted = 0;
            for (Future<Boolean> result : results) {
                if (result.get(10, TimeUnit.SECONDS)) {
                    granted++;
                }
            }
            assertThat(granted).isEqualTo(3);
            assertThat(gate.holders(key)).isEqualTo(3);
        } finally {
            executor.shutdownNow();
        }
    }

    @Test
    void releaseIsFloorClampedAndFreesSlot() {
        JdbcConcurrencyGate gate = new JdbcConcurrencyGate(jdbc, Duration.ofMinutes(2));
        String key = "sem:global:" + UUID.randomUUID();

        assertThat(gate.acquire(key, 1)).isTrue();
        assertThat(gate.acquire(key, 1)).isFalse();

        gate.release(key);
        gate.release(key);

        assertThat(gate.holders(key)).isZero();
        assertThat(gate.acquire(key, 1)).isTrue();
    }

    @Test
    void expiredLeaseIsReclaimed() {
        MutableClock clock = new MutableClock(Instant.parse("2026-01-01T00:00:00Z"));
        JdbcConcurrencyGate gate = new JdbcConcurrencyGate(jdbc, Duration.ofSeconds(30), clock);
        String key = "sem:mx:" + UUID.randomUUID();

        assertThat(gate.acquire(key, 1)).isTrue();
        assertThat(gate.acquire(key, 1)).isFalse();

        clock.advance(Duration.ofSeconds(45));

        assertThat(gate.acquire(key, 1)).isTrue();
        assertThat(gate.holders(key)).isEqualTo(1);
    }

    @Test
    void rpsCountsPerSecondWindow() {
        MutableClock clock = new MutableClock(Instant.parse("2026-01-01T00:00:00Z"));
        JdbcConcurrencyGate gate = new JdbcConcurrencyGate(jdbc, Duration.ofSeconds(30), clock);
        String key = "rps:mx:" + UUID.randomUUID();

        assertThat(gate.consumeRps(key, 2)).isTrue();
        assertThat(gate.consumeRps(key, 2)).isTrue();
        assertThat(gate.consumeRps(key, 2)).isFalse();

        clock.advance(Duration.ofSeconds(1));

        assertThat(gate.consumeRps(key, 2)).isTrue();
    }

    @Test
    void refundFreesOneHitInTheCurrentWindow() {
        MutableClock clock = new MutableClock(Instant.parse("2026-01-01T00:00:00Z"));
        JdbcConcurrencyGate gate = new JdbcConcurrencyGate(jdbc, Duration.ofSeconds(30), clock);
        String key = "rps:global:" + UUID.randomUUID();

        assertThat(gate.consumeRps(key, 1)).isTrue();
        gate.refundRps(key);
        gate.refundRps(key);

        assertThat(gate.consumeRps(key, 1)).isTrue();
        assertThat(gate.consumeRps(key, 1)).isFalse();
    }
}
