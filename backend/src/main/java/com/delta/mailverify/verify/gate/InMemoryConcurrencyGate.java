package com.delta.mailverify.verify.gate;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

public class InMemoryConcurrencyGate implements ConcurrencyGate {
    private final Map<String, Lease> leases = new ConcurrentHashMap<>();
    private final Map<String, Window> windows = new ConcurrentHashMap<>();
    private final Duration leaseTtl;
    private final Clock clock;

    public InMemoryConcurrencyGate(Duration leaseTtl) {
        this(leaseTtl, Clock.systemUTC());
    }

    public InMemoryConcurrencyGate(Duration leaseTtl, Clock clock) {
        this.leaseTtl = leaseTtl;
        this.clock = clock;
    }

    @Override
    public boolean acquire(String key, int limit) {
        if (key == null || limit <= 0) {
            return false;
        }
        AtomicBoolean acquired = new AtomicBoolean(false);
        leases.compute(key, (ignored, current) -> {
            Instant now = clock.instant();
            int holders = current == null || current.expiresAt().isBefore(now) ? 0 : current.holders();
            if (holders >= limit) {
                return current;
            }
            acquired.set(true);
            return new Lease(holders + 1, now.plus(leaseTtl));
        });
        return acquired.get();
    }

    @Override
    public void release(String key) {
        if (key == null) {
            return;
        }
        leases.computeIfPresent(key, (ignored, current) -> {
            int holders = current.holders() - 1;
            return holders <= 0 ? null : new Lease(holders, current.expiresAt());
        });
    }

    @Override
    public boolean consumeRps(String key, int limit) {
        if (key == null || limit <= 0) {
            return false;
        }
        long second = clock.instant().getEpochSecond();
        AtomicInteger count = new AtomicInteger();
        windows.compute(key, (ignored, current) -> {
            if (current == null || current.second() != second) {
                count.set(1);
                return new Window(second, 1);
            }
            count.set(current.hits() + 1);
            return new Window(second, current.hits() + 1);
        });
        return count.get() <= limit;
    }

    @Override
    public void refundRps(String key) {
        if (key == null) {
            return;
        }
        long second = clock.instant().getEpochSecond();
        windows.computeIfPresent(key, (ignored, current) -> {
            if (current.second() != second || current.hits() <= 0) {
                return current;
            }
            return new Window(second, current.hits() - 1);
        });
    }

    public int rpsHits(String key) {
        Window window = windows.get(key);
        if (window == null || window.second() != clock.instant().getEpochSecond()) {
            return 0;
        }
        return window.hits();
    }

    public int holders(String key) {
        Lease lease = leases.get(key);
        if (lease == null || lease.expiresAt().isBefore(clock.instant())) {
            return 0;
        }
        return lease.holders();
    }

    private record Lease(int holders, Instant expiresAt) {}

    private record Window(long second, int hits) {}
}
