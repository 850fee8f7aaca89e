package com.delta.mailverify.verify.gate;

/**
 * Shared counters guarding outbound SMTP work. Every call is non-blocking: a caller that is
 * denied must reschedule itself instead of waiting.
 */
public interface ConcurrencyGate {

    /**
     * Takes one lease on {@code key} when fewer than {@code limit} are held. The lease carries a
     * bounded TTL, so holders that crash without releasing stop counting once it lapses.
     */
    boolean acquire(String key, int limit);

    /**
     * Returns one lease. Safe to call for keys that were never acquired; the count never goes
     * below zero.
     */
    void release(String key);

    /**
     * Counts one hit against the current one-second window for {@code key}.
     *
     * @return true while the window is still within {@code limit}
     */
    boolean consumeRps(String key, int limit);

    /**
     * Takes back one hit from the current window for {@code key}. Never goes below zero.
     */
    void refundRps(String key);
}
