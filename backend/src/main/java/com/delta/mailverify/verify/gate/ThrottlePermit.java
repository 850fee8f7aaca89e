package com.delta.mailverify.verify.gate;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

public class ThrottlePermit implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(ThrottlePermit.class);

    private final ConcurrencyGate gate;
    private final List<String> heldKeys;
    private final String denialReason;
    private boolean released;

    ThrottlePermit(ConcurrencyGate gate, List<String> heldKeys, String denialReason) {
        this.gate = gate;
        this.heldKeys = new ArrayList<>(heldKeys);
        this.denialReason = denialReason;
    }

    public boolean granted() {
        return denialReason == null;
    }

    public String denialReason() {
        return denialReason;
    }

    public List<String> heldKeys() {
        return List.copyOf(heldKeys);
    }

    /**
     * Releases held leases in reverse acquisition order. Idempotent.
     */
    public void release() {
        if (released) {
            return;
        }
        released = true;
        for (int i = heldKeys.size() - 1; i >= 0; i--) {
            String key = heldKeys.get(i);
            try {
                gate.release(key);
            } catch (RuntimeException e) {
                log.warn("Failed to release gate lease {}", key, e);
            }
        }
    }

    @Override
    public void close() {
        release();
    }
}
