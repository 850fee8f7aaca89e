package com.delta.mailverify.verify.gate;

import com.delta.mailverify.config.VerifierProperties;
import com.delta.mailverify.verify.util.VerificationReasonCodes;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Applies the probe gates in their fixed order: global lease, MX lease, global RPS, MX RPS.
 */
@Component
public class ProbeThrottle {
    public static final String GLOBAL_SEMAPHORE = "sem:global";
    public static final String GLOBAL_RPS = "rps:global";

    private final ConcurrencyGate gate;
    private final VerifierProperties properties;

    public ProbeThrottle(ConcurrencyGate gate, VerifierProperties properties) {
        this.gate = gate;
        this.properties = properties;
    }

    public static String mxSemaphore(String mxHost) {
        return "sem:mx:" + normalizeMx(mxHost);
    }

    public static String mxRps(String mxHost) {
        return "rps:mx:" + normalizeMx(mxHost);
    }

    /**
     * Always close the returned permit, even when it was denied: a denial after the first lease
     * still holds that lease. A per-MX RPS denial hands the global RPS hit back.
     */
    public ThrottlePermit acquire(String mxHost) {
        List<String> held = new ArrayList<>(2);
        if (!gate.acquire(GLOBAL_SEMAPHORE, properties.getGate().getGlobalConcurrency())) {
            return new ThrottlePermit(gate, held, VerificationReasonCodes.GLOBAL_CONCURRENCY_CAP);
        }
        held.add(GLOBAL_SEMAPHORE);

        String mxKey = mxSemaphore(mxHost);
        if (!gate.acquire(mxKey, properties.getGate().getPerMxConcurrency())) {
            return new ThrottlePermit(gate, held, VerificationReasonCodes.MX_CONCURRENCY_CAP);
        }
        held.add(mxKey);

        if (!gate.consumeRps(GLOBAL_RPS, properties.getRps().getGlobal())) {
            return new ThrottlePermit(gate, held, VerificationReasonCodes.GLOBAL_RPS_THROTTLE);
        }
        if (!gate.consumeRps(mxRps(mxHost), properties.getRps().getPerMx())) {
            gate.refundRps(GLOBAL_RPS);
            return new ThrottlePermit(gate, held, VerificationReasonCodes.MX_RPS_THROTTLE);
        }
        return new ThrottlePermit(gate, held, null);
    }

    private static String normalizeMx(String mxHost) {
        return mxHost == null ? "" : mxHost.trim().toLowerCase(Locale.ROOT);
    }
}
