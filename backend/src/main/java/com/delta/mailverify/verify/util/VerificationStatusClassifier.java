package com.delta.mailverify.verify.util;

import com.delta.mailverify.verify.fallback.FallbackResult;
import com.delta.mailverify.verify.model.DomainCatchAllStatus;
import com.delta.mailverify.verify.model.StatusDecision;
import com.delta.mailverify.verify.model.VerificationSignals;
import com.delta.mailverify.verify.model.VerifyStatus;
import com.delta.mailverify.verify.smtp.ProbeCategory;

import java.time.Duration;
import java.time.Instant;
import java.util.Locale;

/**
 * Maps raw probe, catch-all and fallback signals to a canonical verify status and reason.
 * Rules are checked in order: staleness, hard reject, accept, soft failure, fallback only.
 */
public final class VerificationStatusClassifier {
    public static final Duration RESULT_TTL = Duration.ofDays(90);

    private VerificationStatusClassifier() {}

    public static StatusDecision classify(VerificationSignals signals, Instant now) {
        if (signals.verifiedAt() != null && signals.verifiedAt().isBefore(now.minus(RESULT_TTL))) {
            return decision(VerifyStatus.UNKNOWN_TIMEOUT, VerificationReasonCodes.STALE_RESULT_TTL_EXCEEDED);
        }

        ProbeCategory category = signals.rcptCategory();
        Integer code = signals.rcptCode();
        String fallback = normalizeFallback(signals.fallbackStatus());
        boolean fallbackValid = FallbackResult.VALID.equals(fallback);
        boolean fallbackInvalid = FallbackResult.INVALID.equals(fallback);

        boolean hardFail = category == ProbeCategory.HARD_FAIL || inRange(code, 500);
        if (hardFail) {
            return fallbackValid
                ? decision(VerifyStatus.VALID, VerificationReasonCodes.FALLBACK_VALID_OVERRIDES_RCPT_5XX)
                : decision(VerifyStatus.INVALID, VerificationReasonCodes.RCPT_5XX_USER_UNKNOWN);
        }

        boolean accepted = category == ProbeCategory.ACCEPT || inRange(code, 200);
        if (accepted) {
            String catchAll = signals.catchAllStatus() == null
                ? null
                : signals.catchAllStatus().trim().toLowerCase(Locale.ROOT);
            if (DomainCatchAllStatus.NOT_CATCH_ALL.equals(catchAll)) {
                return decision(VerifyStatus.VALID, VerificationReasonCodes.RCPT_2XX_NON_CATCHALL);
            }
            if (DomainCatchAllStatus.CATCH_ALL.equals(catchAll)) {
                return fallbackInvalid
                    ? decision(VerifyStatus.INVALID, VerificationReasonCodes.RCPT_2XX_CATCHALL_FALLBACK_INVALID)
                    : decision(VerifyStatus.RISKY_CATCH_ALL, VerificationReasonCodes.RCPT_2XX_CATCHALL);
            }
            return fallbackValid
                ? decision(VerifyStatus.VALID, VerificationReasonCodes.RCPT_2XX_UNKNOWN_CATCHALL_FALLBACK_VALID)
                : decision(VerifyStatus.RISKY_CATCH_ALL, VerificationReasonCodes.RCPT_2XX_UNKNOWN_CATCHALL);
        }

        boolean softFail = category == ProbeCategory.TEMP_FAIL || inRange(code, 400);
        if (softFail) {
            if (fallbackValid) {
                return decision(VerifyStatus.VALID, VerificationReasonCodes.FALLBACK_VALID_AFTER_TEMPFAIL);
            }
            if (fallbackInvalid) {
                return decision(VerifyStatus.INVALID, VerificationReasonCodes.FALLBACK_INVALID_AFTER_TEMPFAIL);
            }
            return decision(VerifyStatus.UNKNOWN_TIMEOUT, VerificationReasonCodes.TEMPFAIL_OR_TIMEOUT);
        }

        // An UNKNOWN probe without a reply code carries no SMTP evidence either way.
        if (code == null && (category == null || category == ProbeCategory.UNKNOWN)) {
            if (fallbackValid) {
                return decision(VerifyStatus.VALID, VerificationReasonCodes.FALLBACK_VALID_NO_SMTP);
            }
            if (fallbackInvalid) {
                return decision(VerifyStatus.INVALID, VerificationReasonCodes.FALLBACK_INVALID_NO_SMTP);
            }
        }
        return decision(VerifyStatus.UNKNOWN_TIMEOUT, VerificationReasonCodes.NO_VERIFICATION_ATTEMPT);
    }

    static String normalizeFallback(String raw) {
        if (raw == null || raw.isBlank()) {
            return null;
        }
        return FallbackResult.mapProviderStatus(raw);
    }

    private static boolean inRange(Integer code, int floor) {
        return code != null && code >= floor && code < floor + 100;
    }

    private static StatusDecision decision(String status, String reason) {
        return new StatusDecision(status, reason);
    }
}
