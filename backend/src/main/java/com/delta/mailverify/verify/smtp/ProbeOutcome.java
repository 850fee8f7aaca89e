package com.delta.mailverify.verify.smtp;

/**
 * Result of one RCPT probe. Callers branch on {@link #category()}; the probe never throws to
 * signal a protocol outcome.
 */
public record ProbeOutcome(
    ProbeCategory category,
    Integer code,
    String message,
    String mxHost,
    String heloDomain,
    long elapsedMs,
    String error
) {
    public static final String ERROR_TIMEOUT = "timeout";
    public static final String ERROR_DISCONNECTED = "disconnected";
    public static final String ERROR_SMTP = "smtp_error";
    public static final String ERROR_GENERIC = "error";
    public static final String ERROR_INVALID_EMAIL = "invalid_email";
    public static final String ERROR_PROBING_DISABLED = "smtp_probing_disabled";

    public static ProbeOutcome accepted(int code, String message, String mxHost, String heloDomain, long elapsedMs) {
        return new ProbeOutcome(ProbeCategory.ACCEPT, code, message, mxHost, heloDomain, elapsedMs, null);
    }

    public static ProbeOutcome permanentFailure(int code, String message, String mxHost, String heloDomain, long elapsedMs) {
        return new ProbeOutcome(ProbeCategory.HARD_FAIL, code, message, mxHost, heloDomain, elapsedMs, null);
    }

    public static ProbeOutcome temporaryFailure(
        Integer code,
        String message,
        String mxHost,
        String heloDomain,
        long elapsedMs,
        String error
    ) {
        return new ProbeOutcome(ProbeCategory.TEMP_FAIL, code, message, mxHost, heloDomain, elapsedMs, error);
    }

    public static ProbeOutcome unknown(
        Integer code,
        String message,
        String mxHost,
        String heloDomain,
        long elapsedMs,
        String error
    ) {
        return new ProbeOutcome(ProbeCategory.UNKNOWN, code, message, mxHost, heloDomain, elapsedMs, error);
    }

    public boolean ok() {
        return category == ProbeCategory.ACCEPT;
    }
}
