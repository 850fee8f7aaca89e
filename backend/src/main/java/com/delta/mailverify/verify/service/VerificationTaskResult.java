package com.delta.mailverify.verify.service;

/**
 * What the caller should do with the job after one verification attempt.
 */
public record VerificationTaskResult(Outcome outcome, String reason, Long resultId, String verifyStatus) {

    public enum Outcome {
        COMPLETED,
        RETRY,
        BAD_INPUT
    }

    public static VerificationTaskResult completed(long resultId, String verifyStatus, String reason) {
        return new VerificationTaskResult(Outcome.COMPLETED, reason, resultId, verifyStatus);
    }

    public static VerificationTaskResult retry(String reason) {
        return new VerificationTaskResult(Outcome.RETRY, reason, null, null);
    }

    public static VerificationTaskResult badInput(String reason) {
        return new VerificationTaskResult(Outcome.BAD_INPUT, reason, null, null);
    }

    public boolean isRetry() {
        return outcome == Outcome.RETRY;
    }
}
