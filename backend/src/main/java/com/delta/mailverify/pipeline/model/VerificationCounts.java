package com.delta.mailverify.pipeline.model;

public record VerificationCounts(long verified, long valid, long invalid, long riskyCatchAll, long unknownTimeout) {

    public static VerificationCounts empty() {
        return new VerificationCounts(0, 0, 0, 0, 0);
    }
}
