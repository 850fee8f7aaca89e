package com.delta.mailverify.verify.bounce;

public record BounceImportResult(
    String outcome,
    Long resultId,
    String token,
    boolean hard,
    Long escalatedResultId
) {
    public static final String IGNORED = "ignored";
    public static final String UNMATCHED = "unmatched";
    public static final String APPLIED = "applied";
    public static final String ALREADY_RESOLVED = "already_resolved";

    public static BounceImportResult ignored() {
        return new BounceImportResult(IGNORED, null, null, false, null);
    }

    public static BounceImportResult unmatched(BounceNotification notification) {
        return new BounceImportResult(UNMATCHED, null, notification.token(), notification.hard(), null);
    }
}
