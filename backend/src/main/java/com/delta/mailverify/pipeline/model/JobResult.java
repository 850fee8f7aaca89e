package com.delta.mailverify.pipeline.model;

import java.util.Map;

/**
 * Handler verdict for one claimed job. Unexpected failures are thrown instead.
 */
public record JobResult(Kind kind, String reason, Map<String, Object> metrics) {

    public enum Kind {
        SUCCESS,
        RETRY,
        DEFER,
        FAILURE
    }

    public static JobResult success() {
        return new JobResult(Kind.SUCCESS, null, Map.of());
    }

    public static JobResult success(Map<String, Object> metrics) {
        return new JobResult(Kind.SUCCESS, null, metrics == null ? Map.of() : metrics);
    }

    public static JobResult retry(String reason) {
        return new JobResult(Kind.RETRY, reason, Map.of());
    }

    /**
     * Requeue without spending an attempt; used while waiting on sibling jobs.
     */
    public static JobResult defer(String reason) {
        return new JobResult(Kind.DEFER, reason, Map.of());
    }

    public static JobResult failure(String reason) {
        return new JobResult(Kind.FAILURE, reason, Map.of());
    }
}
