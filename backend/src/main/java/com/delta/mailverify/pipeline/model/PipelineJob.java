package com.delta.mailverify.pipeline.model;

import java.util.Map;

public record PipelineJob(
    long id,
    String queue,
    String jobType,
    Map<String, Object> payload,
    Long dependsOnJobId,
    String status,
    int attempts,
    int maxAttempts,
    String tenantId,
    Long runId,
    Long companyId
) {
    public boolean isLastAttempt() {
        return attempts >= maxAttempts;
    }

    public Long payloadLong(String key) {
        Object value = payload == null ? null : payload.get(key);
        if (value instanceof Number number) {
            return number.longValue();
        }
        if (value instanceof String text && !text.isBlank()) {
            return Long.parseLong(text.trim());
        }
        return null;
    }

    public String payloadString(String key) {
        Object value = payload == null ? null : payload.get(key);
        return value == null ? null : String.valueOf(value);
    }

    public boolean payloadFlag(String key) {
        Object value = payload == null ? null : payload.get(key);
        if (value instanceof Boolean flag) {
            return flag;
        }
        return value != null && Boolean.parseBoolean(String.valueOf(value));
    }
}
