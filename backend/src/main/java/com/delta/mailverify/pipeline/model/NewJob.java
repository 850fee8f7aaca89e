package com.delta.mailverify.pipeline.model;

import java.util.Map;

public record NewJob(
    String jobType,
    Map<String, Object> payload,
    Long dependsOnJobId,
    int maxAttempts,
    String tenantId,
    Long runId,
    Long companyId
) {
    public String queue() {
        return JobTypes.queueFor(jobType);
    }
}
