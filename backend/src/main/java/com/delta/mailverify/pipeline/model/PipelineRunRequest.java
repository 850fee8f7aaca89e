package com.delta.mailverify.pipeline.model;

import java.util.List;

/**
 * Body of {@code POST /api/pipeline/runs}. {@code modes} is free text such as
 * {@code "generate+verify"}; null fields fall back to configured defaults.
 */
public record PipelineRunRequest(
    String tenantId,
    List<String> domains,
    String modes,
    Integer companyLimit,
    Integer maxProbesPerPerson,
    Boolean force
) {}
