package com.delta.mailverify.pipeline.model;

import java.time.Instant;
import java.util.List;
import java.util.Map;

public record PipelineRun(
    long id,
    String tenantId,
    String status,
    List<String> domains,
    Map<String, Object> options,
    Map<String, Object> progress,
    String error,
    Instant createdAt,
    Instant startedAt,
    Instant finishedAt
) {}
