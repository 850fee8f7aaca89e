package com.delta.mailverify.verify.model;

import java.time.Instant;
import java.util.Map;

public record DeadLetterRecord(
    Long id,
    Long jobId,
    String queue,
    int attempts,
    String email,
    String mxHost,
    String errorType,
    String errorMessage,
    String stackTrace,
    Map<String, Object> meta,
    Instant createdAt
) {}
