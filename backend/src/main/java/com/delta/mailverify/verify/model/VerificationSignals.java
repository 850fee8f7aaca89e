package com.delta.mailverify.verify.model;

import com.delta.mailverify.verify.smtp.ProbeCategory;

import java.time.Instant;

public record VerificationSignals(
    ProbeCategory rcptCategory,
    Integer rcptCode,
    String catchAllStatus,
    String fallbackStatus,
    String mxHost,
    Instant verifiedAt
) {}
