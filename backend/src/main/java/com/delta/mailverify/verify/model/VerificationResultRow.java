package com.delta.mailverify.verify.model;

import java.time.Instant;

public record VerificationResultRow(
    long id,
    Long emailId,
    String email,
    String domain,
    String mxHost,
    String probeCategory,
    Integer probeCode,
    String verifyStatus,
    String verifyReason,
    String catchAllStatus,
    String fallbackStatus,
    String testSendStatus,
    String testSendToken,
    Instant testSendAt,
    String bounceCode,
    String bounceReason,
    Instant verifiedAt,
    Instant updatedAt
) {}
