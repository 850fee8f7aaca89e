package com.delta.mailverify.verify.model;

import java.time.Instant;

/**
 * Probe-derived columns written by the verification upsert. Test-send columns are owned by the
 * test-send lifecycle and are not part of this record.
 */
public record VerificationUpsert(
    Long emailId,
    String email,
    String domain,
    String mxHost,
    String probeCategory,
    Integer probeCode,
    String probeError,
    String verifyStatus,
    String verifyReason,
    String catchAllStatus,
    String fallbackStatus,
    String fallbackRaw,
    Instant verifiedAt
) {}
