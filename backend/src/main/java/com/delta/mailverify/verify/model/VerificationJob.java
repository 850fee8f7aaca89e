package com.delta.mailverify.verify.model;

public record VerificationJob(Long emailId, String email, String domain, Long personId, boolean force) {}
