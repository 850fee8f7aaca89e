package com.delta.mailverify.pipeline.model;

public record EmailRecord(long id, Long personId, Long companyId, String email, String domain, String source) {}
