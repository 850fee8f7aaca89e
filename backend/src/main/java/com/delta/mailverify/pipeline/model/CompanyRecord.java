package com.delta.mailverify.pipeline.model;

public record CompanyRecord(long id, String tenantId, String name, String domain) {}
