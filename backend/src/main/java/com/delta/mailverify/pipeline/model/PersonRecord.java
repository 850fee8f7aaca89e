package com.delta.mailverify.pipeline.model;

public record PersonRecord(long id, long companyId, String fullName, String firstName, String lastName) {}
