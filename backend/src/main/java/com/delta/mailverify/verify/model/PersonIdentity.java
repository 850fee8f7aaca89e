package com.delta.mailverify.verify.model;

public record PersonIdentity(long personId, String firstName, String lastName, String fullName, String domain) {}
