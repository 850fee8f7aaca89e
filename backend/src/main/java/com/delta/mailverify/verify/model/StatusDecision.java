package com.delta.mailverify.verify.model;

public record StatusDecision(String verifyStatus, String verifyReason) {}
