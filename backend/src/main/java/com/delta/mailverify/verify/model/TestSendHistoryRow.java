package com.delta.mailverify.verify.model;

public record TestSendHistoryRow(String email, String testSendStatus, String bounceCode, String bounceReason) {}
