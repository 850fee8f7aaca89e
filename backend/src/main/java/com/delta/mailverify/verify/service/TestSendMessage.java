package com.delta.mailverify.verify.service;

public record TestSendMessage(long resultId, String recipient, String returnPath, String token, String subject) {}
