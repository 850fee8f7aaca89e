package com.delta.mailverify.verify.service;

/**
 * Outbound delivery of a test-send. Implementations must put {@link TestSendMessage#returnPath()}
 * in the envelope sender so bounces carry the token back.
 */
public interface TestSendMailer {

    void send(TestSendMessage message);
}
