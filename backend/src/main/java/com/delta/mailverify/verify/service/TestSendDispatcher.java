package com.delta.mailverify.verify.service;

/**
 * Hands a requested test-send to whatever delivers it asynchronously.
 */
public interface TestSendDispatcher {

    void dispatch(long resultId, String token);
}
