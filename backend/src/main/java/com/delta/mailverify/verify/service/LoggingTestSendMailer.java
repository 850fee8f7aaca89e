package com.delta.mailverify.verify.service;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class LoggingTestSendMailer implements TestSendMailer {
    private static final Logger log = LoggerFactory.getLogger(LoggingTestSendMailer.class);

    @Override
    public void send(TestSendMessage message) {
        log.info(
            "Test-send to {} (result {}) with return path {} not delivered: no mailer configured",
            message.recipient(),
            message.resultId(),
            message.returnPath()
        );
    }
}
