package com.delta.mailverify.pipeline.service;

import com.delta.mailverify.verify.service.TestSendDispatcher;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

@Component
public class QueueTestSendDispatcher implements TestSendDispatcher {
    private static final Logger log = LoggerFactory.getLogger(QueueTestSendDispatcher.class);

    private final PipelineJobScheduler scheduler;

    public QueueTestSendDispatcher(PipelineJobScheduler scheduler) {
        this.scheduler = scheduler;
    }

    @Override
    public void dispatch(long resultId, String token) {
        long jobId = scheduler.enqueueTestSend(resultId, token);
        log.info("Test-send job {} enqueued for result {}", jobId, resultId);
    }
}
