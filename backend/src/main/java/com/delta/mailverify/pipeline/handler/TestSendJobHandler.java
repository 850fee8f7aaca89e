package com.delta.mailverify.pipeline.handler;

import com.delta.mailverify.pipeline.model.JobResult;
import com.delta.mailverify.pipeline.model.JobTypes;
import com.delta.mailverify.pipeline.model.PipelineJob;
import com.delta.mailverify.pipeline.service.PipelineJobScheduler;
import com.delta.mailverify.verify.model.TestSendStatus;
import com.delta.mailverify.verify.model.VerificationResultRow;
import com.delta.mailverify.verify.persistence.VerificationResultRepository;
import com.delta.mailverify.verify.service.TestSendMailer;
import com.delta.mailverify.verify.service.TestSendService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.Map;
import java.util.Optional;

/**
 * Delivers a pending test-send and marks it sent. Rows that moved on are left alone.
 */
@Component
public class TestSendJobHandler implements JobHandler {
    private static final Logger log = LoggerFactory.getLogger(TestSendJobHandler.class);

    private final VerificationResultRepository resultRepository;
    private final TestSendService testSendService;
    private final TestSendMailer mailer;

    public TestSendJobHandler(
        VerificationResultRepository resultRepository,
        TestSendService testSendService,
        TestSendMailer mailer
    ) {
        this.resultRepository = resultRepository;
        this.testSendService = testSendService;
        this.mailer = mailer;
    }

    @Override
    public String jobType() {
        return JobTypes.TEST_SEND;
    }

    @Override
    public JobResult handle(PipelineJob job) {
        Long resultId = job.payloadLong(PipelineJobScheduler.RESULT_ID);
        if (resultId == null) {
            return JobResult.failure("missing_result_id");
        }
        Optional<VerificationResultRow> row = resultRepository.findById(resultId);
        if (row.isEmpty()) {
            return JobResult.failure("result_not_found");
        }
        if (!TestSendStatus.PENDING.equals(row.get().testSendStatus())) {
            log.debug("Test-send for result {} already {}", resultId, row.get().testSendStatus());
            return JobResult.success(Map.of("skipped", String.valueOf(row.get().testSendStatus())));
        }
        String token = job.payloadString(PipelineJobScheduler.TOKEN);
        if (token != null && !token.equals(row.get().testSendToken())) {
            return JobResult.success(Map.of("skipped", "token_mismatch"));
        }
        mailer.send(testSendService.messageFor(row.get()));
        testSendService.markSent(resultId, Instant.now());
        log.info("Test-send delivered for result {}", resultId);
        return JobResult.success(Map.of("sent", true));
    }
}
