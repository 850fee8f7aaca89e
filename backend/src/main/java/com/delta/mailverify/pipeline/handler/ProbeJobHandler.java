package com.delta.mailverify.pipeline.handler;

import com.delta.mailverify.pipeline.model.JobResult;
import com.delta.mailverify.pipeline.model.JobTypes;
import com.delta.mailverify.pipeline.model.PipelineJob;
import com.delta.mailverify.pipeline.service.PipelineJobScheduler;
import com.delta.mailverify.verify.model.DeadLetterRecord;
import com.delta.mailverify.verify.model.VerificationJob;
import com.delta.mailverify.verify.persistence.DeadLetterRepository;
import com.delta.mailverify.verify.service.VerificationTask;
import com.delta.mailverify.verify.service.VerificationTaskResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

@Component
public class ProbeJobHandler implements JobHandler {
    private static final Logger log = LoggerFactory.getLogger(ProbeJobHandler.class);
    static final String RETRIES_EXHAUSTED = "retries_exhausted";

    private final VerificationTask verificationTask;
    private final DeadLetterRepository deadLetterRepository;

    public ProbeJobHandler(VerificationTask verificationTask, DeadLetterRepository deadLetterRepository) {
        this.verificationTask = verificationTask;
        this.deadLetterRepository = deadLetterRepository;
    }

    @Override
    public String jobType() {
        return JobTypes.PROBE;
    }

    @Override
    public JobResult handle(PipelineJob job) {
        VerificationJob verificationJob = new VerificationJob(
            job.payloadLong(PipelineJobScheduler.EMAIL_ID),
            job.payloadString(PipelineJobScheduler.EMAIL),
            job.payloadString(PipelineJobScheduler.DOMAIN),
            job.payloadLong(PipelineJobScheduler.PERSON_ID),
            job.payloadFlag(PipelineJobScheduler.FORCE)
        );
        VerificationTaskResult result = verificationTask.execute(
            verificationJob,
            job.id(),
            job.queue(),
            job.attempts(),
            job.maxAttempts()
        );
        if (result.outcome() == VerificationTaskResult.Outcome.COMPLETED) {
            Map<String, Object> metrics = new LinkedHashMap<>();
            metrics.put("result_id", result.resultId());
            metrics.put("verify_status", result.verifyStatus());
            return JobResult.success(metrics);
        }
        if (result.outcome() == VerificationTaskResult.Outcome.BAD_INPUT) {
            return JobResult.failure(result.reason());
        }
        if (!job.isLastAttempt()) {
            return JobResult.retry(result.reason());
        }
        recordExhausted(job, verificationJob, result.reason());
        return JobResult.failure(RETRIES_EXHAUSTED + ": " + result.reason());
    }

    private void recordExhausted(PipelineJob job, VerificationJob verificationJob, String reason) {
        Map<String, Object> meta = new LinkedHashMap<>();
        meta.put("email_id", verificationJob.emailId());
        meta.put("domain", verificationJob.domain());
        meta.put("person_id", verificationJob.personId());
        meta.put("last_reason", reason);
        try {
            deadLetterRepository.insert(new DeadLetterRecord(
                null,
                job.id(),
                job.queue(),
                job.attempts(),
                verificationJob.email(),
                null,
                RETRIES_EXHAUSTED,
                reason,
                null,
                meta,
                Instant.now()
            ));
        } catch (RuntimeException e) {
            log.warn("Failed to record dead letter for probe job {}", job.id(), e);
        }
    }
}
