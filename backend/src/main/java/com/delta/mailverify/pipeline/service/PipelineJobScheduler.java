package com.delta.mailverify.pipeline.service;

import com.delta.mailverify.config.VerifierProperties;
import com.delta.mailverify.pipeline.model.EmailRecord;
import com.delta.mailverify.pipeline.model.JobTypes;
import com.delta.mailverify.pipeline.model.NewJob;
import com.delta.mailverify.pipeline.model.PipelineJob;
import com.delta.mailverify.pipeline.persistence.JobQueueRepository;
import org.springframework.stereotype.Service;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Builds job payloads and enqueues them. Probe jobs use the verification retry budget,
 * everything else the pipeline job budget.
 */
@Service
public class PipelineJobScheduler {
    public static final String COMPANY_ID = "company_id";
    public static final String PERSON_ID = "person_id";
    public static final String EMAIL_ID = "email_id";
    public static final String EMAIL = "email";
    public static final String DOMAIN = "domain";
    public static final String MAX_PROBES_PER_PERSON = "max_probes_per_person";
    public static final String ENQUEUE_PROBES = "enqueue_probes";
    public static final String ONLY_SOURCED = "only_sourced";
    public static final String FORCE = "force";
    public static final String RESULT_ID = "result_id";
    public static final String TOKEN = "token";

    private final JobQueueRepository queueRepository;
    private final VerifierProperties properties;

    public PipelineJobScheduler(JobQueueRepository queueRepository, VerifierProperties properties) {
        this.queueRepository = queueRepository;
        this.properties = properties;
    }

    public long enqueueDiscovery(String tenantId, long runId, long companyId) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put(COMPANY_ID, companyId);
        return queueRepository.enqueue(pipelineJob(JobTypes.DISCOVERY, payload, null, tenantId, runId, companyId));
    }

    public long enqueueGenerateFanout(
        String tenantId,
        long runId,
        long companyId,
        Long dependsOn,
        int maxProbesPerPerson,
        boolean enqueueProbes,
        boolean force
    ) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put(COMPANY_ID, companyId);
        payload.put(MAX_PROBES_PER_PERSON, maxProbesPerPerson);
        payload.put(ENQUEUE_PROBES, enqueueProbes);
        payload.put(FORCE, force);
        return queueRepository.enqueue(pipelineJob(JobTypes.GENERATE_FANOUT, payload, dependsOn, tenantId, runId, companyId));
    }

    public long enqueueVerifySweep(
        String tenantId,
        long runId,
        long companyId,
        Long dependsOn,
        boolean onlySourced,
        boolean force
    ) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put(COMPANY_ID, companyId);
        payload.put(ONLY_SOURCED, onlySourced);
        payload.put(FORCE, force);
        return queueRepository.enqueue(pipelineJob(JobTypes.VERIFY_SWEEP, payload, dependsOn, tenantId, runId, companyId));
    }

    /**
     * One generate job per person, inheriting the fanout's probe settings.
     */
    public long enqueueGeneratePerson(PipelineJob fanout, long personId) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put(COMPANY_ID, fanout.companyId());
        payload.put(PERSON_ID, personId);
        Long maxProbes = fanout.payloadLong(MAX_PROBES_PER_PERSON);
        payload.put(MAX_PROBES_PER_PERSON, maxProbes == null ? properties.getPipeline().getMaxProbesPerPerson() : maxProbes);
        payload.put(ENQUEUE_PROBES, fanout.payloadFlag(ENQUEUE_PROBES));
        payload.put(FORCE, fanout.payloadFlag(FORCE));
        return queueRepository.enqueue(pipelineJob(
            JobTypes.GENERATE_PERSON,
            payload,
            null,
            fanout.tenantId(),
            fanout.runId(),
            fanout.companyId()
        ));
    }

    public long enqueueProbe(String tenantId, Long runId, Long companyId, EmailRecord email, boolean force) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put(EMAIL_ID, email.id());
        payload.put(EMAIL, email.email());
        payload.put(DOMAIN, email.domain());
        payload.put(PERSON_ID, email.personId());
        payload.put(FORCE, force);
        return queueRepository.enqueue(new NewJob(
            JobTypes.PROBE,
            payload,
            null,
            properties.getRetry().getMaxAttempts(),
            tenantId,
            runId,
            companyId
        ));
    }

    /**
     * Test-send jobs belong to no run, so a late escalation never holds a run open.
     */
    public long enqueueTestSend(long resultId, String token) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put(RESULT_ID, resultId);
        payload.put(TOKEN, token);
        return queueRepository.enqueue(new NewJob(
            JobTypes.TEST_SEND,
            payload,
            null,
            properties.getPipeline().getJobMaxAttempts(),
            null,
            null,
            null
        ));
    }

    private NewJob pipelineJob(
        String jobType,
        Map<String, Object> payload,
        Long dependsOn,
        String tenantId,
        Long runId,
        Long companyId
    ) {
        return new NewJob(
            jobType,
            payload,
            dependsOn,
            properties.getPipeline().getJobMaxAttempts(),
            tenantId,
            runId,
            companyId
        );
    }
}
