package com.delta.mailverify.pipeline.handler;

import com.delta.mailverify.pipeline.model.EmailRecord;
import com.delta.mailverify.pipeline.model.JobResult;
import com.delta.mailverify.pipeline.model.JobTypes;
import com.delta.mailverify.pipeline.model.PipelineJob;
import com.delta.mailverify.pipeline.persistence.JobQueueRepository;
import com.delta.mailverify.pipeline.persistence.PipelineRunRepository;
import com.delta.mailverify.pipeline.service.PipelineJobScheduler;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;

/**
 * Enqueues probes for a company's addresses that have no verification result. When the sweep
 * covers generated addresses it waits until the run's generate jobs for the company are done.
 */
@Component
public class VerifySweepJobHandler implements JobHandler {
    static final String WAITING_FOR_GENERATION = "waiting_for_generation";

    private final PipelineRunRepository runRepository;
    private final JobQueueRepository queueRepository;
    private final PipelineJobScheduler scheduler;

    public VerifySweepJobHandler(
        PipelineRunRepository runRepository,
        JobQueueRepository queueRepository,
        PipelineJobScheduler scheduler
    ) {
        this.runRepository = runRepository;
        this.queueRepository = queueRepository;
        this.scheduler = scheduler;
    }

    @Override
    public String jobType() {
        return JobTypes.VERIFY_SWEEP;
    }

    @Override
    public JobResult handle(PipelineJob job) {
        if (job.companyId() == null) {
            return JobResult.failure("missing_company_id");
        }
        boolean onlySourced = job.payloadFlag(PipelineJobScheduler.ONLY_SOURCED);
        if (!onlySourced && job.runId() != null
            && queueRepository.countOpen(job.runId(), job.companyId(), JobTypes.GENERATE_PERSON) > 0) {
            return JobResult.defer(WAITING_FOR_GENERATION);
        }
        boolean force = job.payloadFlag(PipelineJobScheduler.FORCE);
        List<EmailRecord> emails = runRepository.findUnverifiedEmails(job.companyId(), onlySourced);
        for (EmailRecord email : emails) {
            scheduler.enqueueProbe(job.tenantId(), job.runId(), job.companyId(), email, force);
        }
        return JobResult.success(Map.of("probes_enqueued", emails.size()));
    }
}
