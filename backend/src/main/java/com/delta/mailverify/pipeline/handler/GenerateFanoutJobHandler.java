package com.delta.mailverify.pipeline.handler;

import com.delta.mailverify.pipeline.model.JobResult;
import com.delta.mailverify.pipeline.model.JobTypes;
import com.delta.mailverify.pipeline.model.PersonRecord;
import com.delta.mailverify.pipeline.model.PipelineJob;
import com.delta.mailverify.pipeline.persistence.PipelineRunRepository;
import com.delta.mailverify.pipeline.service.PipelineJobScheduler;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;

@Component
public class GenerateFanoutJobHandler implements JobHandler {
    private final PipelineRunRepository runRepository;
    private final PipelineJobScheduler scheduler;

    public GenerateFanoutJobHandler(PipelineRunRepository runRepository, PipelineJobScheduler scheduler) {
        this.runRepository = runRepository;
        this.scheduler = scheduler;
    }

    @Override
    public String jobType() {
        return JobTypes.GENERATE_FANOUT;
    }

    @Override
    public JobResult handle(PipelineJob job) {
        if (job.companyId() == null) {
            return JobResult.failure("missing_company_id");
        }
        List<PersonRecord> people = runRepository.findPeopleForCompany(job.companyId());
        for (PersonRecord person : people) {
            scheduler.enqueueGeneratePerson(job, person.id());
        }
        return JobResult.success(Map.of("generate_jobs", people.size()));
    }
}
