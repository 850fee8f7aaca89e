package com.delta.mailverify.pipeline.handler;

import com.delta.mailverify.pipeline.model.CompanyRecord;
import com.delta.mailverify.pipeline.model.EmailRecord;
import com.delta.mailverify.pipeline.model.JobResult;
import com.delta.mailverify.pipeline.model.JobTypes;
import com.delta.mailverify.pipeline.model.PersonRecord;
import com.delta.mailverify.pipeline.model.PipelineJob;
import com.delta.mailverify.pipeline.persistence.PipelineRunRepository;
import com.delta.mailverify.pipeline.service.PipelineJobScheduler;
import com.delta.mailverify.verify.util.PatternCatalog;
import com.delta.mailverify.verify.util.PatternCatalog.Candidate;
import com.delta.mailverify.verify.util.PatternCatalog.DomainPatternInference;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Generates pattern candidates for one person and enqueues probes for the first few new ones.
 */
@Component
public class GeneratePersonJobHandler implements JobHandler {
    private static final Logger log = LoggerFactory.getLogger(GeneratePersonJobHandler.class);
    private static final int NAME_EXAMPLE_LIMIT = 200;

    private final PipelineRunRepository runRepository;
    private final PipelineJobScheduler scheduler;

    public GeneratePersonJobHandler(PipelineRunRepository runRepository, PipelineJobScheduler scheduler) {
        this.runRepository = runRepository;
        this.scheduler = scheduler;
    }

    @Override
    public String jobType() {
        return JobTypes.GENERATE_PERSON;
    }

    @Override
    public JobResult handle(PipelineJob job) {
        Long personId = job.payloadLong(PipelineJobScheduler.PERSON_ID);
        if (personId == null || job.companyId() == null) {
            return JobResult.failure("missing_person_id");
        }
        Optional<PersonRecord> person = runRepository.findPerson(personId);
        Optional<CompanyRecord> company = runRepository.findCompany(job.companyId());
        if (person.isEmpty() || company.isEmpty()) {
            return JobResult.failure("person_not_found");
        }
        String domain = company.get().domain();
        String[] names = nameParts(person.get());

        DomainPatternInference inference = PatternCatalog.inferDomainPattern(
            runRepository.findNameExamples(domain, NAME_EXAMPLE_LIMIT)
        );
        List<Candidate> candidates = PatternCatalog.generate(names[0], names[1], inference.pattern());

        Long maxProbesValue = job.payloadLong(PipelineJobScheduler.MAX_PROBES_PER_PERSON);
        int maxProbes = maxProbesValue == null ? 0 : maxProbesValue.intValue();
        boolean enqueueProbes = job.payloadFlag(PipelineJobScheduler.ENQUEUE_PROBES) && maxProbes > 0;
        boolean force = job.payloadFlag(PipelineJobScheduler.FORCE);

        int created = 0;
        int probes = 0;
        for (Candidate candidate : candidates) {
            String email = candidate.localPart() + "@" + domain;
            PipelineRunRepository.EmailInsert insert = runRepository.insertEmailIfAbsent(
                personId,
                job.companyId(),
                job.runId(),
                email,
                domain,
                PipelineRunRepository.SOURCE_GENERATED,
                null,
                candidate.pattern()
            );
            if (!insert.created()) {
                continue;
            }
            created++;
            if (enqueueProbes && probes < maxProbes) {
                EmailRecord record = new EmailRecord(
                    insert.id(),
                    personId,
                    job.companyId(),
                    email,
                    domain,
                    PipelineRunRepository.SOURCE_GENERATED
                );
                scheduler.enqueueProbe(job.tenantId(), job.runId(), job.companyId(), record, force);
                probes++;
            }
        }
        log.debug(
            "Generated {} candidates for person {} at {} (pattern={}, probes={})",
            created,
            personId,
            domain,
            inference.pattern(),
            probes
        );
        Map<String, Object> metrics = new LinkedHashMap<>();
        metrics.put("generated", created);
        metrics.put("probes_enqueued", probes);
        return JobResult.success(metrics);
    }

    static String[] nameParts(PersonRecord person) {
        String first = person.firstName();
        String last = person.lastName();
        if ((first == null || first.isBlank() || last == null || last.isBlank()) && person.fullName() != null) {
            String[] tokens = person.fullName().trim().split("\\s+");
            if (first == null || first.isBlank()) {
                first = tokens[0];
            }
            if ((last == null || last.isBlank()) && tokens.length > 1) {
                last = tokens[tokens.length - 1];
            }
        }
        return new String[]{first, last};
    }
}
