package com.delta.mailverify.pipeline.handler;

import com.delta.mailverify.pipeline.discovery.CompanyDiscovery;
import com.delta.mailverify.pipeline.discovery.DiscoveredPerson;
import com.delta.mailverify.pipeline.model.CompanyRecord;
import com.delta.mailverify.pipeline.model.JobResult;
import com.delta.mailverify.pipeline.model.JobTypes;
import com.delta.mailverify.pipeline.model.PipelineJob;
import com.delta.mailverify.pipeline.persistence.PipelineRunRepository;
import com.delta.mailverify.verify.smtp.EmailAddress;
import com.delta.mailverify.verify.util.PatternCatalog;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

@Component
public class DiscoveryJobHandler implements JobHandler {
    private static final Logger log = LoggerFactory.getLogger(DiscoveryJobHandler.class);

    private final CompanyDiscovery companyDiscovery;
    private final PipelineRunRepository runRepository;

    public DiscoveryJobHandler(CompanyDiscovery companyDiscovery, PipelineRunRepository runRepository) {
        this.companyDiscovery = companyDiscovery;
        this.runRepository = runRepository;
    }

    @Override
    public String jobType() {
        return JobTypes.DISCOVERY;
    }

    @Override
    public JobResult handle(PipelineJob job) {
        if (job.companyId() == null) {
            return JobResult.failure("missing_company_id");
        }
        Optional<CompanyRecord> company = runRepository.findCompany(job.companyId());
        if (company.isEmpty()) {
            return JobResult.failure("company_not_found");
        }
        List<DiscoveredPerson> people = companyDiscovery.discover(company.get());
        int peopleSaved = 0;
        int emailsSaved = 0;
        for (DiscoveredPerson person : people) {
            if (person.fullName() == null || person.fullName().isBlank()) {
                continue;
            }
            long personId = runRepository.upsertPerson(
                company.get().id(),
                person.fullName().trim(),
                person.firstName(),
                person.lastName(),
                person.title(),
                person.sourceUrl()
            );
            peopleSaved++;
            for (String raw : person.emailsOrEmpty()) {
                Optional<EmailAddress> address = EmailAddress.parse(raw);
                if (address.isEmpty() || !address.get().domain().equals(company.get().domain())) {
                    continue;
                }
                String email = address.get().address().toLowerCase(Locale.ROOT);
                String pattern = PatternCatalog.infer(address.get().localPart(), person.firstName(), person.lastName())
                    .orElse(null);
                PipelineRunRepository.EmailInsert insert = runRepository.insertEmailIfAbsent(
                    personId,
                    company.get().id(),
                    job.runId(),
                    email,
                    address.get().domain(),
                    PipelineRunRepository.SOURCE_CRAWL,
                    person.sourceUrl(),
                    pattern
                );
                if (insert.created()) {
                    emailsSaved++;
                }
            }
        }
        log.info("Discovery for {} found {} people and {} new addresses", company.get().domain(), peopleSaved, emailsSaved);
        Map<String, Object> metrics = new LinkedHashMap<>();
        metrics.put("people", peopleSaved);
        metrics.put("emails", emailsSaved);
        return JobResult.success(metrics);
    }
}
