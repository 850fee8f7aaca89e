package com.delta.mailverify.pipeline.service;

import com.delta.mailverify.config.VerifierProperties;
import com.delta.mailverify.pipeline.model.CompanyRecord;
import com.delta.mailverify.pipeline.model.PipelineRun;
import com.delta.mailverify.pipeline.model.RunJobCounts;
import com.delta.mailverify.pipeline.model.RunStatus;
import com.delta.mailverify.pipeline.model.VerificationCounts;
import com.delta.mailverify.pipeline.persistence.JobQueueRepository;
import com.delta.mailverify.pipeline.persistence.JobQueueRepository.CompanyJobCounts;
import com.delta.mailverify.pipeline.persistence.JobQueueRepository.JobError;
import com.delta.mailverify.pipeline.persistence.PipelineRunRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

/**
 * Closes a run once its last job is terminal: metrics, optional cleanup, final status.
 */
@Service
public class RunCompletionService {
    private static final Logger log = LoggerFactory.getLogger(RunCompletionService.class);
    static final int MAX_ERRORS = 50;
    public static final String RUN_COMPLETED_ACTION = "run_completed";
    static final String PHASE_COMPLETED = "completed";

    private final PipelineRunRepository runRepository;
    private final JobQueueRepository queueRepository;
    private final VerifierProperties properties;

    public RunCompletionService(
        PipelineRunRepository runRepository,
        JobQueueRepository queueRepository,
        VerifierProperties properties
    ) {
        this.runRepository = runRepository;
        this.queueRepository = queueRepository;
        this.properties = properties;
    }

    public boolean completeIfFinished(long runId) {
        if (queueRepository.countOpenForRun(runId) > 0) {
            return false;
        }
        return complete(runId).isPresent();
    }

    /**
     * @return the terminal status, or empty when the run was missing or already closed
     */
    public Optional<String> complete(long runId) {
        Optional<PipelineRun> found = runRepository.findRun(runId);
        if (found.isEmpty() || RunStatus.isTerminal(found.get().status())) {
            return Optional.empty();
        }
        PipelineRun run = found.get();
        RunJobCounts jobCounts = queueRepository.countForRun(runId);
        List<JobError> errors = queueRepository.findErrors(runId, MAX_ERRORS);

        List<Map<String, Object>> companies = new ArrayList<>();
        long peopleTotal = 0;
        long emailsTotal = 0;
        long verified = 0;
        long valid = 0;
        long invalid = 0;
        long risky = 0;
        long timeout = 0;
        for (CompanyJobCounts counts : queueRepository.countByCompany(runId)) {
            long people = runRepository.countPeople(counts.companyId());
            long emails = runRepository.countEmails(counts.companyId());
            VerificationCounts verification = runRepository.countVerificationsForCompany(counts.companyId());
            peopleTotal += people;
            emailsTotal += emails;
            verified += verification.verified();
            valid += verification.valid();
            invalid += verification.invalid();
            risky += verification.riskyCatchAll();
            timeout += verification.unknownTimeout();

            Map<String, Object> company = new LinkedHashMap<>();
            company.put("company_id", counts.companyId());
            company.put("domain", runRepository.findCompany(counts.companyId()).map(CompanyRecord::domain).orElse(null));
            company.put("people", people);
            company.put("emails", emails);
            company.put("jobs_succeeded", counts.succeeded());
            company.put("jobs_failed", counts.failed());
            company.put("emails_valid", verification.valid());
            company.put("emails_invalid", verification.invalid());
            companies.add(company);
        }

        Map<String, Object> metrics = new LinkedHashMap<>();
        metrics.put("total_companies", run.domains().size());
        metrics.put("companies", companies);
        metrics.put("people", peopleTotal);
        metrics.put("emails", emailsTotal);
        metrics.put("jobs_succeeded", jobCounts.succeeded());
        metrics.put("jobs_failed", jobCounts.failed());
        metrics.put("emails_verified", verified);
        metrics.put("emails_valid", valid);
        metrics.put("emails_invalid", invalid);
        metrics.put("emails_risky_catch_all", risky);
        metrics.put("emails_unknown_timeout", timeout);
        metrics.put("errors", errors.stream().map(RunCompletionService::errorEntry).toList());
        metrics.put("error_types", errorHistogram(errors));

        Map<String, Object> progress = new LinkedHashMap<>(run.progress());
        progress.put("permutation_cleanup", cleanup(runId));
        progress.put("phase", PHASE_COMPLETED);
        progress.put("completed_at", Instant.now().toString());
        progress.put("metrics", metrics);

        String status = jobCounts.failed() > 0 ? RunStatus.COMPLETED_WITH_ERRORS : RunStatus.SUCCEEDED;
        if (!runRepository.finishRun(runId, status, null, progress)) {
            return Optional.empty();
        }
        Map<String, Object> activity = new LinkedHashMap<>();
        activity.put("status", status);
        activity.put("total_companies", run.domains().size());
        activity.put("emails_valid", valid);
        runRepository.insertActivity(run.tenantId(), RUN_COMPLETED_ACTION, runId, activity);
        log.info("Run {} finished with status {} ({} jobs failed)", runId, status, jobCounts.failed());
        return Optional.of(status);
    }

    private Map<String, Object> cleanup(long runId) {
        Map<String, Object> result = new LinkedHashMap<>();
        VerifierProperties.Cleanup cleanup = properties.getCleanup();
        if (!cleanup.isDeleteInvalidGenerated()) {
            result.put("skipped", true);
            result.put("reason", "cleanup_disabled");
            return result;
        }
        try {
            int deleted = runRepository.deleteGeneratedEmails(runId, cleanup.isDeleteUntestedGenerated());
            result.put("deleted", deleted);
            result.put("include_untested", cleanup.isDeleteUntestedGenerated());
        } catch (RuntimeException e) {
            log.warn("Cleanup of generated addresses failed for run {}", runId, e);
            result.put("skipped", true);
            result.put("reason", "cleanup_exception");
        }
        return result;
    }

    private static Map<String, Object> errorEntry(JobError error) {
        Map<String, Object> entry = new LinkedHashMap<>();
        entry.put("company_id", error.companyId());
        entry.put("job_type", error.jobType());
        entry.put("error", error.error());
        return entry;
    }

    static Map<String, Integer> errorHistogram(List<JobError> errors) {
        Map<String, Integer> histogram = new TreeMap<>();
        for (JobError error : errors) {
            histogram.merge(errorType(error.error()), 1, Integer::sum);
        }
        return histogram;
    }

    static String errorType(String error) {
        if (error == null || error.isBlank()) {
            return "unknown";
        }
        int colon = error.indexOf(':');
        return (colon > 0 ? error.substring(0, colon) : error).trim();
    }
}
