package com.delta.mailverify.pipeline.service;

import com.delta.mailverify.config.VerifierProperties;
import com.delta.mailverify.pipeline.model.DomainLimitInfo;
import com.delta.mailverify.pipeline.model.JobTypes;
import com.delta.mailverify.pipeline.model.PipelineRun;
import com.delta.mailverify.pipeline.model.PipelineRunRequest;
import com.delta.mailverify.pipeline.model.RunStatus;
import com.delta.mailverify.pipeline.persistence.JobQueueRepository;
import com.delta.mailverify.pipeline.persistence.PipelineRunRepository;
import com.delta.mailverify.verify.smtp.EmailAddress;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ExecutorService;

/**
 * Turns a run request into per-domain job chains: discovery, then generation, then the
 * verify sweep. Quota checks happen before anything is enqueued.
 */
@Service
public class PipelineOrchestratorService {
    private static final Logger log = LoggerFactory.getLogger(PipelineOrchestratorService.class);
    static final String DEFAULT_TENANT = "default";
    static final String PHASE_STARTING = "starting";
    static final String PHASE_FANOUT = "fanout";
    static final String PHASE_FANOUT_COMPLETE = "fanout_complete";

    private final PipelineRunRepository runRepository;
    private final JobQueueRepository queueRepository;
    private final DomainLimitService domainLimitService;
    private final PipelineJobScheduler scheduler;
    private final RunCompletionService runCompletionService;
    private final ExecutorService pipelineRunExecutor;
    private final VerifierProperties properties;

    public PipelineOrchestratorService(
        PipelineRunRepository runRepository,
        JobQueueRepository queueRepository,
        DomainLimitService domainLimitService,
        PipelineJobScheduler scheduler,
        RunCompletionService runCompletionService,
        @Qualifier("pipelineRunExecutor") ExecutorService pipelineRunExecutor,
        VerifierProperties properties
    ) {
        this.runRepository = runRepository;
        this.queueRepository = queueRepository;
        this.domainLimitService = domainLimitService;
        this.scheduler = scheduler;
        this.runCompletionService = runCompletionService;
        this.pipelineRunExecutor = pipelineRunExecutor;
        this.properties = properties;
    }

    private record PreparedRun(
        long runId,
        String tenantId,
        List<String> modes,
        Map<String, Object> options,
        DomainLimitInfo limits,
        Instant startedAt,
        int maxProbesPerPerson,
        boolean force
    ) {}

    /**
     * Creates the run and enqueues every job before returning.
     */
    public PipelineRun startRun(PipelineRunRequest request) {
        PreparedRun prepared = prepare(request);
        fanOut(prepared);
        return runRepository.findRun(prepared.runId())
            .orElseThrow(() -> new IllegalStateException("Run " + prepared.runId() + " disappeared"));
    }

    /**
     * Creates the run and checks quotas synchronously, then enqueues jobs in the background.
     */
    public long submitRun(PipelineRunRequest request) {
        PreparedRun prepared = prepare(request);
        pipelineRunExecutor.submit(() -> {
            try {
                fanOut(prepared);
            } catch (Exception e) {
                log.warn("Background fan-out failed for run {}", prepared.runId(), e);
            }
        });
        return prepared.runId();
    }

    private PreparedRun prepare(PipelineRunRequest request) {
        if (request == null) {
            throw new InvalidPipelineRequestException("Request body is required");
        }
        String tenantId = request.tenantId() == null || request.tenantId().isBlank()
            ? DEFAULT_TENANT
            : request.tenantId().trim();
        List<String> domains = normalizeDomains(request.domains());
        if (domains.isEmpty()) {
            throw new InvalidPipelineRequestException("At least one valid domain is required");
        }
        List<String> modes = PipelineModes.normalize(request.modes());
        boolean autodiscovery = PipelineModes.includes(modes, PipelineModes.AUTODISCOVERY);
        boolean generate = PipelineModes.includes(modes, PipelineModes.GENERATE);
        boolean verify = PipelineModes.includes(modes, PipelineModes.VERIFY);
        if (!autodiscovery && !generate && !verify) {
            throw new InvalidPipelineRequestException("No runnable stage in modes: " + request.modes());
        }
        int maxProbes = request.maxProbesPerPerson() == null
            ? properties.getPipeline().getMaxProbesPerPerson()
            : Math.max(0, request.maxProbesPerPerson());
        boolean force = Boolean.TRUE.equals(request.force());

        Map<String, Object> options = new LinkedHashMap<>();
        options.put("modes", modes);
        options.put("company_limit", request.companyLimit());
        options.put("max_probes_per_person", maxProbes);
        options.put("force", force);

        long runId = runRepository.createRun(tenantId, domains, options);
        DomainLimitInfo limits;
        try {
            limits = domainLimitService.apply(tenantId, runId, domains, request.companyLimit());
        } catch (TenantQuotaExceededException e) {
            runRepository.finishRun(runId, RunStatus.FAILED, e.getMessage(), null);
            log.info("Run {} for tenant {} rejected: {}", runId, tenantId, e.getMessage());
            throw e;
        }
        Instant startedAt = Instant.now();
        runRepository.updateDomains(runId, limits.effectiveDomains());
        runRepository.markRunning(runId);

        Map<String, Object> activity = new LinkedHashMap<>();
        activity.put("domains_count", limits.effectiveCount());
        activity.put("effective_domain_count", limits.effectiveCount());
        activity.put("original_domain_count", limits.originalCount());
        activity.put("modes", modes);
        runRepository.insertActivity(tenantId, DomainLimitService.RUN_STARTED_ACTION, runId, activity);
        log.info("Run {} started for tenant {}: {} domains, modes={}", runId, tenantId, limits.effectiveCount(), modes);
        return new PreparedRun(runId, tenantId, modes, options, limits, startedAt, maxProbes, force);
    }

    private void fanOut(PreparedRun run) {
        try {
            List<Map<String, Object>> domainEntries = new ArrayList<>();
            Map<String, Object> metrics = initialMetrics(run);
            Map<String, Object> progress = initialProgress(run, domainEntries, metrics);
            runRepository.updateProgress(run.runId(), progress);
            boolean autodiscovery = PipelineModes.includes(run.modes(), PipelineModes.AUTODISCOVERY);
            boolean generate = PipelineModes.includes(run.modes(), PipelineModes.GENERATE);
            boolean verify = PipelineModes.includes(run.modes(), PipelineModes.VERIFY);
            boolean enqueueProbes = generate && verify && run.maxProbesPerPerson() > 0;

            progress.put("phase", PHASE_FANOUT);

            List<String> domains = run.limits().effectiveDomains();
            int flushEvery = properties.getPipeline().getProgressFlushEvery();
            for (int i = 0; i < domains.size(); i++) {
                String domain = domains.get(i);
                long companyId = runRepository.ensureCompany(run.tenantId(), domain, null);
                List<Map<String, Object>> jobs = new ArrayList<>();

                Long discoveryJobId = null;
                if (autodiscovery) {
                    discoveryJobId = scheduler.enqueueDiscovery(run.tenantId(), run.runId(), companyId);
                    jobs.add(jobEntry(JobTypes.DISCOVERY, discoveryJobId, null));
                    increment(metrics, "autodiscovery_jobs_enqueued");
                }
                Long generateJobId = null;
                if (generate) {
                    generateJobId = scheduler.enqueueGenerateFanout(
                        run.tenantId(),
                        run.runId(),
                        companyId,
                        discoveryJobId,
                        run.maxProbesPerPerson(),
                        enqueueProbes,
                        run.force()
                    );
                    jobs.add(jobEntry(JobTypes.GENERATE_FANOUT, generateJobId, discoveryJobId));
                    increment(metrics, "generate_jobs_enqueued");
                }
                if (verify) {
                    Long dependsOn = generateJobId != null ? generateJobId : discoveryJobId;
                    long sweepJobId = scheduler.enqueueVerifySweep(
                        run.tenantId(),
                        run.runId(),
                        companyId,
                        dependsOn,
                        enqueueProbes,
                        run.force()
                    );
                    jobs.add(jobEntry(JobTypes.VERIFY_SWEEP, sweepJobId, dependsOn));
                    increment(metrics, "verify_jobs_enqueued");
                }

                Map<String, Object> entry = new LinkedHashMap<>();
                entry.put("domain", domain);
                entry.put("company_id", companyId);
                entry.put("state", "enqueued");
                entry.put("jobs", jobs);
                domainEntries.add(entry);
                metrics.put("companies_enqueued", i + 1);

                boolean last = i == domains.size() - 1;
                if (last) {
                    progress.put("phase", PHASE_FANOUT_COMPLETE);
                }
                if (last || (i + 1) % flushEvery == 0) {
                    runRepository.updateProgress(run.runId(), progress);
                }
            }
        } catch (RuntimeException e) {
            log.warn("Run {} failed during fan-out", run.runId(), e);
            runRepository.finishRun(run.runId(), RunStatus.FAILED, e.getClass().getSimpleName() + ": " + e.getMessage(), null);
            throw e;
        }
        if (queueRepository.countOpenForRun(run.runId()) == 0) {
            runCompletionService.complete(run.runId());
        }
    }

    private static Map<String, Object> initialProgress(
        PreparedRun run,
        List<Map<String, Object>> domainEntries,
        Map<String, Object> metrics
    ) {
        Map<String, Object> progress = new LinkedHashMap<>();
        progress.put("phase", PHASE_STARTING);
        progress.put("started_at", run.startedAt().toString());
        progress.put("options", run.options());
        progress.put("limits", run.limits().toProgress());
        progress.put("modes", run.modes());
        progress.put("domains", domainEntries);
        progress.put("metrics", metrics);
        return progress;
    }

    private static Map<String, Object> initialMetrics(PreparedRun run) {
        Map<String, Object> metrics = new LinkedHashMap<>();
        metrics.put("total_companies", run.limits().effectiveCount());
        metrics.put("companies_enqueued", 0);
        metrics.put("autodiscovery_jobs_enqueued", 0);
        metrics.put("generate_jobs_enqueued", 0);
        metrics.put("verify_jobs_enqueued", 0);
        return metrics;
    }

    private static Map<String, Object> jobEntry(String stage, long jobId, Long dependsOn) {
        Map<String, Object> job = new LinkedHashMap<>();
        job.put("stage", stage);
        job.put("job_id", jobId);
        job.put("queue", JobTypes.queueFor(stage));
        job.put("depends_on", dependsOn);
        return job;
    }

    private static void increment(Map<String, Object> metrics, String key) {
        Object current = metrics.get(key);
        int value = current instanceof Number number ? number.intValue() : 0;
        metrics.put(key, value + 1);
    }

    /**
     * Lowercases, strips trailing dots and IDNA-encodes. Entries that are not plausible host
     * names are dropped; duplicates keep their first position.
     */
    static List<String> normalizeDomains(List<String> raw) {
        if (raw == null) {
            return List.of();
        }
        Set<String> out = new LinkedHashSet<>();
        for (String value : raw) {
            String domain = EmailAddress.normalizeDomain(value);
            if (domain == null || domain.isEmpty() || !domain.contains(".")) {
                continue;
            }
            if (domain.startsWith(".") || domain.contains("..") || !domain.matches("[a-z0-9.-]+")) {
                continue;
            }
            out.add(domain);
        }
        return new ArrayList<>(out);
    }
}
