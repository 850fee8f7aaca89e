package com.delta.mailverify.pipeline.service;

import com.delta.mailverify.config.VerifierProperties;
import com.delta.mailverify.pipeline.model.DomainLimitInfo;
import com.delta.mailverify.pipeline.persistence.PipelineRunRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Applies the per-run company cap and the rolling 24h tenant cap before any job is enqueued.
 */
@Service
public class DomainLimitService {
    private static final Logger log = LoggerFactory.getLogger(DomainLimitService.class);
    public static final String RUN_STARTED_ACTION = "run_started";
    static final Duration WINDOW = Duration.ofHours(24);

    private final PipelineRunRepository runRepository;
    private final VerifierProperties properties;

    public DomainLimitService(PipelineRunRepository runRepository, VerifierProperties properties) {
        this.runRepository = runRepository;
        this.properties = properties;
    }

    public DomainLimitInfo apply(String tenantId, Long runId, List<String> domains, Integer companyLimit) {
        int originalCount = domains.size();
        int runCap = companyLimit == null || companyLimit <= 0
            ? properties.getPipeline().getDefaultCompanyLimit()
            : companyLimit;
        List<String> effective = domains;
        boolean companyLimitApplied = false;
        if (effective.size() > runCap) {
            log.info("Applying per-run company limit for run {}: {} -> {}", runId, originalCount, runCap);
            effective = effective.subList(0, runCap);
            companyLimitApplied = true;
        }

        Instant since = Instant.now().minus(WINDOW);
        String method = "user_activity";
        List<Map<String, Object>> activity =
            runRepository.findActivityMetadata(tenantId, RUN_STARTED_ACTION, since, runId);
        int used;
        if (!activity.isEmpty()) {
            used = activity.stream().mapToInt(DomainLimitService::domainCountOf).sum();
        } else {
            method = "runs";
            used = runRepository.findRecentRunDomains(tenantId, since, runId).stream()
                .mapToInt(List::size)
                .sum();
        }

        int hardCap = properties.getPipeline().getHardCompanyLimit24h();
        int remaining = Math.max(0, hardCap - used);
        if (remaining <= 0) {
            throw new TenantQuotaExceededException(
                "24h company limit exceeded: limit=" + hardCap + " (used=" + used + ", method=" + method + ")"
            );
        }
        boolean hardLimitApplied = false;
        if (effective.size() > remaining) {
            log.info("Applying 24h company limit for run {}: {} -> {} (used={})", runId, effective.size(), remaining, used);
            effective = effective.subList(0, remaining);
            hardLimitApplied = true;
        }
        return new DomainLimitInfo(
            originalCount,
            companyLimitApplied,
            used,
            method,
            hardCap,
            remaining,
            hardLimitApplied,
            List.copyOf(effective)
        );
    }

    static int domainCountOf(Map<String, Object> metadata) {
        Object value = metadata.get("domains_count");
        if (value == null) {
            value = metadata.get("effective_domain_count");
        }
        if (value instanceof Number number) {
            return number.intValue();
        }
        if (value != null) {
            try {
                return Integer.parseInt(String.valueOf(value).trim());
            } catch (NumberFormatException e) {
                log.debug("Ignoring non-numeric domain count {}", value);
            }
        }
        return 0;
    }
}
