package com.delta.mailverify.pipeline.model;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * How the per-run cap and the rolling 24h tenant cap shaped a run's domain list.
 */
public record DomainLimitInfo(
    int originalCount,
    boolean companyLimitApplied,
    int usedLast24h,
    String usedMethod,
    int hardCap24h,
    int remaining24h,
    boolean hardLimitApplied,
    List<String> effectiveDomains
) {
    public int effectiveCount() {
        return effectiveDomains.size();
    }

    public Map<String, Object> toProgress() {
        Map<String, Object> info = new LinkedHashMap<>();
        info.put("original_count", originalCount);
        info.put("company_limit_applied", companyLimitApplied);
        info.put("used_24h", usedLast24h);
        info.put("used_24h_method", usedMethod);
        info.put("hard_limit_24h", hardCap24h);
        info.put("remaining_24h", remaining24h);
        info.put("hard_24h_applied", hardLimitApplied);
        info.put("effective_domain_count", effectiveCount());
        return info;
    }
}
