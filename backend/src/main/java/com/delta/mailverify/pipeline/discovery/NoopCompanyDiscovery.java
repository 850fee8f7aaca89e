package com.delta.mailverify.pipeline.discovery;

import com.delta.mailverify.pipeline.model.CompanyRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

public class NoopCompanyDiscovery implements CompanyDiscovery {
    private static final Logger log = LoggerFactory.getLogger(NoopCompanyDiscovery.class);

    @Override
    public List<DiscoveredPerson> discover(CompanyRecord company) {
        log.debug("No discovery collaborator configured; skipping {}", company.domain());
        return List.of();
    }
}
