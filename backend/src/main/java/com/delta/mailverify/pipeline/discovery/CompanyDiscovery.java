package com.delta.mailverify.pipeline.discovery;

import com.delta.mailverify.pipeline.model.CompanyRecord;

import java.util.List;

/**
 * Finds people for a company domain. Crawling and name extraction live outside this service.
 */
public interface CompanyDiscovery {

    List<DiscoveredPerson> discover(CompanyRecord company);
}
