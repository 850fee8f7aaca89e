package com.delta.mailverify.pipeline.discovery;

import java.util.List;

/**
 * A person found on a company's pages, with any addresses published next to them.
 */
public record DiscoveredPerson(
    String fullName,
    String firstName,
    String lastName,
    String title,
    String sourceUrl,
    List<String> emails
) {
    public List<String> emailsOrEmpty() {
        return emails == null ? List.of() : emails;
    }
}
