package com.delta.mailverify.verify.smtp;

import java.net.IDN;
import java.util.Locale;
import java.util.Optional;

/**
 * Address split at the last {@code @}. The local-part keeps its case; the domain is lowercased
 * and IDNA-encoded.
 */
public record EmailAddress(String localPart, String domain) {

    public static Optional<EmailAddress> parse(String raw) {
        if (raw == null) {
            return Optional.empty();
        }
        String trimmed = raw.trim();
        int at = trimmed.lastIndexOf('@');
        if (at <= 0 || at == trimmed.length() - 1) {
            return Optional.empty();
        }
        String local = trimmed.substring(0, at);
        String domain = trimmed.substring(at + 1).trim().toLowerCase(Locale.ROOT);
        if (local.isBlank() || local.chars().anyMatch(Character::isWhitespace) || domain.contains("@")) {
            return Optional.empty();
        }
        try {
            domain = IDN.toASCII(domain, IDN.ALLOW_UNASSIGNED);
        } catch (IllegalArgumentException e) {
            return Optional.empty();
        }
        if (domain.isEmpty() || !domain.contains(".")) {
            return Optional.empty();
        }
        return Optional.of(new EmailAddress(local, domain));
    }

    public static String normalizeDomain(String raw) {
        if (raw == null || raw.isBlank()) {
            return null;
        }
        String trimmed = raw.trim().toLowerCase(Locale.ROOT);
        if (trimmed.endsWith(".")) {
            trimmed = trimmed.substring(0, trimmed.length() - 1);
        }
        try {
            return IDN.toASCII(trimmed, IDN.ALLOW_UNASSIGNED);
        } catch (IllegalArgumentException e) {
            return null;
        }
    }

    public String address() {
        return localPart + "@" + domain;
    }
}
