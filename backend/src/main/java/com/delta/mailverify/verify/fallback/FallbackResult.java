package com.delta.mailverify.verify.fallback;

import java.util.Locale;
import java.util.Set;

public record FallbackResult(String status, String raw) {
    public static final String VALID = "valid";
    public static final String INVALID = "invalid";
    public static final String CATCH_ALL = "catch_all";
    public static final String UNKNOWN = "unknown";

    private static final Set<String> VALID_ALIASES = Set.of("valid", "deliverable", "ok", "success");
    private static final Set<String> INVALID_ALIASES = Set.of("invalid", "undeliverable", "bad", "hard_bounce");
    private static final Set<String> CATCH_ALL_ALIASES = Set.of("catch_all", "catchall");

    public static FallbackResult unknown(String raw) {
        return new FallbackResult(UNKNOWN, raw);
    }

    public static String mapProviderStatus(String providerStatus) {
        if (providerStatus == null) {
            return UNKNOWN;
        }
        String normalized = providerStatus.trim().toLowerCase(Locale.ROOT);
        if (VALID_ALIASES.contains(normalized)) {
            return VALID;
        }
        if (INVALID_ALIASES.contains(normalized)) {
            return INVALID;
        }
        if (CATCH_ALL_ALIASES.contains(normalized)) {
            return CATCH_ALL;
        }
        return UNKNOWN;
    }
}
