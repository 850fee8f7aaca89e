package com.delta.mailverify.verify.smtp;

import java.util.Locale;

public enum ProbeCategory {
    ACCEPT("accept"),
    HARD_FAIL("hard_fail"),
    TEMP_FAIL("temp_fail"),
    UNKNOWN("unknown");

    private final String value;

    ProbeCategory(String value) {
        this.value = value;
    }

    public String value() {
        return value;
    }

    public static ProbeCategory fromValue(String raw) {
        if (raw == null || raw.isBlank()) {
            return null;
        }
        String normalized = raw.trim().toLowerCase(Locale.ROOT);
        for (ProbeCategory category : values()) {
            if (category.value.equals(normalized)) {
                return category;
            }
        }
        return null;
    }

    public static ProbeCategory fromReplyCode(int code) {
        if (code >= 200 && code < 300) {
            return ACCEPT;
        }
        if (code >= 500 && code < 600) {
            return HARD_FAIL;
        }
        if (code >= 400 && code < 500) {
            return TEMP_FAIL;
        }
        return UNKNOWN;
    }
}
