package com.delta.mailverify.verify.fallback;

public class NoopFallbackVerifier implements FallbackVerifier {
    public static final String DISABLED_REASON = "fallback_disabled_or_unconfigured";

    @Override
    public FallbackResult verify(String email) {
        return FallbackResult.unknown(DISABLED_REASON);
    }
}
