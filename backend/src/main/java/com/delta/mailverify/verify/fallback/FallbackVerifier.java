package com.delta.mailverify.verify.fallback;

/**
 * Secondary verifier consulted once when SMTP evidence is inconclusive. Implementations never throw;
 * any failure is reported as {@link FallbackResult#unknown(String)}.
 */
public interface FallbackVerifier {

    FallbackResult verify(String email);
}
