package com.delta.mailverify.verify.util;

public final class VerificationReasonCodes {
  public static final String STALE_RESULT_TTL_EXCEEDED = "stale_result_ttl_exceeded";
  public static final String RCPT_5XX_USER_UNKNOWN = "rcpt_5xx_user_unknown";
  public static final String FALLBACK_VALID_OVERRIDES_RCPT_5XX = "fallback_valid_overrides_rcpt_5xx";
  public static final String RCPT_2XX_NON_CATCHALL = "rcpt_2xx_non_catchall";
  public static final String RCPT_2XX_CATCHALL = "rcpt_2xx_catchall";
  public static final String RCPT_2XX_CATCHALL_FALLBACK_INVALID = "rcpt_2xx_catchall_fallback_invalid";
  public static final String RCPT_2XX_UNKNOWN_CATCHALL = "rcpt_2xx_unknown_catchall";
  public static final String RCPT_2XX_UNKNOWN_CATCHALL_FALLBACK_VALID = "rcpt_2xx_unknown_catchall_fallback_valid";
  public static final String FALLBACK_VALID_AFTER_TEMPFAIL = "fallback_valid_after_tempfail";
  public static final String FALLBACK_INVALID_AFTER_TEMPFAIL = "fallback_invalid_after_tempfail";
  public static final String TEMPFAIL_OR_TIMEOUT = "tempfail_or_timeout";
  public static final String FALLBACK_VALID_NO_SMTP = "fallback_valid_no_smtp";
  public static final String FALLBACK_INVALID_NO_SMTP = "fallback_invalid_no_smtp";
  public static final String NO_VERIFICATION_ATTEMPT = "no_verification_attempt";
  public static final String TCP25_BLOCKED = "tcp25_blocked";
  public static final String NO_BOUNCE_AFTER_TEST_SEND = "no_bounce_after_test_send";
  public static final String HARD_BOUNCE_USER_UNKNOWN = "hard_bounce_user_unknown";

  public static final String GLOBAL_CONCURRENCY_CAP = "global concurrency cap reached";
  public static final String MX_CONCURRENCY_CAP = "per-MX concurrency cap reached";
  public static final String GLOBAL_RPS_THROTTLE = "global RPS throttle";
  public static final String MX_RPS_THROTTLE = "MX RPS throttle";

  public static final String BAD_INPUT = "bad_input";

  private VerificationReasonCodes() {}
}
