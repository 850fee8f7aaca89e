package com.delta.mailverify.verify.model;

import java.util.Set;

public final class VerifyStatus {
  public static final String PENDING = "pending";
  public static final String VALID = "valid";
  public static final String INVALID = "invalid";
  public static final String RISKY_CATCH_ALL = "risky_catch_all";
  public static final String UNKNOWN_TIMEOUT = "unknown_timeout";

  private static final Set<String> AMBIGUOUS = Set.of(RISKY_CATCH_ALL, UNKNOWN_TIMEOUT);

  private VerifyStatus() {}

  public static boolean isAmbiguous(String status) {
    return status != null && AMBIGUOUS.contains(status);
  }
}
