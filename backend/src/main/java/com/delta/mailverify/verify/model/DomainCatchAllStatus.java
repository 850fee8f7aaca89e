package com.delta.mailverify.verify.model;

/**
 * Outcome of probing a random local-part at a domain's MX.
 */
public final class DomainCatchAllStatus {
  public static final String CATCH_ALL = "catch_all";
  public static final String NOT_CATCH_ALL = "not_catch_all";
  public static final String TEMPFAIL = "tempfail";
  public static final String NO_MX = "no_mx";
  public static final String ERROR = "error";

  private DomainCatchAllStatus() {}

  public static boolean isConclusive(String status) {
    return CATCH_ALL.equals(status) || NOT_CATCH_ALL.equals(status);
  }
}
