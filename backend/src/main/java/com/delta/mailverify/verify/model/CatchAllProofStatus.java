package com.delta.mailverify.verify.model;

public final class CatchAllProofStatus {
  public static final String NOT_CATCHALL_PROVEN = "not_catchall_proven";
  public static final String UNKNOWN = "unknown";

  private CatchAllProofStatus() {}
}
