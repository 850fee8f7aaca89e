package com.delta.mailverify.pipeline.model;

public final class RunStatus {
  public static final String QUEUED = "queued";
  public static final String RUNNING = "running";
  public static final String SUCCEEDED = "succeeded";
  public static final String COMPLETED_WITH_ERRORS = "completed_with_errors";
  public static final String FAILED = "failed";

  private RunStatus() {}

  public static boolean isTerminal(String status) {
    return SUCCEEDED.equals(status) || COMPLETED_WITH_ERRORS.equals(status) || FAILED.equals(status);
  }
}
