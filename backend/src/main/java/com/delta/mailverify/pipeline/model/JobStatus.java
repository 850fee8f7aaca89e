package com.delta.mailverify.pipeline.model;

public final class JobStatus {
  public static final String QUEUED = "queued";
  public static final String RUNNING = "running";
  public static final String SUCCEEDED = "succeeded";
  public static final String FAILED = "failed";

  private JobStatus() {}
}
