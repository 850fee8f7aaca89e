package com.delta.mailverify.pipeline.model;

import java.util.Map;

/**
 * Job types and the queue each one runs on.
 */
public final class JobTypes {
  public static final String DISCOVERY = "discovery";
  public static final String GENERATE_FANOUT = "generate_fanout";
  public static final String GENERATE_PERSON = "generate_person";
  public static final String VERIFY_SWEEP = "verify_sweep";
  public static final String PROBE = "probe";
  public static final String TEST_SEND = "test_send";

  public static final String QUEUE_CRAWL = "crawl";
  public static final String QUEUE_GENERATE = "generate";
  public static final String QUEUE_VERIFY = "verify";
  public static final String QUEUE_TEST_SEND = "test_send";

  private static final Map<String, String> QUEUE_BY_TYPE = Map.of(
      DISCOVERY, QUEUE_CRAWL,
      GENERATE_FANOUT, QUEUE_GENERATE,
      GENERATE_PERSON, QUEUE_GENERATE,
      VERIFY_SWEEP, QUEUE_VERIFY,
      PROBE, QUEUE_VERIFY,
      TEST_SEND, QUEUE_TEST_SEND
  );

  private JobTypes() {}

  public static String queueFor(String jobType) {
    String queue = QUEUE_BY_TYPE.get(jobType);
    if (queue == null) {
      throw new IllegalArgumentException("Unknown job type: " + jobType);
    }
    return queue;
  }
}
