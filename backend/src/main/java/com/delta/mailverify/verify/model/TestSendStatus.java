package com.delta.mailverify.verify.model;

import java.util.List;
import java.util.Set;

/**
 * Test-send lifecycle values. A row only moves forward:
 * not_requested, pending, sent, then one of bounce_hard, bounce_soft or delivered_assumed.
 */
public final class TestSendStatus {
  public static final String NOT_REQUESTED = "not_requested";
  public static final String PENDING = "pending";
  public static final String SENT = "sent";
  public static final String BOUNCE_HARD = "bounce_hard";
  public static final String BOUNCE_SOFT = "bounce_soft";
  public static final String DELIVERED_ASSUMED = "delivered_assumed";

  private static final List<String> ORDER = List.of(NOT_REQUESTED, PENDING, SENT);
  private static final Set<String> TERMINAL = Set.of(BOUNCE_HARD, BOUNCE_SOFT, DELIVERED_ASSUMED);
  private static final Set<String> DELIVERED = Set.of(SENT, DELIVERED_ASSUMED);

  private TestSendStatus() {}

  public static boolean isTerminal(String status) {
    return status != null && TERMINAL.contains(status);
  }

  public static boolean isOutstanding(String status) {
    return PENDING.equals(status) || SENT.equals(status);
  }

  public static boolean isDelivered(String status) {
    return status != null && DELIVERED.contains(status);
  }

  public static boolean isUntried(String status) {
    return status == null || NOT_REQUESTED.equals(status);
  }

  public static boolean canTransition(String from, String to) {
    String current = from == null ? NOT_REQUESTED : from;
    if (to == null || isTerminal(current)) {
      return false;
    }
    if (isTerminal(to)) {
      return SENT.equals(current) || (PENDING.equals(current) && !DELIVERED_ASSUMED.equals(to));
    }
    return ORDER.indexOf(to) > ORDER.indexOf(current);
  }
}
