package com.delta.mailverify.verify.bounce;

/**
 * A parsed bounce. {@code token} is null when no token could be recovered from the payload.
 */
public record BounceNotification(
    String recipientEmail,
    String token,
    boolean hard,
    String statusCode,
    String reason
) {}
