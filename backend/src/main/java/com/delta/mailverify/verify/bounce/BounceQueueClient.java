package com.delta.mailverify.verify.bounce;

import java.util.List;

/**
 * Pull access to the external queue that receives bounce notifications.
 */
public interface BounceQueueClient {

    record QueuedMessage(String receiptHandle, String body) {}

    List<QueuedMessage> receive(int maxMessages);

    void delete(String receiptHandle);
}
