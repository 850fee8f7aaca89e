package com.delta.mailverify.verify.bounce;

import java.util.List;

public class NoopBounceQueueClient implements BounceQueueClient {

    @Override
    public List<QueuedMessage> receive(int maxMessages) {
        return List.of();
    }

    @Override
    public void delete(String receiptHandle) {
        // nothing was received
    }
}
