package com.delta.mailverify.verify.bounce;

import com.delta.mailverify.verify.model.EscalationCandidate;
import com.delta.mailverify.verify.model.VerificationResultRow;
import com.delta.mailverify.verify.persistence.VerificationResultRepository;
import com.delta.mailverify.verify.service.CatchAllClassifier;
import com.delta.mailverify.verify.service.TestSendEscalator;
import com.delta.mailverify.verify.service.TestSendService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Optional;

/**
 * Applies bounce notifications to test-sent rows and continues the escalation chain after a
 * hard bounce.
 */
@Service
public class BounceImportService {
    private static final Logger log = LoggerFactory.getLogger(BounceImportService.class);

    private final BounceNotificationParser parser;
    private final BounceQueueClient queueClient;
    private final VerificationResultRepository resultRepository;
    private final TestSendService testSendService;
    private final TestSendEscalator escalator;
    private final CatchAllClassifier catchAllClassifier;

    public BounceImportService(
        BounceNotificationParser parser,
        BounceQueueClient queueClient,
        VerificationResultRepository resultRepository,
        TestSendService testSendService,
        TestSendEscalator escalator,
        CatchAllClassifier catchAllClassifier
    ) {
        this.parser = parser;
        this.queueClient = queueClient;
        this.resultRepository = resultRepository;
        this.testSendService = testSendService;
        this.escalator = escalator;
        this.catchAllClassifier = catchAllClassifier;
    }

    public BounceImportResult importMessage(String body) {
        Optional<BounceNotification> parsed = parser.parse(body);
        if (parsed.isEmpty()) {
            return BounceImportResult.ignored();
        }
        return apply(parsed.get());
    }

    public BounceImportResult apply(BounceNotification notification) {
        Optional<VerificationResultRow> row = resolve(notification);
        if (row.isEmpty()) {
            log.warn("No test-send matches bounce for {} (token={})", notification.recipientEmail(), notification.token());
            return BounceImportResult.unmatched(notification);
        }
        VerificationResultRow target = row.get();
        boolean applied = testSendService.applyBounce(
            target.id(),
            notification.hard(),
            notification.statusCode(),
            notification.reason()
        );
        if (!applied) {
            return new BounceImportResult(
                BounceImportResult.ALREADY_RESOLVED,
                target.id(),
                target.testSendToken(),
                notification.hard(),
                null
            );
        }
        catchAllClassifier.reclassifyDomain(target.domain());

        Long escalatedId = null;
        if (notification.hard()) {
            escalatedId = escalator.escalateAfterHardBounce(target.id())
                .map(EscalationCandidate::resultId)
                .orElse(null);
        }
        return new BounceImportResult(
            BounceImportResult.APPLIED,
            target.id(),
            target.testSendToken(),
            notification.hard(),
            escalatedId
        );
    }

    /**
     * Pulls up to {@code maxMessages} notifications from the bounce queue. Messages are deleted
     * once handled, including ones that turn out not to be bounces.
     */
    public int drain(int maxMessages) {
        List<BounceQueueClient.QueuedMessage> messages = queueClient.receive(Math.max(1, maxMessages));
        int handled = 0;
        for (BounceQueueClient.QueuedMessage message : messages) {
            try {
                importMessage(message.body());
                queueClient.delete(message.receiptHandle());
                handled++;
            } catch (RuntimeException e) {
                log.warn("Failed to import bounce message {}", message.receiptHandle(), e);
            }
        }
        return handled;
    }

    private Optional<VerificationResultRow> resolve(BounceNotification notification) {
        if (notification.token() != null) {
            Optional<VerificationResultRow> byToken = resultRepository.findByToken(notification.token());
            if (byToken.isPresent()) {
                return byToken;
            }
        }
        if (notification.recipientEmail() == null) {
            return Optional.empty();
        }
        // Can pick the wrong attempt when several test-sends to one address are outstanding.
        return resultRepository.findLatestOutstandingByRecipient(notification.recipientEmail().trim());
    }
}
