package com.delta.mailverify.verify.service;

import com.delta.mailverify.verify.model.DeliveryEvidence;
import com.delta.mailverify.verify.model.TestSendHistoryRow;
import com.delta.mailverify.verify.model.TestSendStatus;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class DeliveryEvidenceStoreTest {

    @Test
    void recognisesUserUnknownByCodeOrPhrase() {
        assertTrue(DeliveryEvidenceStore.isUserUnknownHardBounce("5.1.1", null));
        assertTrue(DeliveryEvidenceStore.isUserUnknownHardBounce(null, "550 Recipient address rejected: no mailbox"));
        assertTrue(DeliveryEvidenceStore.isUserUnknownHardBounce("", "smtp; 550 5.1.1 User Unknown"));
        assertFalse(DeliveryEvidenceStore.isUserUnknownHardBounce("5.7.1", "message rejected as spam"));
        assertFalse(DeliveryEvidenceStore.isUserUnknownHardBounce(null, null));
    }

    @Test
    void deliveredAndUserUnknownTogetherGiveBothSignals() {
        DeliveryEvidence evidence = DeliveryEvidenceStore.aggregate("example.com", List.of(
            new TestSendHistoryRow("a@example.com", TestSendStatus.DELIVERED_ASSUMED, null, null),
            new TestSendHistoryRow("b@example.com", TestSendStatus.BOUNCE_HARD, "5.1.1", "user unknown")
        ));

        assertTrue(evidence.hasGoodReal());
        assertTrue(evidence.hasBadInvalid());
    }

    @Test
    void policyHardBounceIsNotInvalidEvidence() {
        DeliveryEvidence evidence = DeliveryEvidenceStore.aggregate("example.com", List.of(
            new TestSendHistoryRow("b@example.com", TestSendStatus.BOUNCE_HARD, "5.7.1", "blocked by policy")
        ));

        assertFalse(evidence.hasBadInvalid());
        assertFalse(evidence.hasGoodReal());
    }

    @Test
    void softBounceAndPendingContributeNothing() {
        DeliveryEvidence evidence = DeliveryEvidenceStore.aggregate("example.com", List.of(
            new TestSendHistoryRow("a@example.com", TestSendStatus.BOUNCE_SOFT, "4.2.2", "mailbox full"),
            new TestSendHistoryRow("b@example.com", TestSendStatus.PENDING, null, null)
        ));

        assertFalse(evidence.hasGoodReal());
        assertFalse(evidence.hasBadInvalid());
    }

    @Test
    void sentCountsAsDelivered() {
        DeliveryEvidence evidence = DeliveryEvidenceStore.aggregate("example.com", List.of(
            new TestSendHistoryRow("a@example.com", TestSendStatus.SENT, null, null)
        ));

        assertTrue(evidence.hasGoodReal());
    }
}
