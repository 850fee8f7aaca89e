package com.delta.mailverify.verify.service;

import com.delta.mailverify.verify.model.DeliveryEvidence;
import com.delta.mailverify.verify.model.TestSendHistoryRow;
import com.delta.mailverify.verify.model.TestSendStatus;
import com.delta.mailverify.verify.persistence.VerificationResultRepository;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Locale;

/**
 * Per-domain delivery evidence derived from every test-sent row the domain has ever had.
 */
@Service
public class DeliveryEvidenceStore {
    private static final List<String> USER_UNKNOWN_PHRASES = List.of(
        "user unknown",
        "unknown user",
        "no such user",
        "recipient not found",
        "mailbox unavailable",
        "recipient address rejected"
    );

    private final VerificationResultRepository resultRepository;

    public DeliveryEvidenceStore(VerificationResultRepository resultRepository) {
        this.resultRepository = resultRepository;
    }

    public static boolean isUserUnknownHardBounce(String bounceCode, String bounceReason) {
        if (bounceCode != null && bounceCode.trim().startsWith("5.1.")) {
            return true;
        }
        if (bounceReason == null || bounceReason.isBlank()) {
            return false;
        }
        String reason = bounceReason.toLowerCase(Locale.ROOT);
        for (String phrase : USER_UNKNOWN_PHRASES) {
            if (reason.contains(phrase)) {
                return true;
            }
        }
        return false;
    }

    public static DeliveryEvidence aggregate(String domain, List<TestSendHistoryRow> rows) {
        boolean goodReal = false;
        boolean badInvalid = false;
        for (TestSendHistoryRow row : rows) {
            boolean userUnknown = isUserUnknownHardBounce(row.bounceCode(), row.bounceReason());
            if (TestSendStatus.isDelivered(row.testSendStatus()) && !userUnknown) {
                goodReal = true;
            }
            if (TestSendStatus.BOUNCE_HARD.equals(row.testSendStatus()) && userUnknown) {
                badInvalid = true;
            }
        }
        return new DeliveryEvidence(domain, goodReal, badInvalid);
    }

    public DeliveryEvidence evidenceFor(String domain) {
        if (domain == null || domain.isBlank()) {
            return DeliveryEvidence.empty(domain);
        }
        return aggregate(domain, resultRepository.findTestSendHistory(domain));
    }
}
