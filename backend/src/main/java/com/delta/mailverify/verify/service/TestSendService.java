package com.delta.mailverify.verify.service;

import com.delta.mailverify.config.VerifierProperties;
import com.delta.mailverify.verify.model.TestSendStatus;
import com.delta.mailverify.verify.model.VerificationResultRow;
import com.delta.mailverify.verify.persistence.VerificationResultRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.security.SecureRandom;
import java.time.Instant;
import java.util.Base64;
import java.util.Optional;

/**
 * Owns the test-send columns of a verification row: token minting, the pending and sent
 * transitions, and bounce application.
 */
@Service
public class TestSendService {
    private static final Logger log = LoggerFactory.getLogger(TestSendService.class);
    private static final int TOKEN_RANDOM_CHARS = 16;
    public static final String DEFAULT_HARD_REASON = "hard_bounce";
    public static final String DEFAULT_SOFT_REASON = "soft_bounce";

    private final VerificationResultRepository resultRepository;
    private final VerifierProperties properties;
    private final SecureRandom random = new SecureRandom();

    public TestSendService(VerificationResultRepository resultRepository, VerifierProperties properties) {
        this.resultRepository = resultRepository;
        this.properties = properties;
    }

    /**
     * Moves the row to {@code pending}, reusing its token when it already has one.
     *
     * @return the token, or empty when the row is missing or already past {@code pending}
     */
    public Optional<String> requestTestSend(long resultId) {
        Optional<VerificationResultRow> row = resultRepository.findById(resultId);
        if (row.isEmpty()) {
            return Optional.empty();
        }
        String status = row.get().testSendStatus();
        if (!TestSendStatus.isUntried(status) && !TestSendStatus.PENDING.equals(status)) {
            log.debug("Result {} already has test-send status {}", resultId, status);
            return Optional.empty();
        }
        String token = row.get().testSendToken();
        if (token == null || token.isBlank()) {
            token = mintToken(resultId);
        }
        int updated = resultRepository.markTestSendRequested(resultId, token);
        return updated == 1 ? Optional.of(token) : Optional.empty();
    }

    public boolean markSent(long resultId, Instant sentAt) {
        return resultRepository.markTestSendSent(resultId, sentAt == null ? Instant.now() : sentAt) == 1;
    }

    public boolean applyBounce(long resultId, boolean hard, String code, String reason) {
        return applyBounce(resultId, hard, code, reason, Instant.now());
    }

    public boolean applyBounce(long resultId, boolean hard, String code, String reason, Instant bouncedAt) {
        String effectiveReason = reason == null || reason.isBlank()
            ? (hard ? DEFAULT_HARD_REASON : DEFAULT_SOFT_REASON)
            : reason;
        int updated = resultRepository.applyBounce(resultId, hard, code, effectiveReason, bouncedAt);
        if (updated == 1) {
            log.info("Applied {} bounce to result {} (code={})", hard ? "hard" : "soft", resultId, code);
            return true;
        }
        log.debug("Bounce for result {} ignored: no outstanding test-send", resultId);
        return false;
    }

    public String returnPathFor(String token) {
        VerifierProperties.TestSend testSend = properties.getTestSend();
        return testSend.getBouncePrefix() + "+" + token + "@" + testSend.getBounceDomain();
    }

    public TestSendMessage messageFor(VerificationResultRow row) {
        String token = row.testSendToken();
        return new TestSendMessage(
            row.id(),
            row.email(),
            returnPathFor(token),
            token,
            "Quick question (token=" + token + ")"
        );
    }

    String mintToken(long resultId) {
        byte[] bytes = new byte[12];
        random.nextBytes(bytes);
        String suffix = Base64.getUrlEncoder().withoutPadding().encodeToString(bytes);
        return "vr" + resultId + "-" + suffix.substring(0, TOKEN_RANDOM_CHARS);
    }
}
