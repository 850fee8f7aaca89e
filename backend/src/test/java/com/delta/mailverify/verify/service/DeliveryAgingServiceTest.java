package com.delta.mailverify.verify.service;

import com.delta.mailverify.pipeline.persistence.PipelineRunRepository;
import com.delta.mailverify.verify.model.TestSendStatus;
import com.delta.mailverify.verify.model.VerificationResultRow;
import com.delta.mailverify.verify.model.VerifyStatus;
import com.delta.mailverify.verify.persistence.VerificationResultRepository;
import com.delta.mailverify.verify.util.VerificationReasonCodes;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.transaction.annotation.Transactional;

import java.time.Duration;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;

@SpringBootTest
@ActiveProfiles("test")
@Transactional
class DeliveryAgingServiceTest {

    @Autowired
    private DeliveryAgingService agingService;

    @Autowired
    private VerificationResultRepository resultRepository;

    @Autowired
    private PipelineRunRepository runRepository;

    private VerificationFixtures fixtures;

    @BeforeEach
    void setUp() {
        fixtures = new VerificationFixtures(runRepository, resultRepository);
    }

    @Test
    void staleSendsAreAssumedDeliveredAndAmbiguousRowsUpgraded() {
        Instant now = Instant.now();
        String domain = VerificationFixtures.uniqueDomain("aging");
        long stale = fixtures.sent(null, null, "old", domain, VerifyStatus.UNKNOWN_TIMEOUT, now.minus(Duration.ofHours(30)));
        long fresh = fixtures.sent(null, null, "new", domain, VerifyStatus.RISKY_CATCH_ALL, now.minus(Duration.ofHours(1)));

        int aged = agingService.assumeDeliveredForStale(now, Duration.ofHours(24));

        assertThat(aged).isGreaterThanOrEqualTo(1);
        VerificationResultRow staleRow = resultRepository.findById(stale).orElseThrow();
        assertEquals(TestSendStatus.DELIVERED_ASSUMED, staleRow.testSendStatus());
        assertEquals(VerifyStatus.VALID, staleRow.verifyStatus());
        assertEquals(VerificationReasonCodes.NO_BOUNCE_AFTER_TEST_SEND, staleRow.verifyReason());
        assertEquals(TestSendStatus.SENT, resultRepository.findById(fresh).orElseThrow().testSendStatus());
    }

    @Test
    void invalidRowKeepsItsStatusWhenAged() {
        Instant now = Instant.now();
        String domain = VerificationFixtures.uniqueDomain("aging-invalid");
        long row = fixtures.sent(null, null, "x", domain, VerifyStatus.INVALID, now.minus(Duration.ofHours(48)));

        agingService.assumeDeliveredForStale(now, Duration.ofHours(24));

        VerificationResultRow aged = resultRepository.findById(row).orElseThrow();
        assertEquals(TestSendStatus.DELIVERED_ASSUMED, aged.testSendStatus());
        assertEquals(VerifyStatus.INVALID, aged.verifyStatus());
    }

    @Test
    void nothingStaleIsNoop() {
        assertEquals(0, agingService.assumeDeliveredForStale(Instant.parse("2000-01-01T00:00:00Z"), Duration.ofHours(24)));
    }
}
