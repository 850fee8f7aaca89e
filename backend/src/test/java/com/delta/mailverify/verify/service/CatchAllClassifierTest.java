package com.delta.mailverify.verify.service;

import com.delta.mailverify.pipeline.persistence.PipelineRunRepository;
import com.delta.mailverify.verify.model.CatchAllProofStatus;
import com.delta.mailverify.verify.model.DeliveryEvidence;
import com.delta.mailverify.verify.model.VerifyStatus;
import com.delta.mailverify.verify.persistence.DomainEvidenceRepository;
import com.delta.mailverify.verify.persistence.VerificationResultRepository;
import com.delta.mailverify.verify.util.VerificationReasonCodes;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;

@SpringBootTest
@ActiveProfiles("test")
@Transactional
class CatchAllClassifierTest {

    @Autowired
    private CatchAllClassifier classifier;

    @Autowired
    private VerificationResultRepository resultRepository;

    @Autowired
    private DomainEvidenceRepository evidenceRepository;

    @Autowired
    private PipelineRunRepository runRepository;

    private VerificationFixtures fixtures;

    @BeforeEach
    void setUp() {
        fixtures = new VerificationFixtures(runRepository, resultRepository);
    }

    @Test
    void provenOnlyWithBothSignals() {
        assertEquals(CatchAllProofStatus.NOT_CATCHALL_PROVEN, CatchAllClassifier.classify(new DeliveryEvidence("d", true, true)));
        assertEquals(CatchAllProofStatus.UNKNOWN, CatchAllClassifier.classify(new DeliveryEvidence("d", true, false)));
        assertEquals(CatchAllProofStatus.UNKNOWN, CatchAllClassifier.classify(new DeliveryEvidence("d", false, true)));
        assertEquals(CatchAllProofStatus.UNKNOWN, CatchAllClassifier.classify(null));
    }

    @Test
    void bounceAndDeliveryProveDomainAndUpgradeDeliveredRiskyRows() {
        String domain = VerificationFixtures.uniqueDomain("proof");
        long delivered = fixtures.sent(null, null, "brett.anderson", domain, VerifyStatus.RISKY_CATCH_ALL, Instant.now());
        fixtures.hardBounced(null, null, "b.anderson", domain, "5.1.1", "user unknown");
        long untested = fixtures.result(null, null, "brett", domain, VerifyStatus.RISKY_CATCH_ALL);

        CatchAllClassifier.ReclassifyResult result = classifier.reclassifyDomain(domain);

        assertEquals(CatchAllProofStatus.NOT_CATCHALL_PROVEN, result.status());
        assertEquals(1, result.upgraded());
        assertEquals(VerifyStatus.VALID, resultRepository.findById(delivered).orElseThrow().verifyStatus());
        assertEquals(
            VerificationReasonCodes.NO_BOUNCE_AFTER_TEST_SEND,
            resultRepository.findById(delivered).orElseThrow().verifyReason()
        );
        assertEquals(VerifyStatus.RISKY_CATCH_ALL, resultRepository.findById(untested).orElseThrow().verifyStatus());
        assertThat(evidenceRepository.findDeliveryCatchAllStatus(domain)).contains(CatchAllProofStatus.NOT_CATCHALL_PROVEN);
    }

    @Test
    void deliveryWithoutInvalidBounceStaysUnknown() {
        String domain = VerificationFixtures.uniqueDomain("unproven");
        long delivered = fixtures.sent(null, null, "jane", domain, VerifyStatus.RISKY_CATCH_ALL, Instant.now());
        fixtures.hardBounced(null, null, "john", domain, "5.7.1", "blocked by policy");

        CatchAllClassifier.ReclassifyResult result = classifier.reclassifyDomain(domain);

        assertEquals(CatchAllProofStatus.UNKNOWN, result.status());
        assertEquals(0, result.upgraded());
        assertEquals(VerifyStatus.RISKY_CATCH_ALL, resultRepository.findById(delivered).orElseThrow().verifyStatus());
        assertThat(evidenceRepository.findDeliveryCatchAllStatus(domain)).contains(CatchAllProofStatus.UNKNOWN);
    }

    @Test
    void reclassifyAllCoversDomainsWithTestSendActivity() {
        String active = VerificationFixtures.uniqueDomain("active");
        String idle = VerificationFixtures.uniqueDomain("idle");
        fixtures.sent(null, null, "jane", active, VerifyStatus.RISKY_CATCH_ALL, Instant.now());
        fixtures.result(null, null, "jane", idle, VerifyStatus.RISKY_CATCH_ALL);

        List<CatchAllClassifier.ReclassifyResult> results = classifier.reclassifyAll();

        assertThat(results).extracting(CatchAllClassifier.ReclassifyResult::domain).contains(active).doesNotContain(idle);
    }
}
