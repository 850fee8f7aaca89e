package com.delta.mailverify.verify.service;

import com.delta.mailverify.pipeline.model.JobTypes;
import com.delta.mailverify.pipeline.persistence.PipelineRunRepository;
import com.delta.mailverify.verify.bounce.BounceImportResult;
import com.delta.mailverify.verify.bounce.BounceImportService;
import com.delta.mailverify.verify.bounce.BounceNotification;
import com.delta.mailverify.verify.model.TestSendStatus;
import com.delta.mailverify.verify.model.VerifyStatus;
import com.delta.mailverify.verify.persistence.VerificationResultRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;

@SpringBootTest
@ActiveProfiles("test")
@Transactional
class TestSendEscalationFlowTest {

    @Autowired
    private BounceImportService bounceImportService;

    @Autowired
    private TestSendService testSendService;

    @Autowired
    private VerificationResultRepository resultRepository;

    @Autowired
    private PipelineRunRepository runRepository;

    @Autowired
    private NamedParameterJdbcTemplate jdbc;

    private VerificationFixtures fixtures;

    @BeforeEach
    void setUp() {
        fixtures = new VerificationFixtures(runRepository, resultRepository);
    }

    private long testSendJobs() {
        Long count = jdbc.queryForObject(
            "SELECT COUNT(*) FROM pipeline_jobs WHERE job_type = :type",
            new MapSqlParameterSource().addValue("type", JobTypes.TEST_SEND),
            Long.class
        );
        return count == null ? 0 : count;
    }

    @Test
    void hardBounceWalksToNextCandidateOneAtATime() {
        String domain = VerificationFixtures.uniqueDomain("acme");
        long company = fixtures.company(domain);
        long person = fixtures.person(company, "Brett", "Anderson");
        long first = fixtures.result(person, company, "brett.anderson", domain, VerifyStatus.RISKY_CATCH_ALL);
        long second = fixtures.result(person, company, "b.anderson", domain, VerifyStatus.RISKY_CATCH_ALL);
        long third = fixtures.result(person, company, "brett", domain, VerifyStatus.UNKNOWN_TIMEOUT);
        String token = testSendService.requestTestSend(first).orElseThrow();
        testSendService.markSent(first, null);
        long jobsBefore = testSendJobs();

        BounceImportResult result = bounceImportService.apply(
            new BounceNotification("brett.anderson@" + domain, token, true, "5.1.1", "user unknown")
        );

        assertEquals(BounceImportResult.APPLIED, result.outcome());
        assertEquals(second, result.escalatedResultId());
        assertEquals(TestSendStatus.BOUNCE_HARD, resultRepository.findById(first).orElseThrow().testSendStatus());
        assertEquals(TestSendStatus.PENDING, resultRepository.findById(second).orElseThrow().testSendStatus());
        assertEquals(TestSendStatus.NOT_REQUESTED, resultRepository.findById(third).orElseThrow().testSendStatus());
        assertEquals(jobsBefore + 1, testSendJobs());
    }

    private BounceImportResult hardBounce(long resultId, String email) {
        String token = resultRepository.findById(resultId).orElseThrow().testSendToken();
        testSendService.markSent(resultId, Instant.now());
        return bounceImportService.apply(new BounceNotification(email, token, true, "5.1.1", "no such user"));
    }

    @Test
    void chainIsExhaustedAfterEveryPatternBounces() {
        String domain = VerificationFixtures.uniqueDomain("chain");
        long company = fixtures.company(domain);
        long person = fixtures.person(company, "Brett", "Anderson");
        long flast = fixtures.result(person, company, "banderson", domain, VerifyStatus.RISKY_CATCH_ALL);
        long firstDotLast = fixtures.result(person, company, "brett.anderson", domain, VerifyStatus.RISKY_CATCH_ALL);
        long first = fixtures.result(person, company, "brett", domain, VerifyStatus.RISKY_CATCH_ALL);
        testSendService.requestTestSend(flast).orElseThrow();

        assertEquals(firstDotLast, hardBounce(flast, "banderson@" + domain).escalatedResultId());
        assertEquals(first, hardBounce(firstDotLast, "brett.anderson@" + domain).escalatedResultId());
        BounceImportResult last = hardBounce(first, "brett@" + domain);

        assertEquals(BounceImportResult.APPLIED, last.outcome());
        assertNull(last.escalatedResultId());
        assertEquals(VerifyStatus.INVALID, resultRepository.findById(first).orElseThrow().verifyStatus());
    }
}
