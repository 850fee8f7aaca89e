package com.delta.mailverify.pipeline.persistence;

import com.delta.mailverify.pipeline.model.JobStatus;
import com.delta.mailverify.pipeline.model.JobTypes;
import com.delta.mailverify.pipeline.model.NewJob;
import com.delta.mailverify.pipeline.model.PipelineJob;
import com.delta.mailverify.pipeline.model.RunJobCounts;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;

@SpringBootTest
@ActiveProfiles("test")
@Transactional
class JobQueueRepositoryTest {
    private static final long RUN_ID = 9_000_001L;

    @Autowired
    private JobQueueRepository queueRepository;

    @Autowired
    private NamedParameterJdbcTemplate jdbc;

    private long enqueue(String type, Long dependsOn, long companyId) {
        return queueRepository.enqueue(new NewJob(type, Map.of("company_id", companyId), dependsOn, 3, "t1", RUN_ID, companyId));
    }

    private String statusOf(long jobId) {
        return queueRepository.findById(jobId).orElseThrow().status();
    }

    @Test
    void dependentJobWaitsForItsParent() {
        long discovery = enqueue(JobTypes.DISCOVERY, null, 1L);
        long fanout = enqueue(JobTypes.GENERATE_FANOUT, discovery, 1L);

        assertThat(queueRepository.claimNext(JobTypes.QUEUE_GENERATE, "w1", 60)).isEmpty();

        PipelineJob claimed = queueRepository.claimNext(JobTypes.QUEUE_CRAWL, "w1", 60).orElseThrow();
        assertEquals(discovery, claimed.id());
        assertEquals(1, claimed.attempts());
        assertEquals(JobStatus.RUNNING, claimed.status());
        assertEquals(1L, claimed.payloadLong("company_id"));
        queueRepository.markSucceeded(discovery);

        PipelineJob next = queueRepository.claimNext(JobTypes.QUEUE_GENERATE, "w1", 60).orElseThrow();
        assertEquals(fanout, next.id());
    }

    @Test
    void runningJobIsNotClaimedTwiceUntilLockExpires() {
        long job = enqueue(JobTypes.DISCOVERY, null, 1L);
        queueRepository.claimNext(JobTypes.QUEUE_CRAWL, "w1", 60).orElseThrow();

        assertThat(queueRepository.claimNext(JobTypes.QUEUE_CRAWL, "w2", 60)).isEmpty();

        jdbc.update(
            "UPDATE pipeline_jobs SET locked_until = :past WHERE id = :id",
            new MapSqlParameterSource()
                .addValue("past", java.sql.Timestamp.from(Instant.now().minusSeconds(5)))
                .addValue("id", job)
        );
        PipelineJob reclaimed = queueRepository.claimNext(JobTypes.QUEUE_CRAWL, "w2", 60).orElseThrow();
        assertEquals(job, reclaimed.id());
        assertEquals(2, reclaimed.attempts());
    }

    @Test
    void futureJobIsNotDue() {
        queueRepository.enqueue(
            new NewJob(JobTypes.DISCOVERY, Map.of(), null, 3, "t1", RUN_ID, 1L),
            Instant.now().plusSeconds(3600)
        );

        assertThat(queueRepository.claimNext(JobTypes.QUEUE_CRAWL, "w1", 60)).isEmpty();
    }

    @Test
    void failureCascadesThroughDependents() {
        long discovery = enqueue(JobTypes.DISCOVERY, null, 1L);
        long fanout = enqueue(JobTypes.GENERATE_FANOUT, discovery, 1L);
        long sweep = enqueue(JobTypes.VERIFY_SWEEP, fanout, 1L);
        long unrelated = enqueue(JobTypes.DISCOVERY, null, 2L);

        List<Long> cascaded = queueRepository.markFailed(discovery, "crawl_failed: timeout");

        assertThat(cascaded).containsExactly(fanout, sweep);
        assertEquals(JobStatus.FAILED, statusOf(sweep));
        assertEquals(JobStatus.QUEUED, statusOf(unrelated));
        assertThat(queueRepository.findErrors(RUN_ID, 10))
            .extracting(JobQueueRepository.JobError::error)
            .containsExactly("crawl_failed: timeout", JobQueueRepository.DEPENDENCY_FAILED, JobQueueRepository.DEPENDENCY_FAILED);
    }

    @Test
    void retryRequeuesWithErrorAndSpendsAttempt() {
        long job = enqueue(JobTypes.DISCOVERY, null, 1L);
        queueRepository.claimNext(JobTypes.QUEUE_CRAWL, "w1", 60);

        queueRepository.markRetry(job, Instant.now().minusSeconds(1), "smtp_451");

        PipelineJob again = queueRepository.claimNext(JobTypes.QUEUE_CRAWL, "w1", 60).orElseThrow();
        assertEquals(2, again.attempts());
    }

    @Test
    void deferGivesTheAttemptBack() {
        long job = enqueue(JobTypes.VERIFY_SWEEP, null, 1L);
        queueRepository.claimNext(JobTypes.QUEUE_VERIFY, "w1", 60);

        queueRepository.defer(job, Instant.now().plusSeconds(15), "waiting_for_generation");

        PipelineJob deferred = queueRepository.findById(job).orElseThrow();
        assertEquals(JobStatus.QUEUED, deferred.status());
        assertEquals(0, deferred.attempts());
        assertThat(queueRepository.claimNext(JobTypes.QUEUE_VERIFY, "w1", 60)).isEmpty();
    }

    @Test
    void countsByRunCompanyAndType() {
        long a = enqueue(JobTypes.DISCOVERY, null, 1L);
        long b = enqueue(JobTypes.GENERATE_PERSON, null, 1L);
        enqueue(JobTypes.GENERATE_PERSON, null, 2L);
        queueRepository.markSucceeded(a);
        queueRepository.markFailed(b, "boom");

        RunJobCounts counts = queueRepository.countForRun(RUN_ID);
        assertEquals(1, counts.succeeded());
        assertEquals(1, counts.failed());
        assertEquals(1, counts.queued());
        assertEquals(1, queueRepository.countOpenForRun(RUN_ID));
        assertEquals(0, queueRepository.countOpen(RUN_ID, 1L, JobTypes.GENERATE_PERSON));
        assertEquals(1, queueRepository.countOpen(RUN_ID, 2L, JobTypes.GENERATE_PERSON));

        List<JobQueueRepository.CompanyJobCounts> byCompany = queueRepository.countByCompany(RUN_ID);
        assertEquals(2, byCompany.size());
        assertEquals(new JobQueueRepository.CompanyJobCounts(1L, 1, 1), byCompany.get(0));
    }

    @Test
    void unknownJobIsAbsent() {
        assertEquals(Optional.empty(), queueRepository.findById(-1L));
    }
}
