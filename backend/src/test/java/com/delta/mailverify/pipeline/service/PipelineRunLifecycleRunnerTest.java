package com.delta.mailverify.pipeline.service;

import com.delta.mailverify.pipeline.model.JobTypes;
import com.delta.mailverify.pipeline.model.NewJob;
import com.delta.mailverify.pipeline.model.RunStatus;
import com.delta.mailverify.pipeline.persistence.JobQueueRepository;
import com.delta.mailverify.pipeline.persistence.PipelineRunRepository;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.transaction.annotation.Transactional;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;

@SpringBootTest
@ActiveProfiles("test")
@Transactional
class PipelineRunLifecycleRunnerTest {

    @Autowired
    private PipelineRunLifecycleRunner lifecycleRunner;

    @Autowired
    private PipelineRunRepository runRepository;

    @Autowired
    private JobQueueRepository queueRepository;

    @Test
    void staleRunsWithoutOpenJobsAreAborted() {
        long idle = runRepository.createRun("t1", List.of("idle.example"), Map.of());
        runRepository.markRunning(idle);
        long busy = runRepository.createRun("t1", List.of("busy.example"), Map.of());
        runRepository.markRunning(busy);
        queueRepository.enqueue(new NewJob(JobTypes.DISCOVERY, Map.of(), null, 3, "t1", busy, null));

        int aborted = lifecycleRunner.abortStaleRuns(Instant.now().plus(Duration.ofHours(3)));

        assertThat(aborted).isGreaterThanOrEqualTo(1);
        assertEquals(RunStatus.FAILED, runRepository.findRun(idle).orElseThrow().status());
        assertEquals(PipelineRunLifecycleRunner.ABORTED_ON_STARTUP, runRepository.findRun(idle).orElseThrow().error());
        assertEquals(RunStatus.RUNNING, runRepository.findRun(busy).orElseThrow().status());
    }

    @Test
    void freshRunsAreLeftAlone() {
        long fresh = runRepository.createRun("t1", List.of("fresh.example"), Map.of());
        runRepository.markRunning(fresh);

        lifecycleRunner.abortStaleRuns(Instant.now());

        assertEquals(RunStatus.RUNNING, runRepository.findRun(fresh).orElseThrow().status());
    }
}
