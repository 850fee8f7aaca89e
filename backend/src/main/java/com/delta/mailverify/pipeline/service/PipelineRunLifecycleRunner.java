package com.delta.mailverify.pipeline.service;

import com.delta.mailverify.config.VerifierProperties;
import com.delta.mailverify.pipeline.model.RunStatus;
import com.delta.mailverify.pipeline.persistence.JobQueueRepository;
import com.delta.mailverify.pipeline.persistence.PipelineRunRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

@Component
public class PipelineRunLifecycleRunner implements ApplicationRunner {
    private static final Logger log = LoggerFactory.getLogger(PipelineRunLifecycleRunner.class);
    static final String ABORTED_ON_STARTUP = "aborted_on_startup";

    private final PipelineRunRepository runRepository;
    private final JobQueueRepository queueRepository;
    private final VerifierProperties properties;

    public PipelineRunLifecycleRunner(
        PipelineRunRepository runRepository,
        JobQueueRepository queueRepository,
        VerifierProperties properties
    ) {
        this.runRepository = runRepository;
        this.queueRepository = queueRepository;
        this.properties = properties;
    }

    @Override
    public void run(ApplicationArguments args) {
        abortStaleRuns(Instant.now());
    }

    /**
     * Fails runs left in {@code running} past the stale window with no queued or running jobs.
     *
     * @return number of runs aborted
     */
    public int abortStaleRuns(Instant now) {
        boolean dbConnected;
        try {
            dbConnected = runRepository.isDbReachable();
        } catch (Exception e) {
            dbConnected = false;
        }
        if (!dbConnected) {
            log.warn("Skipping stale run cleanup because database is unreachable");
            return 0;
        }

        Instant cutoff = now.minus(Duration.ofMinutes(properties.getPipeline().getStaleRunMinutes()));
        List<Long> stale = runRepository.findRunningStartedBefore(cutoff);
        int aborted = 0;
        for (Long runId : stale) {
            if (queueRepository.countOpenForRun(runId) > 0) {
                continue;
            }
            if (runRepository.finishRun(runId, RunStatus.FAILED, ABORTED_ON_STARTUP, null)) {
                aborted++;
                log.info("Aborted stale pipeline run {} with no open jobs", runId);
            }
        }
        return aborted;
    }
}
