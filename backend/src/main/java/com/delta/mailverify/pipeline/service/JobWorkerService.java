package com.delta.mailverify.pipeline.service;

import com.delta.mailverify.config.VerifierProperties;
import com.delta.mailverify.pipeline.handler.JobHandler;
import com.delta.mailverify.pipeline.model.JobResult;
import com.delta.mailverify.pipeline.model.PipelineJob;
import com.delta.mailverify.pipeline.persistence.JobQueueRepository;
import com.delta.mailverify.verify.util.FullJitterBackoff;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import java.lang.management.ManagementFactory;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Polls the job queues and runs claimed jobs through their handlers. Retries go back on the
 * queue with full-jitter backoff; the run is closed when its last job turns terminal.
 */
@Service
public class JobWorkerService {
    private static final Logger log = LoggerFactory.getLogger(JobWorkerService.class);
    static final Duration DEFER_DELAY = Duration.ofSeconds(15);
    static final String UNKNOWN_JOB_TYPE = "unknown_job_type";

    private final JobQueueRepository queueRepository;
    private final RunCompletionService runCompletionService;
    private final VerifierProperties properties;
    private final Map<String, JobHandler> handlers = new LinkedHashMap<>();
    private final AtomicBoolean running = new AtomicBoolean(false);
    private final Object lifecycleLock = new Object();
    private final String instanceId;

    private ExecutorService executor;
    private int activeWorkerCount;

    public JobWorkerService(
        JobQueueRepository queueRepository,
        RunCompletionService runCompletionService,
        List<JobHandler> handlers,
        VerifierProperties properties
    ) {
        this.queueRepository = queueRepository;
        this.runCompletionService = runCompletionService;
        this.properties = properties;
        for (JobHandler handler : handlers) {
            this.handlers.put(handler.jobType(), handler);
        }
        this.instanceId = "worker-" + ManagementFactory.getRuntimeMXBean().getName();
    }

    @PostConstruct
    public void startIfEnabled() {
        if (properties.getWorker().isEnabled()) {
            start();
        }
    }

    @PreDestroy
    public void stopOnShutdown() {
        stop();
    }

    public boolean isRunning() {
        return running.get();
    }

    public int getActiveWorkerCount() {
        return activeWorkerCount;
    }

    public void start() {
        synchronized (lifecycleLock) {
            if (running.get()) {
                return;
            }
            List<String> queues = properties.getWorker().getQueueNames();
            int perQueue = properties.getWorker().getWorkersPerQueue();
            int pollIntervalMs = properties.getWorker().getPollIntervalMs();
            long lockTtlSeconds = properties.getWorker().getLockTtlSeconds();
            int workerCount = queues.size() * perQueue;
            if (workerCount == 0) {
                log.warn("No worker queues configured; job worker not started");
                return;
            }
            activeWorkerCount = workerCount;
            executor = Executors.newFixedThreadPool(workerCount, runnable -> {
                Thread thread = new Thread(runnable);
                thread.setName("pipeline-worker");
                thread.setDaemon(true);
                return thread;
            });
            running.set(true);
            for (String queue : queues) {
                for (int i = 0; i < perQueue; i++) {
                    int workerIndex = i + 1;
                    executor.submit(() -> workerLoop(queue, workerIndex, pollIntervalMs, lockTtlSeconds));
                }
            }
            log.info("Job worker started: queues={} workersPerQueue={}", queues, perQueue);
        }
    }

    public void stop() {
        synchronized (lifecycleLock) {
            if (!running.get()) {
                return;
            }
            running.set(false);
            if (executor != null) {
                executor.shutdownNow();
                try {
                    executor.awaitTermination(5, TimeUnit.SECONDS);
                } catch (InterruptedException ignored) {
                    Thread.currentThread().interrupt();
                }
                executor = null;
            }
            activeWorkerCount = 0;
        }
    }

    /**
     * Claims and runs at most one job from the queue on the calling thread.
     *
     * @return true when a job was processed
     */
    public boolean runOnce(String queue) {
        Optional<PipelineJob> job = queueRepository.claimNext(queue, instanceId, properties.getWorker().getLockTtlSeconds());
        if (job.isEmpty()) {
            return false;
        }
        process(job.get());
        return true;
    }

    private void workerLoop(String queue, int workerIndex, int pollIntervalMs, long lockTtlSeconds) {
        Thread.currentThread().setName("pipeline-worker-" + queue + "-" + workerIndex);
        String owner = instanceId + "-" + queue + "-" + workerIndex;
        while (running.get() && !Thread.currentThread().isInterrupted()) {
            Optional<PipelineJob> job;
            try {
                job = queueRepository.claimNext(queue, owner, lockTtlSeconds);
            } catch (Exception e) {
                log.warn("Worker {}-{} failed to claim a job", queue, workerIndex, e);
                sleep(pollIntervalMs);
                continue;
            }
            if (job.isEmpty()) {
                sleep(pollIntervalMs);
                continue;
            }
            try {
                process(job.get());
            } catch (Exception e) {
                log.warn("Worker {}-{} failed while recording job {}", queue, workerIndex, job.get().id(), e);
            }
        }
    }

    void process(PipelineJob job) {
        JobHandler handler = handlers.get(job.jobType());
        JobResult result;
        if (handler == null) {
            result = JobResult.failure(UNKNOWN_JOB_TYPE + ": " + job.jobType());
        } else {
            try {
                result = handler.handle(job);
            } catch (Exception e) {
                log.warn("Job {} ({}) attempt {}/{} threw", job.id(), job.jobType(), job.attempts(), job.maxAttempts(), e);
                result = JobResult.retry("exception=" + e.getClass().getSimpleName() + ": " + e.getMessage());
            }
        }
        boolean terminal = record(job, result);
        if (terminal && job.runId() != null) {
            try {
                runCompletionService.completeIfFinished(job.runId());
            } catch (Exception e) {
                log.warn("Run completion check failed for run {}", job.runId(), e);
            }
        }
    }

    private boolean record(PipelineJob job, JobResult result) {
        switch (result.kind()) {
            case SUCCESS:
                queueRepository.markSucceeded(job.id());
                return true;
            case DEFER:
                queueRepository.defer(job.id(), Instant.now().plus(DEFER_DELAY), result.reason());
                return false;
            case RETRY:
                if (!job.isLastAttempt()) {
                    Duration delay = FullJitterBackoff.delay(
                        job.attempts(),
                        properties.getRetry().getBackoffBaseMs(),
                        properties.getRetry().getBackoffCapMs()
                    );
                    queueRepository.markRetry(job.id(), Instant.now().plus(delay), result.reason());
                    log.debug("Job {} retry in {} ms: {}", job.id(), delay.toMillis(), result.reason());
                    return false;
                }
                queueRepository.markFailed(job.id(), result.reason());
                return true;
            default:
                queueRepository.markFailed(job.id(), result.reason());
                log.info("Job {} ({}) failed: {}", job.id(), job.jobType(), result.reason());
                return true;
        }
    }

    private void sleep(int pollIntervalMs) {
        try {
            TimeUnit.MILLISECONDS.sleep(Math.max(50, pollIntervalMs));
        } catch (InterruptedException ignored) {
            Thread.currentThread().interrupt();
        }
    }
}
