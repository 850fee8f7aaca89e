package com.delta.mailverify.pipeline.service;

import com.delta.mailverify.config.VerifierProperties;
import com.delta.mailverify.verify.bounce.BounceImportService;
import com.delta.mailverify.verify.persistence.DeadLetterRepository;
import com.delta.mailverify.verify.service.CatchAllClassifier;
import com.delta.mailverify.verify.service.DeliveryAgingService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Periodic upkeep that runs alongside the job workers: drain bounces, age unanswered
 * test-sends, reclassify domains, trim the dead-letter stream.
 */
@Service
public class MaintenanceScheduler {
    private static final Logger log = LoggerFactory.getLogger(MaintenanceScheduler.class);

    private final BounceImportService bounceImportService;
    private final DeliveryAgingService deliveryAgingService;
    private final CatchAllClassifier catchAllClassifier;
    private final DeadLetterRepository deadLetterRepository;
    private final VerifierProperties properties;
    private final Object lifecycleLock = new Object();

    private ScheduledExecutorService scheduler;

    public MaintenanceScheduler(
        BounceImportService bounceImportService,
        DeliveryAgingService deliveryAgingService,
        CatchAllClassifier catchAllClassifier,
        DeadLetterRepository deadLetterRepository,
        VerifierProperties properties
    ) {
        this.bounceImportService = bounceImportService;
        this.deliveryAgingService = deliveryAgingService;
        this.catchAllClassifier = catchAllClassifier;
        this.deadLetterRepository = deadLetterRepository;
        this.properties = properties;
    }

    @PostConstruct
    public void startIfEnabled() {
        if (!properties.getWorker().isEnabled()) {
            return;
        }
        synchronized (lifecycleLock) {
            int interval = properties.getWorker().getMaintenanceIntervalSeconds();
            scheduler = Executors.newSingleThreadScheduledExecutor(runnable -> {
                Thread thread = new Thread(runnable);
                thread.setName("pipeline-maintenance");
                thread.setDaemon(true);
                return thread;
            });
            scheduler.scheduleWithFixedDelay(this::runSafely, interval, interval, TimeUnit.SECONDS);
        }
    }

    @PreDestroy
    public void stop() {
        synchronized (lifecycleLock) {
            if (scheduler != null) {
                scheduler.shutdownNow();
                scheduler = null;
            }
        }
    }

    private void runSafely() {
        try {
            runOnce(Instant.now());
        } catch (Exception e) {
            log.warn("Maintenance pass failed", e);
        }
    }

    /**
     * One maintenance pass. Each step is independent; a failing step does not stop the rest.
     */
    public Map<String, Object> runOnce(Instant now) {
        Map<String, Object> summary = new LinkedHashMap<>();
        if (properties.getBounce().isDrainEnabled()) {
            try {
                summary.put("bounces_imported", bounceImportService.drain(properties.getBounce().getDrainBatch()));
            } catch (RuntimeException e) {
                log.warn("Bounce drain failed", e);
            }
        }
        try {
            summary.put("delivered_assumed", deliveryAgingService.assumeDeliveredForStale(now));
        } catch (RuntimeException e) {
            log.warn("Delivery aging failed", e);
        }
        try {
            summary.put("domains_reclassified", catchAllClassifier.reclassifyAll().size());
        } catch (RuntimeException e) {
            log.warn("Domain reclassification failed", e);
        }
        try {
            summary.put("dead_letters_trimmed", deadLetterRepository.trim(properties.getDeadLetter().getRetention()));
        } catch (RuntimeException e) {
            log.warn("Dead-letter trim failed", e);
        }
        log.debug("Maintenance pass: {}", summary);
        return summary;
    }
}
