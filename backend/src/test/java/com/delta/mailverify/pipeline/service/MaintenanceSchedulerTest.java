package com.delta.mailverify.pipeline.service;

import com.delta.mailverify.config.VerifierProperties;
import com.delta.mailverify.verify.bounce.BounceImportService;
import com.delta.mailverify.verify.persistence.DeadLetterRepository;
import com.delta.mailverify.verify.service.CatchAllClassifier;
import com.delta.mailverify.verify.service.CatchAllClassifier.ReclassifyResult;
import com.delta.mailverify.verify.service.DeliveryAgingService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class MaintenanceSchedulerTest {
    @Mock
    private BounceImportService bounceImportService;
    @Mock
    private DeliveryAgingService deliveryAgingService;
    @Mock
    private CatchAllClassifier catchAllClassifier;
    @Mock
    private DeadLetterRepository deadLetterRepository;

    private VerifierProperties properties;
    private MaintenanceScheduler scheduler;

    @BeforeEach
    void setUp() {
        properties = new VerifierProperties();
        scheduler = new MaintenanceScheduler(
            bounceImportService, deliveryAgingService, catchAllClassifier, deadLetterRepository, properties
        );
    }

    @Test
    void failingStepDoesNotStopTheRest() {
        Instant now = Instant.now();
        when(deliveryAgingService.assumeDeliveredForStale(now)).thenThrow(new IllegalStateException("db hiccup"));
        when(catchAllClassifier.reclassifyAll()).thenReturn(List.of(new ReclassifyResult("acme.com", "not_catch_all", 1)));
        when(deadLetterRepository.trim(anyInt())).thenReturn(3);

        Map<String, Object> summary = scheduler.runOnce(now);

        assertThat(summary).doesNotContainKey("delivered_assumed");
        assertThat(summary).containsEntry("domains_reclassified", 1).containsEntry("dead_letters_trimmed", 3);
        verifyNoInteractions(bounceImportService);
    }

    @Test
    void drainRunsWhenEnabled() {
        properties.getBounce().setDrainEnabled(true);
        properties.getBounce().setDrainBatch(25);
        Instant now = Instant.now();
        when(bounceImportService.drain(25)).thenReturn(2);

        Map<String, Object> summary = scheduler.runOnce(now);

        assertThat(summary).containsEntry("bounces_imported", 2);
        verify(deadLetterRepository).trim(1000);
    }
}
