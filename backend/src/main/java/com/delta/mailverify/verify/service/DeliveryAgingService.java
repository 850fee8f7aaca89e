package com.delta.mailverify.verify.service;

import com.delta.mailverify.config.VerifierProperties;
import com.delta.mailverify.verify.persistence.VerificationResultRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

/**
 * Resolves test-sends that never bounced: after the waiting window a {@code sent} row is
 * assumed delivered, then the affected domains are reclassified.
 */
@Service
public class DeliveryAgingService {
    private static final Logger log = LoggerFactory.getLogger(DeliveryAgingService.class);

    private final VerificationResultRepository resultRepository;
    private final CatchAllClassifier catchAllClassifier;
    private final VerifierProperties properties;

    public DeliveryAgingService(
        VerificationResultRepository resultRepository,
        CatchAllClassifier catchAllClassifier,
        VerifierProperties properties
    ) {
        this.resultRepository = resultRepository;
        this.catchAllClassifier = catchAllClassifier;
        this.properties = properties;
    }

    public int assumeDeliveredForStale(Instant now) {
        Duration window = Duration.ofHours(properties.getTestSend().getDeliveredAssumedHours());
        return assumeDeliveredForStale(now, window);
    }

    public int assumeDeliveredForStale(Instant now, Duration window) {
        Instant cutoff = now.minus(window);
        List<String> domains = resultRepository.findDomainsWithStaleSends(cutoff);
        if (domains.isEmpty()) {
            return 0;
        }
        int aged = resultRepository.assumeDeliveredBefore(cutoff);
        log.info("Assumed delivery for {} test-sends across {} domains", aged, domains.size());
        catchAllClassifier.reclassifyDomains(domains);
        return aged;
    }
}
