package com.delta.mailverify.verify.service;

import com.delta.mailverify.config.VerifierProperties;
import com.delta.mailverify.verify.model.DomainCatchAllStatus;
import com.delta.mailverify.verify.persistence.DomainEvidenceRepository;
import com.delta.mailverify.verify.persistence.DomainEvidenceRepository.CatchAllProbeRecord;
import com.delta.mailverify.verify.smtp.ProbeCategory;
import com.delta.mailverify.verify.smtp.ProbeOutcome;
import com.delta.mailverify.verify.smtp.SmtpProbe;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;
import java.util.HexFormat;
import java.util.Optional;
import java.util.concurrent.ThreadLocalRandom;

/**
 * Probes a random local-part at a domain's MX to tell whether it accepts any recipient.
 * Conclusive results are reused from {@code domain_catch_all} until the cache TTL runs out.
 */
@Service
public class DomainCatchAllProbeService {
    private static final Logger log = LoggerFactory.getLogger(DomainCatchAllProbeService.class);
    private static final String PROBE_PREFIX = "_ca_";

    private final SmtpProbe smtpProbe;
    private final DomainEvidenceRepository evidenceRepository;
    private final VerifierProperties properties;

    public DomainCatchAllProbeService(
        SmtpProbe smtpProbe,
        DomainEvidenceRepository evidenceRepository,
        VerifierProperties properties
    ) {
        this.smtpProbe = smtpProbe;
        this.evidenceRepository = evidenceRepository;
        this.properties = properties;
    }

    /**
     * @return the cached or freshly probed status, or empty when probing is off or the MX is
     * unreachable on port 25
     */
    public Optional<String> statusFor(String domain, String mxHost, boolean preflightPassed) {
        if (domain == null || domain.isBlank()) {
            return Optional.empty();
        }
        Instant now = Instant.now();
        Duration ttl = Duration.ofHours(properties.getCatchAll().getCacheTtlHours());
        Optional<CatchAllProbeRecord> cached = evidenceRepository.findCatchAllProbe(domain);
        if (cached.isPresent() && DomainCatchAllStatus.isConclusive(cached.get().status())
            && cached.get().checkedAt() != null
            && cached.get().checkedAt().isAfter(now.minus(ttl))) {
            return Optional.ofNullable(cached.get().status());
        }
        if (!properties.getCatchAll().isEnabled() || !preflightPassed) {
            return Optional.empty();
        }

        String localPart = randomLocalPart();
        if (mxHost == null || mxHost.isBlank()) {
            evidenceRepository.upsertCatchAllProbe(domain, DomainCatchAllStatus.NO_MX, null, null, localPart, now);
            return Optional.of(DomainCatchAllStatus.NO_MX);
        }
        ProbeOutcome outcome = smtpProbe.probe(localPart + "@" + domain, mxHost);
        String status = statusOf(outcome);
        evidenceRepository.upsertCatchAllProbe(domain, status, mxHost, outcome.code(), localPart, now);
        log.debug("Catch-all probe for {} via {} returned {} ({})", domain, mxHost, status, outcome.code());
        return Optional.of(status);
    }

    static String statusOf(ProbeOutcome outcome) {
        if (outcome.category() == ProbeCategory.ACCEPT) {
            return DomainCatchAllStatus.CATCH_ALL;
        }
        if (outcome.category() == ProbeCategory.HARD_FAIL) {
            return DomainCatchAllStatus.NOT_CATCH_ALL;
        }
        if (outcome.category() == ProbeCategory.TEMP_FAIL) {
            return DomainCatchAllStatus.TEMPFAIL;
        }
        return DomainCatchAllStatus.ERROR;
    }

    private static String randomLocalPart() {
        byte[] bytes = new byte[6];
        ThreadLocalRandom.current().nextBytes(bytes);
        return PROBE_PREFIX + HexFormat.of().formatHex(bytes);
    }
}
