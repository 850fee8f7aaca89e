package com.delta.mailverify.verify.service;

import com.delta.mailverify.verify.model.CatchAllProofStatus;
import com.delta.mailverify.verify.model.DeliveryEvidence;
import com.delta.mailverify.verify.model.TestSendStatus;
import com.delta.mailverify.verify.model.VerificationResultRow;
import com.delta.mailverify.verify.model.VerifyStatus;
import com.delta.mailverify.verify.persistence.DomainEvidenceRepository;
import com.delta.mailverify.verify.persistence.VerificationResultRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.List;

/**
 * Decides whether bounce evidence proves a domain is not catch-all, and upgrades the
 * risky rows that evidence vouches for.
 */
@Service
public class CatchAllClassifier {
    private static final Logger log = LoggerFactory.getLogger(CatchAllClassifier.class);

    private final DeliveryEvidenceStore evidenceStore;
    private final DomainEvidenceRepository evidenceRepository;
    private final VerificationResultRepository resultRepository;

    public CatchAllClassifier(
        DeliveryEvidenceStore evidenceStore,
        DomainEvidenceRepository evidenceRepository,
        VerificationResultRepository resultRepository
    ) {
        this.evidenceStore = evidenceStore;
        this.evidenceRepository = evidenceRepository;
        this.resultRepository = resultRepository;
    }

    public record ReclassifyResult(String domain, String status, int upgraded) {}

    public static String classify(DeliveryEvidence evidence) {
        if (evidence != null && evidence.hasGoodReal() && evidence.hasBadInvalid()) {
            return CatchAllProofStatus.NOT_CATCHALL_PROVEN;
        }
        return CatchAllProofStatus.UNKNOWN;
    }

    public static boolean shouldUpgradeRiskyToValid(VerificationResultRow row, String domainStatus) {
        if (row == null) {
            return false;
        }
        return VerifyStatus.RISKY_CATCH_ALL.equals(row.verifyStatus())
            && CatchAllProofStatus.NOT_CATCHALL_PROVEN.equals(domainStatus)
            && TestSendStatus.isDelivered(row.testSendStatus())
            && !DeliveryEvidenceStore.isUserUnknownHardBounce(row.bounceCode(), row.bounceReason());
    }

    public ReclassifyResult reclassifyDomain(String domain) {
        DeliveryEvidence evidence = evidenceStore.evidenceFor(domain);
        String status = classify(evidence);
        evidenceRepository.saveDeliveryEvidence(evidence, status, Instant.now());

        int upgraded = 0;
        if (CatchAllProofStatus.NOT_CATCHALL_PROVEN.equals(status)) {
            for (VerificationResultRow row : resultRepository.findByDomain(domain)) {
                if (shouldUpgradeRiskyToValid(row, status)) {
                    upgraded += resultRepository.upgradeRiskyToValid(row.id());
                }
            }
        }
        if (upgraded > 0) {
            log.info("Domain {} is {}; upgraded {} risky rows to valid", domain, status, upgraded);
        } else {
            log.debug("Domain {} reclassified as {}", domain, status);
        }
        return new ReclassifyResult(domain, status, upgraded);
    }

    public List<ReclassifyResult> reclassifyAll() {
        List<String> domains = resultRepository.findDomainsWithTestSendActivity();
        return reclassifyDomains(domains);
    }

    public List<ReclassifyResult> reclassifyDomains(List<String> domains) {
        return domains.stream()
            .map(this::reclassifyQuietly)
            .filter(result -> result != null)
            .toList();
    }

    private ReclassifyResult reclassifyQuietly(String domain) {
        try {
            return reclassifyDomain(domain);
        } catch (RuntimeException e) {
            log.warn("Failed to reclassify domain {}", domain, e);
            return null;
        }
    }
}
