package com.delta.mailverify.verify.service;

import com.delta.mailverify.verify.fallback.FallbackResult;
import com.delta.mailverify.verify.fallback.FallbackVerifier;
import com.delta.mailverify.verify.gate.ProbeThrottle;
import com.delta.mailverify.verify.gate.ThrottlePermit;
import com.delta.mailverify.verify.model.DeadLetterRecord;
import com.delta.mailverify.verify.model.StatusDecision;
import com.delta.mailverify.verify.model.VerificationJob;
import com.delta.mailverify.verify.model.VerificationSignals;
import com.delta.mailverify.verify.model.VerificationUpsert;
import com.delta.mailverify.verify.model.VerifyStatus;
import com.delta.mailverify.verify.persistence.DeadLetterRepository;
import com.delta.mailverify.verify.persistence.VerificationResultRepository;
import com.delta.mailverify.verify.smtp.EmailAddress;
import com.delta.mailverify.verify.smtp.MxResolver;
import com.delta.mailverify.verify.smtp.ProbeCategory;
import com.delta.mailverify.verify.smtp.ProbeOutcome;
import com.delta.mailverify.verify.smtp.SmtpProbe;
import com.delta.mailverify.verify.smtp.Tcp25Preflight;
import com.delta.mailverify.verify.util.VerificationReasonCodes;
import com.delta.mailverify.verify.util.VerificationStatusClassifier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.PrintWriter;
import java.io.StringWriter;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * One verification attempt for one address: gate, probe, classify, persist, escalate.
 * Retryable conditions come back as {@link VerificationTaskResult#retry(String)}; the job
 * queue owns the backoff.
 */
@Service
public class VerificationTask {
    private static final Logger log = LoggerFactory.getLogger(VerificationTask.class);

    private final MxResolver mxResolver;
    private final Tcp25Preflight preflight;
    private final ProbeThrottle throttle;
    private final SmtpProbe smtpProbe;
    private final FallbackVerifier fallbackVerifier;
    private final DomainCatchAllProbeService catchAllProbeService;
    private final VerificationResultRepository resultRepository;
    private final DeadLetterRepository deadLetterRepository;
    private final TestSendEscalator escalator;

    public VerificationTask(
        MxResolver mxResolver,
        Tcp25Preflight preflight,
        ProbeThrottle throttle,
        SmtpProbe smtpProbe,
        FallbackVerifier fallbackVerifier,
        DomainCatchAllProbeService catchAllProbeService,
        VerificationResultRepository resultRepository,
        DeadLetterRepository deadLetterRepository,
        TestSendEscalator escalator
    ) {
        this.mxResolver = mxResolver;
        this.preflight = preflight;
        this.throttle = throttle;
        this.smtpProbe = smtpProbe;
        this.fallbackVerifier = fallbackVerifier;
        this.catchAllProbeService = catchAllProbeService;
        this.resultRepository = resultRepository;
        this.deadLetterRepository = deadLetterRepository;
        this.escalator = escalator;
    }

    public VerificationTaskResult execute(VerificationJob job, Long jobId, String queue, int attempt, int maxAttempts) {
        String mxHost = null;
        try {
            Optional<EmailAddress> address = EmailAddress.parse(job.email());
            if (address.isEmpty()) {
                log.debug("Skipping malformed address {}", job.email());
                return VerificationTaskResult.badInput(VerificationReasonCodes.BAD_INPUT);
            }
            String email = address.get().address();
            String domain = address.get().domain();
            mxHost = mxResolver.resolve(domain);

            boolean reachable = preflight.isReachable(mxHost);
            if (!reachable && !job.force()) {
                long resultId = resultRepository.upsertResult(new VerificationUpsert(
                    job.emailId(), email, domain, mxHost,
                    null, null, VerificationReasonCodes.TCP25_BLOCKED,
                    VerifyStatus.UNKNOWN_TIMEOUT, VerificationReasonCodes.TCP25_BLOCKED,
                    null, null, null, Instant.now()
                ));
                return VerificationTaskResult.completed(resultId, VerifyStatus.UNKNOWN_TIMEOUT, VerificationReasonCodes.TCP25_BLOCKED);
            }

            ProbeOutcome outcome;
            String catchAllStatus = null;
            // a catch-all cache miss opens a second session to the same MX
            try (ThrottlePermit permit = throttle.acquire(mxHost)) {
                if (!permit.granted()) {
                    log.debug("Probe of {} throttled: {}", email, permit.denialReason());
                    return VerificationTaskResult.retry(permit.denialReason());
                }
                outcome = smtpProbe.probe(email, mxHost);
                if (outcome.category() == ProbeCategory.ACCEPT) {
                    catchAllStatus = catchAllProbeService.statusFor(domain, mxHost, reachable).orElse(null);
                }
            }
            resultRepository.insertAttempt(jobId, email, domain, attempt, outcome);

            if (outcome.category() == ProbeCategory.TEMP_FAIL && attempt < maxAttempts) {
                return VerificationTaskResult.retry(describe(outcome));
            }

            FallbackResult fallback = null;
            if (outcome.category() == ProbeCategory.UNKNOWN || outcome.category() == ProbeCategory.TEMP_FAIL) {
                fallback = consultFallback(email);
            }

            Instant now = Instant.now();
            StatusDecision decision = VerificationStatusClassifier.classify(
                new VerificationSignals(
                    outcome.category(),
                    outcome.code(),
                    catchAllStatus,
                    fallback == null ? null : fallback.status(),
                    mxHost,
                    now
                ),
                now
            );
            long resultId = resultRepository.upsertResult(new VerificationUpsert(
                job.emailId(),
                email,
                domain,
                mxHost,
                outcome.category().value(),
                outcome.code(),
                outcome.error(),
                decision.verifyStatus(),
                decision.verifyReason(),
                catchAllStatus,
                fallback == null ? null : fallback.status(),
                fallback == null ? null : fallback.raw(),
                now
            ));

            if (VerifyStatus.isAmbiguous(decision.verifyStatus())) {
                escalator.escalateAmbiguous(resultId);
            }
            return VerificationTaskResult.completed(resultId, decision.verifyStatus(), decision.verifyReason());
        } catch (RuntimeException e) {
            if (attempt >= maxAttempts) {
                recordDeadLetter(job, jobId, queue, attempt, mxHost, e);
            }
            throw e;
        }
    }

    private FallbackResult consultFallback(String email) {
        try {
            FallbackResult result = fallbackVerifier.verify(email);
            return result == null ? FallbackResult.unknown("no_result") : result;
        } catch (RuntimeException e) {
            log.warn("Fallback verifier failed for {}", email, e);
            return FallbackResult.unknown(e.getClass().getSimpleName());
        }
    }

    private void recordDeadLetter(VerificationJob job, Long jobId, String queue, int attempt, String mxHost, RuntimeException e) {
        Map<String, Object> meta = new LinkedHashMap<>();
        meta.put("email_id", job.emailId());
        meta.put("domain", job.domain());
        meta.put("person_id", job.personId());
        meta.put("force", job.force());
        StringWriter trace = new StringWriter();
        e.printStackTrace(new PrintWriter(trace));
        try {
            deadLetterRepository.insert(new DeadLetterRecord(
                null,
                jobId,
                queue,
                attempt,
                job.email(),
                mxHost,
                e.getClass().getName(),
                e.getMessage(),
                trace.toString(),
                meta,
                Instant.now()
            ));
        } catch (RuntimeException deadLetterFailure) {
            log.warn("Failed to record dead letter for job {}", jobId, deadLetterFailure);
        }
    }

    private static String describe(ProbeOutcome outcome) {
        if (outcome.error() != null) {
            return outcome.error();
        }
        return outcome.code() == null ? "temp_fail" : "smtp_" + outcome.code();
    }
}
