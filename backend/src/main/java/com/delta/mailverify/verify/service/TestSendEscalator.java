package com.delta.mailverify.verify.service;

import com.delta.mailverify.config.VerifierProperties;
import com.delta.mailverify.verify.model.EscalationCandidate;
import com.delta.mailverify.verify.model.PersonIdentity;
import com.delta.mailverify.verify.model.TestSendStatus;
import com.delta.mailverify.verify.model.VerificationResultRow;
import com.delta.mailverify.verify.model.VerifyStatus;
import com.delta.mailverify.verify.persistence.VerificationResultRepository;
import com.delta.mailverify.verify.util.PatternCatalog;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * Walks a person's candidate addresses one test-send at a time. Only one address per
 * person and domain may be outstanding; each step re-reads row state before acting.
 */
@Service
public class TestSendEscalator {
    private static final Logger log = LoggerFactory.getLogger(TestSendEscalator.class);

    private final VerificationResultRepository resultRepository;
    private final TestSendService testSendService;
    private final TestSendDispatcher dispatcher;
    private final VerifierProperties properties;

    public TestSendEscalator(
        VerificationResultRepository resultRepository,
        TestSendService testSendService,
        TestSendDispatcher dispatcher,
        VerifierProperties properties
    ) {
        this.resultRepository = resultRepository;
        this.testSendService = testSendService;
        this.dispatcher = dispatcher;
        this.properties = properties;
    }

    record RankedCandidate(EscalationCandidate candidate, String pattern) {}

    public Optional<EscalationCandidate> chooseNextCandidate(long bouncedResultId) {
        Optional<PersonIdentity> person = resultRepository.findPersonForResult(bouncedResultId);
        if (person.isEmpty()) {
            return Optional.empty();
        }
        List<EscalationCandidate> candidates =
            resultRepository.findCandidatesForPerson(person.get().personId(), person.get().domain());
        return rank(person.get(), candidates, bouncedResultId);
    }

    static Optional<EscalationCandidate> rank(
        PersonIdentity person,
        List<EscalationCandidate> candidates,
        long excludeResultId
    ) {
        String[] names = nameParts(person);
        Comparator<RankedCandidate> order = PatternCatalog.byPriority(
            RankedCandidate::pattern,
            ranked -> ranked.candidate().localPart()
        );
        return candidates.stream()
            .filter(candidate -> candidate.resultId() != excludeResultId)
            .filter(candidate -> TestSendStatus.isUntried(candidate.testSendStatus()))
            .filter(candidate -> VerifyStatus.isAmbiguous(candidate.verifyStatus()))
            .map(candidate -> new RankedCandidate(
                candidate,
                PatternCatalog.infer(candidate.localPart(), names[0], names[1]).orElse(null)
            ))
            .min(order)
            .map(RankedCandidate::candidate);
    }

    /**
     * Picks the next candidate after a hard bounce and starts its test-send.
     */
    public Optional<EscalationCandidate> escalateAfterHardBounce(long bouncedResultId) {
        if (!properties.getTestSend().isAutoEscalate()) {
            return Optional.empty();
        }
        Optional<PersonIdentity> person = resultRepository.findPersonForResult(bouncedResultId);
        if (person.isEmpty()) {
            log.debug("Result {} has no person; escalation skipped", bouncedResultId);
            return Optional.empty();
        }
        if (resultRepository.hasOutstandingTestSend(person.get().personId(), person.get().domain())) {
            log.debug("Person {} already has an outstanding test-send at {}", person.get().personId(), person.get().domain());
            return Optional.empty();
        }
        Optional<EscalationCandidate> next = chooseNextCandidate(bouncedResultId);
        if (next.isEmpty()) {
            log.info("Escalation exhausted for person {} at {}", person.get().personId(), person.get().domain());
            return Optional.empty();
        }
        return start(next.get().resultId()) ? next : Optional.empty();
    }

    /**
     * Starts a test-send for an ambiguous row that has never been test-sent, unless the person
     * already has one outstanding at the domain.
     */
    public boolean escalateAmbiguous(long resultId) {
        if (!properties.getTestSend().isAutoEscalate()) {
            return false;
        }
        Optional<VerificationResultRow> row = resultRepository.findById(resultId);
        if (row.isEmpty()
            || !VerifyStatus.isAmbiguous(row.get().verifyStatus())
            || !TestSendStatus.isUntried(row.get().testSendStatus())) {
            return false;
        }
        Optional<PersonIdentity> person = resultRepository.findPersonForResult(resultId);
        if (person.isPresent()
            && resultRepository.hasOutstandingTestSend(person.get().personId(), person.get().domain())) {
            return false;
        }
        return start(resultId);
    }

    private boolean start(long resultId) {
        Optional<String> token = testSendService.requestTestSend(resultId);
        if (token.isEmpty()) {
            return false;
        }
        dispatcher.dispatch(resultId, token.get());
        log.info("Escalated test-send to result {}", resultId);
        return true;
    }

    static String[] nameParts(PersonIdentity person) {
        String first = person.firstName();
        String last = person.lastName();
        if ((first == null || first.isBlank() || last == null || last.isBlank()) && person.fullName() != null) {
            String[] tokens = person.fullName().trim().split("\\s+");
            if (first == null || first.isBlank()) {
                first = tokens[0];
            }
            if ((last == null || last.isBlank()) && tokens.length > 1) {
                last = tokens[tokens.length - 1];
            }
        }
        return new String[] {first, last};
    }
}
