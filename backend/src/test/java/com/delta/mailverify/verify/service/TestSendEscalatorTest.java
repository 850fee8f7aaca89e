package com.delta.mailverify.verify.service;

import com.delta.mailverify.config.VerifierProperties;
import com.delta.mailverify.verify.model.EscalationCandidate;
import com.delta.mailverify.verify.model.PersonIdentity;
import com.delta.mailverify.verify.model.TestSendStatus;
import com.delta.mailverify.verify.model.VerificationResultRow;
import com.delta.mailverify.verify.model.VerifyStatus;
import com.delta.mailverify.verify.persistence.VerificationResultRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class TestSendEscalatorTest {
    private static final PersonIdentity BRETT = new PersonIdentity(42L, "Brett", "Anderson", "Brett Anderson", "acme.example");

    @Mock
    private VerificationResultRepository resultRepository;
    @Mock
    private TestSendService testSendService;
    @Mock
    private TestSendDispatcher dispatcher;

    private VerifierProperties properties;
    private TestSendEscalator escalator;

    @BeforeEach
    void setUp() {
        properties = new VerifierProperties();
        escalator = new TestSendEscalator(resultRepository, testSendService, dispatcher, properties);
    }

    private static EscalationCandidate candidate(long id, String localPart, String verifyStatus, String testSendStatus) {
        return new EscalationCandidate(id, id + 100, localPart + "@acme.example", verifyStatus, testSendStatus);
    }

    private List<EscalationCandidate> brettCandidates() {
        return List.of(
            candidate(1L, "brett.anderson", VerifyStatus.INVALID, TestSendStatus.BOUNCE_HARD),
            candidate(2L, "brett", VerifyStatus.UNKNOWN_TIMEOUT, TestSendStatus.NOT_REQUESTED),
            candidate(3L, "banderson", VerifyStatus.RISKY_CATCH_ALL, TestSendStatus.NOT_REQUESTED),
            candidate(4L, "b.anderson", VerifyStatus.VALID, TestSendStatus.NOT_REQUESTED),
            candidate(5L, "brettanderson", VerifyStatus.RISKY_CATCH_ALL, TestSendStatus.SENT),
            candidate(6L, "anderson", VerifyStatus.RISKY_CATCH_ALL, null)
        );
    }

    @Test
    void ranksUntriedAmbiguousCandidatesByPatternPriority() {
        Optional<EscalationCandidate> next = TestSendEscalator.rank(BRETT, brettCandidates(), 1L);

        assertEquals(3L, next.orElseThrow().resultId());
    }

    @Test
    void unknownPatternsSortAfterKnownOnesThenByLocalPart() {
        List<EscalationCandidate> candidates = List.of(
            candidate(7L, "zz-odd", VerifyStatus.RISKY_CATCH_ALL, TestSendStatus.NOT_REQUESTED),
            candidate(8L, "aa-odd", VerifyStatus.RISKY_CATCH_ALL, TestSendStatus.NOT_REQUESTED),
            candidate(9L, "anderson", VerifyStatus.RISKY_CATCH_ALL, TestSendStatus.NOT_REQUESTED)
        );

        assertEquals(9L, TestSendEscalator.rank(BRETT, candidates, 0L).orElseThrow().resultId());
        assertEquals(
            8L,
            TestSendEscalator.rank(BRETT, candidates.subList(0, 2), 0L).orElseThrow().resultId()
        );
    }

    @Test
    void exhaustedCandidatesYieldEmpty() {
        List<EscalationCandidate> candidates = List.of(
            candidate(1L, "brett.anderson", VerifyStatus.INVALID, TestSendStatus.BOUNCE_HARD),
            candidate(4L, "b.anderson", VerifyStatus.VALID, TestSendStatus.NOT_REQUESTED)
        );

        assertThat(TestSendEscalator.rank(BRETT, candidates, 1L)).isEmpty();
    }

    @Test
    void namePartsFallBackToFullName() {
        String[] parts = TestSendEscalator.nameParts(new PersonIdentity(1L, null, " ", "Mary Jane Watson", "d.example"));

        assertEquals("Mary", parts[0]);
        assertEquals("Watson", parts[1]);
    }

    @Test
    void hardBounceStartsNextCandidateAndDispatches() {
        when(resultRepository.findPersonForResult(1L)).thenReturn(Optional.of(BRETT));
        when(resultRepository.hasOutstandingTestSend(42L, "acme.example")).thenReturn(false);
        when(resultRepository.findCandidatesForPerson(42L, "acme.example")).thenReturn(brettCandidates());
        when(testSendService.requestTestSend(3L)).thenReturn(Optional.of("tok-3"));

        Optional<EscalationCandidate> next = escalator.escalateAfterHardBounce(1L);

        assertEquals(3L, next.orElseThrow().resultId());
        verify(dispatcher).dispatch(3L, "tok-3");
    }

    @Test
    void outstandingTestSendBlocksEscalation() {
        when(resultRepository.findPersonForResult(1L)).thenReturn(Optional.of(BRETT));
        when(resultRepository.hasOutstandingTestSend(42L, "acme.example")).thenReturn(true);

        assertThat(escalator.escalateAfterHardBounce(1L)).isEmpty();
        verify(testSendService, never()).requestTestSend(anyLong());
    }

    @Test
    void disabledAutoEscalationDoesNothing() {
        properties.getTestSend().setAutoEscalate(false);

        assertThat(escalator.escalateAfterHardBounce(1L)).isEmpty();
        assertFalse(escalator.escalateAmbiguous(1L));
        verify(dispatcher, never()).dispatch(anyLong(), anyString());
    }

    @Test
    void lostRaceOnRequestDoesNotDispatch() {
        when(resultRepository.findPersonForResult(1L)).thenReturn(Optional.of(BRETT));
        when(resultRepository.hasOutstandingTestSend(42L, "acme.example")).thenReturn(false);
        when(resultRepository.findCandidatesForPerson(42L, "acme.example")).thenReturn(brettCandidates());
        when(testSendService.requestTestSend(3L)).thenReturn(Optional.empty());

        assertThat(escalator.escalateAfterHardBounce(1L)).isEmpty();
        verify(dispatcher, never()).dispatch(anyLong(), anyString());
    }

    @Test
    void ambiguousRowWithoutPersonIsEscalated() {
        when(resultRepository.findById(5L)).thenReturn(Optional.of(new VerificationResultRow(
            5L, null, "x@acme.example", "acme.example", null, "accept", 250,
            VerifyStatus.RISKY_CATCH_ALL, "rcpt_2xx_catchall", "catch_all", null,
            TestSendStatus.NOT_REQUESTED, null, null, null, null, null, null
        )));
        when(resultRepository.findPersonForResult(5L)).thenReturn(Optional.empty());
        when(testSendService.requestTestSend(5L)).thenReturn(Optional.of("tok-5"));

        assertTrue(escalator.escalateAmbiguous(5L));
        verify(dispatcher).dispatch(5L, "tok-5");
    }
}
