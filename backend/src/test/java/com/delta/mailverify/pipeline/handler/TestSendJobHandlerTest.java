package com.delta.mailverify.pipeline.handler;

import com.delta.mailverify.pipeline.model.JobResult;
import com.delta.mailverify.pipeline.model.JobStatus;
import com.delta.mailverify.pipeline.model.JobTypes;
import com.delta.mailverify.pipeline.model.PipelineJob;
import com.delta.mailverify.pipeline.service.PipelineJobScheduler;
import com.delta.mailverify.verify.model.TestSendStatus;
import com.delta.mailverify.verify.model.VerificationResultRow;
import com.delta.mailverify.verify.model.VerifyStatus;
import com.delta.mailverify.verify.persistence.VerificationResultRepository;
import com.delta.mailverify.verify.service.TestSendMailer;
import com.delta.mailverify.verify.service.TestSendMessage;
import com.delta.mailverify.verify.service.TestSendService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Instant;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class TestSendJobHandlerTest {
    @Mock
    private VerificationResultRepository resultRepository;
    @Mock
    private TestSendService testSendService;
    @Mock
    private TestSendMailer mailer;

    private TestSendJobHandler handler;

    @BeforeEach
    void setUp() {
        handler = new TestSendJobHandler(resultRepository, testSendService, mailer);
    }

    private static PipelineJob job(String token) {
        return new PipelineJob(12L, JobTypes.QUEUE_TEST_SEND, JobTypes.TEST_SEND,
            Map.of(PipelineJobScheduler.RESULT_ID, 77, PipelineJobScheduler.TOKEN, token),
            null, JobStatus.RUNNING, 1, 3, null, null, null);
    }

    private static VerificationResultRow row(String testSendStatus, String token) {
        return new VerificationResultRow(
            77L, 31L, "b.anderson@acme.com", "acme.com", "mx.acme.com", "accept", 250,
            VerifyStatus.RISKY_CATCH_ALL, "catch_all", "catch_all", null,
            testSendStatus, token, null, null, null, Instant.now(), Instant.now()
        );
    }

    @Test
    void pendingRowIsSentAndMarked() {
        VerificationResultRow pending = row(TestSendStatus.PENDING, "vr77-abc");
        TestSendMessage message = new TestSendMessage(77L, "b.anderson@acme.com", "bounce+vr77-abc@verifier.example.com", "vr77-abc", "hello");
        when(resultRepository.findById(77L)).thenReturn(Optional.of(pending));
        when(testSendService.messageFor(pending)).thenReturn(message);

        JobResult result = handler.handle(job("vr77-abc"));

        assertEquals(JobResult.Kind.SUCCESS, result.kind());
        verify(mailer).send(message);
        verify(testSendService).markSent(eq(77L), any(Instant.class));
    }

    @Test
    void rowThatMovedOnIsSkipped() {
        when(resultRepository.findById(77L)).thenReturn(Optional.of(row(TestSendStatus.SENT, "vr77-abc")));

        JobResult result = handler.handle(job("vr77-abc"));

        assertEquals(TestSendStatus.SENT, result.metrics().get("skipped"));
        verifyNoInteractions(mailer);
    }

    @Test
    void staleTokenIsSkipped() {
        when(resultRepository.findById(77L)).thenReturn(Optional.of(row(TestSendStatus.PENDING, "vr77-new")));

        JobResult result = handler.handle(job("vr77-old"));

        assertEquals("token_mismatch", result.metrics().get("skipped"));
        verifyNoInteractions(mailer);
        verify(testSendService, never()).markSent(anyLong(), any());
    }

    @Test
    void missingRowFails() {
        when(resultRepository.findById(77L)).thenReturn(Optional.empty());

        assertEquals(JobResult.Kind.FAILURE, handler.handle(job("vr77-abc")).kind());
    }
}
