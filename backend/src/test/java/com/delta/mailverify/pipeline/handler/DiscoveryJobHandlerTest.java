package com.delta.mailverify.pipeline.handler;

import com.delta.mailverify.pipeline.discovery.CompanyDiscovery;
import com.delta.mailverify.pipeline.discovery.DiscoveredPerson;
import com.delta.mailverify.pipeline.model.CompanyRecord;
import com.delta.mailverify.pipeline.model.JobResult;
import com.delta.mailverify.pipeline.model.JobStatus;
import com.delta.mailverify.pipeline.model.JobTypes;
import com.delta.mailverify.pipeline.model.PipelineJob;
import com.delta.mailverify.pipeline.persistence.PipelineRunRepository;
import com.delta.mailverify.verify.util.PatternCatalog;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class DiscoveryJobHandlerTest {
    @Mock
    private CompanyDiscovery companyDiscovery;
    @Mock
    private PipelineRunRepository runRepository;

    private DiscoveryJobHandler handler;

    @BeforeEach
    void setUp() {
        handler = new DiscoveryJobHandler(companyDiscovery, runRepository);
    }

    private static PipelineJob job(Long companyId) {
        return new PipelineJob(1L, JobTypes.QUEUE_CRAWL, JobTypes.DISCOVERY, Map.of(), null,
            JobStatus.RUNNING, 1, 3, "t1", 9L, companyId);
    }

    @Test
    void savesPeopleAndOnlyOnDomainAddresses() {
        CompanyRecord company = new CompanyRecord(4L, "t1", "Acme", "acme.com");
        when(runRepository.findCompany(4L)).thenReturn(Optional.of(company));
        when(companyDiscovery.discover(company)).thenReturn(List.of(
            new DiscoveredPerson("Jane Doe", "Jane", "Doe", "CEO", "https://acme.com/team",
                List.of("Jane.Doe@acme.com", "jane@gmail.com", "not-an-address")),
            new DiscoveredPerson("  ", null, null, null, null, List.of("x@acme.com"))
        ));
        when(runRepository.upsertPerson(4L, "Jane Doe", "Jane", "Doe", "CEO", "https://acme.com/team")).thenReturn(21L);
        when(runRepository.insertEmailIfAbsent(
            21L, 4L, 9L, "jane.doe@acme.com", "acme.com",
            PipelineRunRepository.SOURCE_CRAWL, "https://acme.com/team", PatternCatalog.FIRST_DOT_LAST
        )).thenReturn(new PipelineRunRepository.EmailInsert(31L, true));

        JobResult result = handler.handle(job(4L));

        assertEquals(JobResult.Kind.SUCCESS, result.kind());
        assertEquals(1, result.metrics().get("people"));
        assertEquals(1, result.metrics().get("emails"));
        verify(runRepository, times(1)).upsertPerson(anyLong(), anyString(), any(), any(), any(), any());
    }

    @Test
    void missingCompanyFails() {
        when(runRepository.findCompany(4L)).thenReturn(Optional.empty());

        JobResult result = handler.handle(job(4L));

        assertEquals(JobResult.Kind.FAILURE, result.kind());
        assertEquals("company_not_found", result.reason());
        verify(companyDiscovery, never()).discover(any());
    }

    @Test
    void jobWithoutCompanyFails() {
        assertEquals(JobResult.Kind.FAILURE, handler.handle(job(null)).kind());
        verifyNoInteractions(runRepository, companyDiscovery);
    }
}
