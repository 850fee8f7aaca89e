package com.delta.mailverify.pipeline.service;

import com.delta.mailverify.config.VerifierProperties;
import com.delta.mailverify.pipeline.model.DomainLimitInfo;
import com.delta.mailverify.pipeline.persistence.PipelineRunRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class DomainLimitServiceTest {
    @Mock
    private PipelineRunRepository runRepository;

    private VerifierProperties properties;
    private DomainLimitService service;

    @BeforeEach
    void setUp() {
        properties = new VerifierProperties();
        properties.getPipeline().setDefaultCompanyLimit(3);
        properties.getPipeline().setHardCompanyLimit24h(10);
        service = new DomainLimitService(runRepository, properties);
    }

    @Test
    void perRunCapTrimsInOrder() {
        when(runRepository.findActivityMetadata(eq("t1"), eq(DomainLimitService.RUN_STARTED_ACTION), any(), eq(7L)))
            .thenReturn(List.of());
        when(runRepository.findRecentRunDomains(eq("t1"), any(), eq(7L))).thenReturn(List.of());

        DomainLimitInfo info = service.apply("t1", 7L, List.of("a.com", "b.com", "c.com", "d.com"), null);

        assertThat(info.effectiveDomains()).containsExactly("a.com", "b.com", "c.com");
        assertTrue(info.companyLimitApplied());
        assertFalse(info.hardLimitApplied());
        assertEquals("runs", info.usedMethod());
        assertEquals(4, info.originalCount());
    }

    @Test
    void activityLogCountsTowardRollingCap() {
        when(runRepository.findActivityMetadata(eq("t1"), eq(DomainLimitService.RUN_STARTED_ACTION), any(), eq(7L)))
            .thenReturn(List.of(Map.of("domains_count", 5), Map.of("effective_domain_count", "3")));

        DomainLimitInfo info = service.apply("t1", 7L, List.of("a.com", "b.com", "c.com"), 50);

        assertEquals(8, info.usedLast24h());
        assertEquals(2, info.remaining24h());
        assertTrue(info.hardLimitApplied());
        assertThat(info.effectiveDomains()).containsExactly("a.com", "b.com");
        assertEquals("user_activity", info.usedMethod());
    }

    @Test
    void exhaustedQuotaIsRejected() {
        when(runRepository.findActivityMetadata(eq("t1"), eq(DomainLimitService.RUN_STARTED_ACTION), any(), eq(7L)))
            .thenReturn(List.of(Map.of("domains_count", 10)));

        assertThatThrownBy(() -> service.apply("t1", 7L, List.of("a.com"), null))
            .isInstanceOf(TenantQuotaExceededException.class)
            .hasMessageContaining("limit=10")
            .hasMessageContaining("used=10");
    }

    @Test
    void fallsBackToRunHistoryWhenNoActivity() {
        when(runRepository.findActivityMetadata(eq("t1"), eq(DomainLimitService.RUN_STARTED_ACTION), any(), eq(null)))
            .thenReturn(List.of());
        when(runRepository.findRecentRunDomains(eq("t1"), any(), eq(null)))
            .thenReturn(List.of(List.of("x.com", "y.com"), List.of("z.com")));

        DomainLimitInfo info = service.apply("t1", null, List.of("a.com"), null);

        assertEquals(3, info.usedLast24h());
        assertEquals(7, info.remaining24h());
    }

    @Test
    void domainCountIgnoresGarbage() {
        assertEquals(0, DomainLimitService.domainCountOf(Map.of("domains_count", "many")));
        assertEquals(0, DomainLimitService.domainCountOf(Map.of()));
        assertEquals(4, DomainLimitService.domainCountOf(Map.of("domains_count", 4L)));
    }
}
