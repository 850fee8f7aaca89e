package com.delta.mailverify.api;

import com.delta.mailverify.pipeline.persistence.PipelineRunRepository;
import com.delta.mailverify.pipeline.service.DomainLimitService;
import com.delta.mailverify.verify.model.DeadLetterRecord;
import com.delta.mailverify.verify.persistence.DeadLetterRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.web.context.WebApplicationContext;

import java.time.Instant;
import java.util.Map;
import java.util.UUID;

import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.hasSize;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@SpringBootTest
@ActiveProfiles("test")
@Transactional
class PipelineApiTest {

    @Autowired
    private WebApplicationContext context;

    @Autowired
    private PipelineRunRepository runRepository;

    @Autowired
    private DeadLetterRepository deadLetterRepository;

    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        this.mockMvc = MockMvcBuilders.webAppContextSetup(context).build();
    }

    @Test
    void startRunReturnsTheRunningRun() throws Exception {
        String tenant = "api-" + UUID.randomUUID();
        String domain = "api-" + UUID.randomUUID().toString().substring(0, 8) + ".example";
        mockMvc.perform(post("/api/pipeline/runs")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"tenantId\":\"" + tenant + "\",\"domains\":[\"" + domain + "\"],\"modes\":\"verify\"}"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.status").value("running"))
            .andExpect(jsonPath("$.domains[0]").value(domain))
            .andExpect(jsonPath("$.progress.metrics.verify_jobs_enqueued").value(1));
    }

    @Test
    void runWithoutDomainsIsBadRequest() throws Exception {
        mockMvc.perform(post("/api/pipeline/runs")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"domains\":[]}"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.error").value("invalid_request"));
    }

    @Test
    void exhaustedQuotaIsTooManyRequests() throws Exception {
        String tenant = "api-" + UUID.randomUUID();
        runRepository.insertActivity(tenant, DomainLimitService.RUN_STARTED_ACTION, null, Map.of("domains_count", 5000));

        mockMvc.perform(post("/api/pipeline/runs")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"tenantId\":\"" + tenant + "\",\"domains\":[\"quota.example\"]}"))
            .andExpect(status().isTooManyRequests())
            .andExpect(jsonPath("$.error").value("tenant_quota_exceeded"))
            .andExpect(jsonPath("$.message", containsString("limit=1000")));
    }

    @Test
    void unknownRunIsNotFound() throws Exception {
        mockMvc.perform(get("/api/pipeline/runs/{id}", 987654321L))
            .andExpect(status().isNotFound());
    }

    @Test
    void nonBounceNotificationIsIgnored() throws Exception {
        mockMvc.perform(post("/api/bounces")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"notificationType\":\"Delivery\"}"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.outcome").value("ignored"));
    }

    @Test
    void bounceForUnknownRecipientIsUnmatched() throws Exception {
        String body = """
            {"notificationType":"Bounce",
             "bounce":{"bounceType":"Permanent","bouncedRecipients":[{"emailAddress":"nobody@nowhere.example"}]},
             "mail":{}}
            """;
        mockMvc.perform(post("/api/bounces").contentType(MediaType.APPLICATION_JSON).content(body))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.outcome").value("unmatched"))
            .andExpect(jsonPath("$.hard").value(true));
    }

    @Test
    void deadLettersAreListedNewestFirst() throws Exception {
        deadLetterRepository.insert(new DeadLetterRecord(
            null, 41L, "verify", 5, "a@acme.example", null, "retries_exhausted", "smtp_451", null, Map.of(), Instant.now()
        ));
        deadLetterRepository.insert(new DeadLetterRecord(
            null, 42L, "verify", 5, "b@acme.example", null, "retries_exhausted", "timeout", null, Map.of(), Instant.now()
        ));

        mockMvc.perform(get("/api/dead-letters").param("limit", "1"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$", hasSize(1)))
            .andExpect(jsonPath("$[0].jobId").value(42));
    }
}
