package com.delta.mailverify.config;

import com.delta.mailverify.pipeline.discovery.CompanyDiscovery;
import com.delta.mailverify.pipeline.discovery.NoopCompanyDiscovery;
import com.delta.mailverify.verify.bounce.BounceQueueClient;
import com.delta.mailverify.verify.bounce.NoopBounceQueueClient;
import com.delta.mailverify.verify.fallback.FallbackVerifier;
import com.delta.mailverify.verify.fallback.HttpFallbackVerifier;
import com.delta.mailverify.verify.fallback.NoopFallbackVerifier;
import com.delta.mailverify.verify.gate.ConcurrencyGate;
import com.delta.mailverify.verify.gate.InMemoryConcurrencyGate;
import com.delta.mailverify.verify.gate.JdbcConcurrencyGate;
import com.delta.mailverify.verify.service.LoggingTestSendMailer;
import com.delta.mailverify.verify.service.TestSendMailer;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;

import java.time.Duration;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

@Configuration
public class VerifierConfig {

    @Bean
    public ConcurrencyGate concurrencyGate(VerifierProperties properties, NamedParameterJdbcTemplate jdbc) {
        Duration leaseTtl = Duration.ofSeconds(properties.getGate().getLeaseTtlSeconds());
        if ("memory".equals(properties.getGate().getStore())) {
            return new InMemoryConcurrencyGate(leaseTtl);
        }
        return new JdbcConcurrencyGate(jdbc, leaseTtl);
    }

    @Bean
    public FallbackVerifier fallbackVerifier(VerifierProperties properties, ObjectMapper objectMapper) {
        if (properties.getFallback().isConfigured()) {
            return new HttpFallbackVerifier(properties.getFallback(), objectMapper);
        }
        return new NoopFallbackVerifier();
    }

    @Bean
    @ConditionalOnMissingBean(TestSendMailer.class)
    public TestSendMailer testSendMailer() {
        return new LoggingTestSendMailer();
    }

    @Bean
    @ConditionalOnMissingBean(BounceQueueClient.class)
    public BounceQueueClient bounceQueueClient() {
        return new NoopBounceQueueClient();
    }

    @Bean
    @ConditionalOnMissingBean(CompanyDiscovery.class)
    public CompanyDiscovery companyDiscovery() {
        return new NoopCompanyDiscovery();
    }

    @Bean(name = "pipelineRunExecutor", destroyMethod = "shutdown")
    public ExecutorService pipelineRunExecutor() {
        return Executors.newSingleThreadExecutor();
    }

    @Bean
    public ObjectMapper objectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        return mapper;
    }
}
