package com.delta.mailverify.verify.fallback;

import com.delta.mailverify.config.VerifierProperties;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Map;

/**
 * Single POST to a third-party verification API. One attempt, bounded timeout, no retries.
 */
public class HttpFallbackVerifier implements FallbackVerifier {
    private static final Logger log = LoggerFactory.getLogger(HttpFallbackVerifier.class);

    private final VerifierProperties.Fallback settings;
    private final ObjectMapper objectMapper;
    private final HttpClient client;

    public HttpFallbackVerifier(VerifierProperties.Fallback settings, ObjectMapper objectMapper) {
        this.settings = settings;
        this.objectMapper = objectMapper;
        this.client = HttpClient.newBuilder()
            .connectTimeout(Duration.ofSeconds(settings.getTimeoutSeconds()))
            .version(HttpClient.Version.HTTP_1_1)
            .build();
    }

    @Override
    public FallbackResult verify(String email) {
        if (!settings.isConfigured()) {
            return FallbackResult.unknown(NoopFallbackVerifier.DISABLED_REASON);
        }
        try {
            String body = objectMapper.writeValueAsString(Map.of("email", email == null ? "" : email));
            HttpRequest.Builder request = HttpRequest.newBuilder(URI.create(settings.getUrl()))
                .timeout(Duration.ofSeconds(settings.getTimeoutSeconds()))
                .header("Content-Type", "application/json")
                .header("Accept", "application/json")
                .POST(HttpRequest.BodyPublishers.ofString(body, StandardCharsets.UTF_8));
            if (settings.getApiKey() != null && !settings.getApiKey().isBlank()) {
                request.header("Authorization", "Bearer " + settings.getApiKey().trim());
            }
            HttpResponse<String> response = client.send(request.build(), HttpResponse.BodyHandlers.ofString());
            if (response.statusCode() < 200 || response.statusCode() >= 300) {
                return FallbackResult.unknown("http_" + response.statusCode());
            }
            JsonNode root = objectMapper.readTree(response.body());
            String providerStatus = root.path("status").asText(null);
            return new FallbackResult(FallbackResult.mapProviderStatus(providerStatus), response.body());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return FallbackResult.unknown("interrupted");
        } catch (IOException | RuntimeException e) {
            log.warn("Fallback verifier call failed for {}: {}", email, e.toString());
            return FallbackResult.unknown(e.getClass().getSimpleName() + ": " + e.getMessage());
        }
    }
}
