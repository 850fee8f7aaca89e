package com.delta.mailverify.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;

/**
 * Verifier configuration, bound once at startup from the {@code verifier.*} namespace and handed to
 * every component through its constructor. Nothing in the engine reads the environment directly.
 */
@ConfigurationProperties(prefix = "verifier")
public class VerifierProperties {
    private Gate gate = new Gate();
    private Rps rps = new Rps();
    private Retry retry = new Retry();
    private Smtp smtp = new Smtp();
    private Preflight preflight = new Preflight();
    private CatchAll catchAll = new CatchAll();
    private Fallback fallback = new Fallback();
    private TestSend testSend = new TestSend();
    private Bounce bounce = new Bounce();
    private Pipeline pipeline = new Pipeline();
    private Worker worker = new Worker();
    private Cleanup cleanup = new Cleanup();
    private DeadLetter deadLetter = new DeadLetter();

    public Gate getGate() {
        return gate;
    }

    public void setGate(Gate gate) {
        this.gate = gate;
    }

    public Rps getRps() {
        return rps;
    }

    public void setRps(Rps rps) {
        this.rps = rps;
    }

    public Retry getRetry() {
        return retry;
    }

    public void setRetry(Retry retry) {
        this.retry = retry;
    }

    public Smtp getSmtp() {
        return smtp;
    }

    public void setSmtp(Smtp smtp) {
        this.smtp = smtp;
    }

    public Preflight getPreflight() {
        return preflight;
    }

    public void setPreflight(Preflight preflight) {
        this.preflight = preflight;
    }

    public CatchAll getCatchAll() {
        return catchAll;
    }

    public void setCatchAll(CatchAll catchAll) {
        this.catchAll = catchAll;
    }

    public Fallback getFallback() {
        return fallback;
    }

    public void setFallback(Fallback fallback) {
        this.fallback = fallback;
    }

    public TestSend getTestSend() {
        return testSend;
    }

    public void setTestSend(TestSend testSend) {
        this.testSend = testSend;
    }

    public Bounce getBounce() {
        return bounce;
    }

    public void setBounce(Bounce bounce) {
        this.bounce = bounce;
    }

    public Pipeline getPipeline() {
        return pipeline;
    }

    public void setPipeline(Pipeline pipeline) {
        this.pipeline = pipeline;
    }

    public Worker getWorker() {
        return worker;
    }

    public void setWorker(Worker worker) {
        this.worker = worker;
    }

    public Cleanup getCleanup() {
        return cleanup;
    }

    public void setCleanup(Cleanup cleanup) {
        this.cleanup = cleanup;
    }

    public DeadLetter getDeadLetter() {
        return deadLetter;
    }

    public void setDeadLetter(DeadLetter deadLetter) {
        this.deadLetter = deadLetter;
    }

    public static class Gate {
        private String store = "jdbc";
        private int globalConcurrency = 20;
        private int perMxConcurrency = 3;
        private int leaseTtlSeconds = 120;

        public String getStore() {
            return store == null || store.isBlank() ? "jdbc" : store.trim().toLowerCase(Locale.ROOT);
        }

        public void setStore(String store) {
            this.store = store;
        }

        public int getGlobalConcurrency() {
            return Math.max(1, globalConcurrency);
        }

        public void setGlobalConcurrency(int globalConcurrency) {
            this.globalConcurrency = Math.max(1, globalConcurrency);
        }

        public int getPerMxConcurrency() {
            return Math.max(1, perMxConcurrency);
        }

        public void setPerMxConcurrency(int perMxConcurrency) {
            this.perMxConcurrency = Math.max(1, perMxConcurrency);
        }

        public int getLeaseTtlSeconds() {
            return Math.max(1, leaseTtlSeconds);
        }

        public void setLeaseTtlSeconds(int leaseTtlSeconds) {
            this.leaseTtlSeconds = Math.max(1, leaseTtlSeconds);
        }
    }

    public static class Rps {
        private int global = 10;
        private int perMx = 2;

        public int getGlobal() {
            return Math.max(1, global);
        }

        public void setGlobal(int global) {
            this.global = Math.max(1, global);
        }

        public int getPerMx() {
            return Math.max(1, perMx);
        }

        public void setPerMx(int perMx) {
            this.perMx = Math.max(1, perMx);
        }
    }

    public static class Retry {
        private int maxAttempts = 5;
        private long backoffBaseMs = 2000;
        private long backoffCapMs = 300_000;

        public int getMaxAttempts() {
            return Math.max(1, maxAttempts);
        }

        public void setMaxAttempts(int maxAttempts) {
            this.maxAttempts = Math.max(1, maxAttempts);
        }

        public long getBackoffBaseMs() {
            return Math.max(1, backoffBaseMs);
        }

        public void setBackoffBaseMs(long backoffBaseMs) {
            this.backoffBaseMs = Math.max(1, backoffBaseMs);
        }

        public long getBackoffCapMs() {
            return Math.max(getBackoffBaseMs(), backoffCapMs);
        }

        public void setBackoffCapMs(long backoffCapMs) {
            this.backoffCapMs = Math.max(1, backoffCapMs);
        }
    }

    public static class Smtp {
        private static final int MAX_CONNECT_TIMEOUT_MS = 6000;
        private static final int MAX_COMMAND_TIMEOUT_MS = 10000;

        private boolean enabled = true;
        private String heloDomain = "verifier.example.com";
        private String mailFrom = "bounce@verifier.example.com";
        private int connectTimeoutMs = MAX_CONNECT_TIMEOUT_MS;
        private int commandTimeoutMs = MAX_COMMAND_TIMEOUT_MS;
        private int port = 25;

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public String getHeloDomain() {
            return heloDomain;
        }

        public void setHeloDomain(String heloDomain) {
            this.heloDomain = heloDomain;
        }

        public String getMailFrom() {
            return mailFrom;
        }

        public void setMailFrom(String mailFrom) {
            this.mailFrom = mailFrom;
        }

        public int getConnectTimeoutMs() {
            return Math.max(100, Math.min(connectTimeoutMs, MAX_CONNECT_TIMEOUT_MS));
        }

        public void setConnectTimeoutMs(int connectTimeoutMs) {
            this.connectTimeoutMs = connectTimeoutMs;
        }

        public int getCommandTimeoutMs() {
            return Math.max(100, Math.min(commandTimeoutMs, MAX_COMMAND_TIMEOUT_MS));
        }

        public void setCommandTimeoutMs(int commandTimeoutMs) {
            this.commandTimeoutMs = commandTimeoutMs;
        }

        public int getPort() {
            return port <= 0 ? 25 : port;
        }

        public void setPort(int port) {
            this.port = port;
        }
    }

    public static class Preflight {
        private boolean enabled = true;
        private int timeoutMs = 1500;
        private int cacheTtlSeconds = 300;
        private int maxAddresses = 2;

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public int getTimeoutMs() {
            return Math.max(100, timeoutMs);
        }

        public void setTimeoutMs(int timeoutMs) {
            this.timeoutMs = Math.max(100, timeoutMs);
        }

        public int getCacheTtlSeconds() {
            return Math.max(1, cacheTtlSeconds);
        }

        public void setCacheTtlSeconds(int cacheTtlSeconds) {
            this.cacheTtlSeconds = Math.max(1, cacheTtlSeconds);
        }

        public int getMaxAddresses() {
            return Math.max(1, maxAddresses);
        }

        public void setMaxAddresses(int maxAddresses) {
            this.maxAddresses = Math.max(1, maxAddresses);
        }
    }

    public static class CatchAll {
        private boolean enabled = true;
        private int cacheTtlHours = 24;

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public int getCacheTtlHours() {
            return Math.max(1, cacheTtlHours);
        }

        public void setCacheTtlHours(int cacheTtlHours) {
            this.cacheTtlHours = Math.max(1, cacheTtlHours);
        }
    }

    public static class Fallback {
        private String url;
        private String apiKey;
        private int timeoutSeconds = 10;

        public String getUrl() {
            return url == null || url.isBlank() ? null : url.trim();
        }

        public void setUrl(String url) {
            this.url = url;
        }

        public String getApiKey() {
            return apiKey;
        }

        public void setApiKey(String apiKey) {
            this.apiKey = apiKey;
        }

        public int getTimeoutSeconds() {
            return Math.max(1, timeoutSeconds);
        }

        public void setTimeoutSeconds(int timeoutSeconds) {
            this.timeoutSeconds = Math.max(1, timeoutSeconds);
        }

        public boolean isConfigured() {
            return getUrl() != null;
        }
    }

    public static class TestSend {
        private boolean autoEscalate = true;
        private int deliveredAssumedHours = 24;
        private String bouncePrefix = "bounce";
        private String bounceDomain = "verifier.example.com";
        private String tokenTag = "iq_test_token";

        public boolean isAutoEscalate() {
            return autoEscalate;
        }

        public void setAutoEscalate(boolean autoEscalate) {
            this.autoEscalate = autoEscalate;
        }

        public int getDeliveredAssumedHours() {
            return Math.max(1, deliveredAssumedHours);
        }

        public void setDeliveredAssumedHours(int deliveredAssumedHours) {
            this.deliveredAssumedHours = Math.max(1, deliveredAssumedHours);
        }

        public String getBouncePrefix() {
            return bouncePrefix == null || bouncePrefix.isBlank() ? "bounce" : bouncePrefix.trim();
        }

        public void setBouncePrefix(String bouncePrefix) {
            this.bouncePrefix = bouncePrefix;
        }

        public String getBounceDomain() {
            return bounceDomain;
        }

        public void setBounceDomain(String bounceDomain) {
            this.bounceDomain = bounceDomain;
        }

        public String getTokenTag() {
            return tokenTag == null || tokenTag.isBlank() ? "iq_test_token" : tokenTag.trim();
        }

        public void setTokenTag(String tokenTag) {
            this.tokenTag = tokenTag;
        }
    }

    public static class Bounce {
        private boolean drainEnabled;
        private int drainBatch = 10;

        public boolean isDrainEnabled() {
            return drainEnabled;
        }

        public void setDrainEnabled(boolean drainEnabled) {
            this.drainEnabled = drainEnabled;
        }

        public int getDrainBatch() {
            return Math.max(1, drainBatch);
        }

        public void setDrainBatch(int drainBatch) {
            this.drainBatch = Math.max(1, drainBatch);
        }
    }

    public static class Pipeline {
        private int defaultCompanyLimit = 1000;
        private int hardCompanyLimit24h = 1000;
        private int maxProbesPerPerson = 6;
        private int progressFlushEvery = 10;
        private int staleRunMinutes = 120;
        private int jobMaxAttempts = 3;

        public int getDefaultCompanyLimit() {
            return Math.max(1, defaultCompanyLimit);
        }

        public void setDefaultCompanyLimit(int defaultCompanyLimit) {
            this.defaultCompanyLimit = Math.max(1, defaultCompanyLimit);
        }

        public int getHardCompanyLimit24h() {
            return Math.max(1, hardCompanyLimit24h);
        }

        public void setHardCompanyLimit24h(int hardCompanyLimit24h) {
            this.hardCompanyLimit24h = Math.max(1, hardCompanyLimit24h);
        }

        public int getMaxProbesPerPerson() {
            return Math.max(0, maxProbesPerPerson);
        }

        public void setMaxProbesPerPerson(int maxProbesPerPerson) {
            this.maxProbesPerPerson = Math.max(0, maxProbesPerPerson);
        }

        public int getProgressFlushEvery() {
            return Math.max(1, progressFlushEvery);
        }

        public void setProgressFlushEvery(int progressFlushEvery) {
            this.progressFlushEvery = Math.max(1, progressFlushEvery);
        }

        public int getStaleRunMinutes() {
            return Math.max(1, staleRunMinutes);
        }

        public void setStaleRunMinutes(int staleRunMinutes) {
            this.staleRunMinutes = Math.max(1, staleRunMinutes);
        }

        public int getJobMaxAttempts() {
            return Math.max(1, jobMaxAttempts);
        }

        public void setJobMaxAttempts(int jobMaxAttempts) {
            this.jobMaxAttempts = Math.max(1, jobMaxAttempts);
        }
    }

    public static class Worker {
        private boolean enabled = true;
        private String queues = "crawl,generate,verify,test_send";
        private int workersPerQueue = 2;
        private int pollIntervalMs = 1000;
        private long lockTtlSeconds = 1800;
        private int maintenanceIntervalSeconds = 900;

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public List<String> getQueueNames() {
            if (queues == null || queues.isBlank()) {
                return List.of();
            }
            List<String> names = new ArrayList<>();
            Arrays.stream(queues.split(","))
                .map(String::trim)
                .filter(value -> !value.isEmpty())
                .forEach(names::add);
            return names;
        }

        public String getQueues() {
            return queues;
        }

        public void setQueues(String queues) {
            this.queues = queues;
        }

        public int getWorkersPerQueue() {
            return Math.max(1, workersPerQueue);
        }

        public void setWorkersPerQueue(int workersPerQueue) {
            this.workersPerQueue = Math.max(1, workersPerQueue);
        }

        public int getPollIntervalMs() {
            return Math.max(50, pollIntervalMs);
        }

        public void setPollIntervalMs(int pollIntervalMs) {
            this.pollIntervalMs = Math.max(50, pollIntervalMs);
        }

        public long getLockTtlSeconds() {
            return Math.max(30, lockTtlSeconds);
        }

        public void setLockTtlSeconds(long lockTtlSeconds) {
            this.lockTtlSeconds = Math.max(30, lockTtlSeconds);
        }

        public int getMaintenanceIntervalSeconds() {
            return Math.max(10, maintenanceIntervalSeconds);
        }

        public void setMaintenanceIntervalSeconds(int maintenanceIntervalSeconds) {
            this.maintenanceIntervalSeconds = Math.max(10, maintenanceIntervalSeconds);
        }
    }

    public static class Cleanup {
        private boolean deleteInvalidGenerated;
        private boolean deleteUntestedGenerated;

        public boolean isDeleteInvalidGenerated() {
            return deleteInvalidGenerated;
        }

        public void setDeleteInvalidGenerated(boolean deleteInvalidGenerated) {
            this.deleteInvalidGenerated = deleteInvalidGenerated;
        }

        public boolean isDeleteUntestedGenerated() {
            return deleteUntestedGenerated;
        }

        public void setDeleteUntestedGenerated(boolean deleteUntestedGenerated) {
            this.deleteUntestedGenerated = deleteUntestedGenerated;
        }
    }

    public static class DeadLetter {
        private int retention = 1000;

        public int getRetention() {
            return Math.max(1, retention);
        }

        public void setRetention(int retention) {
            this.retention = Math.max(1, retention);
        }
    }
}
