package org.smileyface.minespec.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Configuration properties for fetching and harvesting, bound from {@code minespec.*}.
 * The engine tables themselves live in {@link SpecEngineConfig}; {@link #engineConfig} names the
 * classpath resource they are read from.
 */
@ConfigurationProperties(prefix = "minespec")
public class HarvestProperties {

    /** User agent sent with every page and robots.txt request. */
    private String userAgent = "MineSpecHarvester/0.1";

    /** Per-request connect/read timeout in milliseconds. */
    private int requestTimeoutMs = 10000;

    /** Upper bound for one fetch including retries; a fetch that exceeds it yields no document. */
    private int fetchDeadlineMs = 60000;

    /** Number of (brand, model) work items processed in parallel. */
    private int workerCount = 4;

    /** Fetch threads shared by all work items. */
    private int fetchThreads = 8;

    /** Maximum in-flight requests against one domain. */
    private int maxConcurrentPerDomain = 2;

    /** Attempts per URL for transient failures (first try included). */
    private int maxAttempts = 3;

    private long retryBaseDelayMs = 500;

    private long retryMaxDelayMs = 8000;

    private int maxRedirects = 5;

    private long maxHtmlBytes = 10L * 1024 * 1024;

    private long maxPdfBytes = 50L * 1024 * 1024;

    /** Whether robots.txt is honoured before fetching. */
    private boolean respectRobots = true;

    /** Classpath resource holding the engine tables. */
    private String engineConfig = SpecEngineConfig.DEFAULT_RESOURCE;

    private Robots robots = new Robots();

    private Store store = new Store();

    public String getUserAgent() { return userAgent; }
    public void setUserAgent(String userAgent) {
        this.userAgent = (userAgent == null || userAgent.isBlank()) ? "MineSpecHarvester/0.1" : userAgent;
    }

    public int getRequestTimeoutMs() { return requestTimeoutMs; }
    public void setRequestTimeoutMs(int requestTimeoutMs) { this.requestTimeoutMs = requestTimeoutMs; }

    public int getFetchDeadlineMs() { return fetchDeadlineMs; }
    public void setFetchDeadlineMs(int fetchDeadlineMs) { this.fetchDeadlineMs = fetchDeadlineMs; }

    public int getWorkerCount() { return workerCount; }
    public void setWorkerCount(int workerCount) { this.workerCount = Math.max(1, workerCount); }

    public int getFetchThreads() { return fetchThreads; }
    public void setFetchThreads(int fetchThreads) { this.fetchThreads = Math.max(1, fetchThreads); }

    public int getMaxConcurrentPerDomain() { return maxConcurrentPerDomain; }
    public void setMaxConcurrentPerDomain(int maxConcurrentPerDomain) {
        this.maxConcurrentPerDomain = Math.max(1, maxConcurrentPerDomain);
    }

    public int getMaxAttempts() { return maxAttempts; }
    public void setMaxAttempts(int maxAttempts) { this.maxAttempts = Math.max(1, maxAttempts); }

    public long getRetryBaseDelayMs() { return retryBaseDelayMs; }
    public void setRetryBaseDelayMs(long retryBaseDelayMs) { this.retryBaseDelayMs = Math.max(0, retryBaseDelayMs); }

    public long getRetryMaxDelayMs() { return retryMaxDelayMs; }
    public void setRetryMaxDelayMs(long retryMaxDelayMs) { this.retryMaxDelayMs = Math.max(0, retryMaxDelayMs); }

    public int getMaxRedirects() { return maxRedirects; }
    public void setMaxRedirects(int maxRedirects) { this.maxRedirects = Math.max(0, maxRedirects); }

    public long getMaxHtmlBytes() { return maxHtmlBytes; }
    public void setMaxHtmlBytes(long maxHtmlBytes) { this.maxHtmlBytes = maxHtmlBytes; }

    public long getMaxPdfBytes() { return maxPdfBytes; }
    public void setMaxPdfBytes(long maxPdfBytes) { this.maxPdfBytes = maxPdfBytes; }

    public boolean isRespectRobots() { return respectRobots; }
    public void setRespectRobots(boolean respectRobots) { this.respectRobots = respectRobots; }

    public String getEngineConfig() { return engineConfig; }
    public void setEngineConfig(String engineConfig) {
        this.engineConfig = (engineConfig == null || engineConfig.isBlank())
                ? SpecEngineConfig.DEFAULT_RESOURCE : engineConfig;
    }

    public Robots getRobots() { return robots; }
    public void setRobots(Robots robots) { this.robots = robots != null ? robots : new Robots(); }

    public Store getStore() { return store; }
    public void setStore(Store store) { this.store = store != null ? store : new Store(); }

    public static class Robots {
        /** Lifetime of cached robots.txt rules. */
        private long ttlSeconds = 3600;
        /** Key prefix for the Redis-backed cache. */
        private String namespace = "minespec:robots";

        public long getTtlSeconds() { return ttlSeconds; }
        public void setTtlSeconds(long ttlSeconds) { this.ttlSeconds = Math.max(1, ttlSeconds); }

        public String getNamespace() { return namespace; }
        public void setNamespace(String namespace) {
            this.namespace = (namespace == null || namespace.isBlank()) ? "minespec:robots" : namespace;
        }
    }

    public static class Store {
        /** Prefix of the Elasticsearch indices holding specs, candidates and rimpull curves. */
        private String indexPrefix = "minespec";

        public String getIndexPrefix() { return indexPrefix; }
        public void setIndexPrefix(String indexPrefix) {
            this.indexPrefix = (indexPrefix == null || indexPrefix.isBlank()) ? "minespec" : indexPrefix;
        }
    }
}
