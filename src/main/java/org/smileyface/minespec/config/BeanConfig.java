package org.smileyface.minespec.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.smileyface.minespec.extractor.HtmlDocumentParser;
import org.smileyface.minespec.extractor.ParameterCatalog;
import org.smileyface.minespec.extractor.PdfDocumentParser;
import org.smileyface.minespec.extractor.RimpullExtractor;
import org.smileyface.minespec.extractor.SpecExtractor;
import org.smileyface.minespec.fetch.BackoffRetry;
import org.smileyface.minespec.fetch.DocumentFetcher;
import org.smileyface.minespec.fetch.DomainThrottle;
import org.smileyface.minespec.fetch.JsoupDocumentFetcher;
import org.smileyface.minespec.harvest.HarvestManager;
import org.smileyface.minespec.qa.QaPipeline;
import org.smileyface.minespec.safety.DnsHostResolver;
import org.smileyface.minespec.safety.InMemoryRobotsCache;
import org.smileyface.minespec.safety.JsoupRobotsFetcher;
import org.smileyface.minespec.safety.RedisRobotsCache;
import org.smileyface.minespec.safety.RobotsCache;
import org.smileyface.minespec.safety.UrlSafetyGate;
import org.smileyface.minespec.scoring.ConfidenceScorer;
import org.smileyface.minespec.scoring.SourceClassifier;
import org.smileyface.minespec.service.SpecPipeline;
import org.smileyface.minespec.store.ElasticContext;
import org.smileyface.minespec.store.ElasticRestClient;
import org.smileyface.minespec.store.ElasticSpecRepository;
import org.smileyface.minespec.store.InMemorySpecRepository;
import org.smileyface.minespec.store.SpecRepository;
import org.smileyface.minespec.validation.CrossValidator;
import org.smileyface.minespec.validation.RimpullReconciler;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Lazy;
import org.springframework.data.redis.core.StringRedisTemplate;

import java.time.Clock;
import java.time.Duration;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Wires the engine, the fetch stack and the stores.
 *
 * Implementations are selected by property:
 * - {@code minespec.robots.cache-type}: "in-memory" (default) or "redis"
 * - {@code minespec.store.type}: "in-memory" (default) or "elasticsearch"
 *
 * The Elasticsearch node is taken from environment variables (with defaults):
 * - ELASTIC_HOST: default "localhost"
 * - ELASTIC_PORT: default "9200"
 */
@Configuration
public class BeanConfig {

    @Value("${minespec.robots.cache-type:in-memory}")
    private String robotsCacheType;

    @Value("${minespec.store.type:in-memory}")
    private String storeType;

    // ---------------- Engine ----------------

    @Bean
    public SpecEngineConfig specEngineConfig(HarvestProperties properties) {
        return SpecEngineConfig.load(properties.getEngineConfig());
    }

    @Bean
    public SpecExtractor specExtractor(SpecEngineConfig config) {
        return new SpecExtractor(config, ParameterCatalog.defaultCatalog(), new RimpullExtractor());
    }

    @Bean
    public SpecPipeline specPipeline(SpecEngineConfig config, SpecExtractor extractor) {
        return new SpecPipeline(extractor, new SourceClassifier(config), new ConfidenceScorer(config),
                new CrossValidator(config), new RimpullReconciler(config), new QaPipeline(config));
    }

    // ---------------- Safety and fetch ----------------

    /**
     * Selects the RobotsCache implementation based on {@code minespec.robots.cache-type}.
     * "redis" uses {@link RedisRobotsCache} when a {@link StringRedisTemplate} is available and
     * falls back to {@link InMemoryRobotsCache} otherwise.
     */
    @Bean
    public RobotsCache robotsCache(ObjectProvider<StringRedisTemplate> redisProvider, HarvestProperties properties) {
        Duration ttl = Duration.ofSeconds(properties.getRobots().getTtlSeconds());
        String kind = robotsCacheType == null ? "in-memory" : robotsCacheType.trim().toLowerCase();
        if ("redis".equals(kind)) {
            StringRedisTemplate template = redisProvider.getIfAvailable();
            if (template != null) {
                return new RedisRobotsCache(template, properties.getRobots().getNamespace(), ttl);
            }
        }
        return new InMemoryRobotsCache(ttl, Clock.systemUTC());
    }

    @Bean
    public UrlSafetyGate urlSafetyGate(RobotsCache robotsCache, HarvestProperties properties) {
        return new UrlSafetyGate(new DnsHostResolver(), robotsCache,
                new JsoupRobotsFetcher(properties.getUserAgent(), properties.getRequestTimeoutMs()),
                properties.getUserAgent());
    }

    @Bean(destroyMethod = "shutdownNow")
    public ScheduledExecutorService retryScheduler() {
        return Executors.newSingleThreadScheduledExecutor(namedThreads("fetch-retry-"));
    }

    @Bean(destroyMethod = "shutdownNow")
    public ExecutorService fetchExecutor(HarvestProperties properties) {
        return Executors.newFixedThreadPool(properties.getFetchThreads(), namedThreads("fetch-"));
    }

    @Bean
    public DocumentFetcher documentFetcher(UrlSafetyGate gate, HarvestProperties properties,
                                           @Qualifier("retryScheduler") ScheduledExecutorService retryScheduler,
                                           @Qualifier("fetchExecutor") ExecutorService fetchExecutor) {
        BackoffRetry retry = new BackoffRetry(retryScheduler, fetchExecutor, properties.getMaxAttempts(),
                properties.getRetryBaseDelayMs(), properties.getRetryMaxDelayMs());
        return new JsoupDocumentFetcher(gate, properties, retry,
                new DomainThrottle(properties.getMaxConcurrentPerDomain()),
                new HtmlDocumentParser(), new PdfDocumentParser());
    }

    // ---------------- Store and harvest ----------------

    @Bean
    public ElasticContext elasticContext(HarvestProperties properties) {
        String host = System.getenv().getOrDefault("ELASTIC_HOST", "localhost");
        String portStr = System.getenv().getOrDefault("ELASTIC_PORT", "9200");
        int port;
        try {
            port = Integer.parseInt(portStr.trim());
        } catch (NumberFormatException e) {
            port = 9200;
        }
        return new ElasticContext(properties.getStore().getIndexPrefix(), host, port);
    }

    @Bean(destroyMethod = "close")
    @Lazy
    public ElasticRestClient elasticRestClient(ElasticContext context, ObjectMapper mapper) {
        return new ElasticRestClient(context, mapper);
    }

    /**
     * Selects the SpecRepository implementation based on {@code minespec.store.type}.
     */
    @Bean
    public SpecRepository specRepository(ObjectProvider<ElasticRestClient> elasticClient, ElasticContext context) {
        String kind = storeType == null ? "in-memory" : storeType.trim().toLowerCase();
        if ("elasticsearch".equals(kind)) {
            ElasticSpecRepository repository = new ElasticSpecRepository(elasticClient.getObject(), context);
            repository.init();
            return repository;
        }
        return new InMemorySpecRepository();
    }

    @Bean(destroyMethod = "shutdown")
    public HarvestManager harvestManager(HarvestProperties properties, DocumentFetcher fetcher,
                                         SpecPipeline pipeline, SpecRepository repository) {
        return new HarvestManager(properties, fetcher, pipeline, repository);
    }

    private static ThreadFactory namedThreads(String prefix) {
        AtomicInteger n = new AtomicInteger();
        return r -> {
            Thread t = new Thread(r, prefix + n.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
    }
}
