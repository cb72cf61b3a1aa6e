package org.smileyface.minespec.safety;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.Arguments;
import org.junit.jupiter.params.provider.MethodSource;
import org.springframework.data.redis.connection.lettuce.LettuceConnectionFactory;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.testcontainers.containers.GenericContainer;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.function.Supplier;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Contract tests for RobotsCache implementations, in-memory and Redis-backed.
 */
class RobotsCacheParameterizedTest {

    private static Logger logger = LogManager.getLogger(RobotsCacheParameterizedTest.class);
    private static GenericContainer<?> redisContainer; // lazily started
    private static List<Arguments> IMPLEMENTATIONS;

    static Stream<Arguments> cacheImplementations() {
        if (IMPLEMENTATIONS == null) {
            synchronized (RobotsCacheParameterizedTest.class) {
                if (IMPLEMENTATIONS == null) {
                    IMPLEMENTATIONS = new ArrayList<>();
                    IMPLEMENTATIONS.add(Arguments.of(
                            "InMemoryRobotsCache",
                            (Supplier<RobotsCache>) () -> new InMemoryRobotsCache(Duration.ofMinutes(10), Clock.systemUTC())
                    ));

                    try {
                        redisContainer = new GenericContainer<>("redis:7.2.4").withExposedPorts(6379);
                        redisContainer.start();

                        Supplier<RobotsCache> redisSupplier = () -> {
                            String host = redisContainer.getHost();
                            Integer port = redisContainer.getMappedPort(6379);
                            LettuceConnectionFactory cf = new LettuceConnectionFactory(host, port);
                            cf.afterPropertiesSet();
                            StringRedisTemplate template = new StringRedisTemplate(cf);
                            return new RedisRobotsCache(template, "test:robots:" + UUID.randomUUID(), Duration.ofMinutes(10));
                        };

                        IMPLEMENTATIONS.add(Arguments.of("RedisRobotsCache", redisSupplier));
                    } catch (Throwable t) {
                        // Docker not available, the Redis implementation is skipped
                        logger.error("Failed to start Redis Testcontainer: {}", t.getMessage(), t);
                    }
                }
            }
        }
        return IMPLEMENTATIONS.stream();
    }

    @AfterAll
    static void tearDown() {
        if (redisContainer != null) {
            try {
                redisContainer.stop();
            } finally {
                redisContainer = null;
            }
        }
    }

    @ParameterizedTest(name = "{index} => impl={0}")
    @MethodSource("cacheImplementations")
    @DisplayName("missingOriginIsEmpty")
    void missingOriginIsEmpty(String implName, Supplier<RobotsCache> supplier) {
        RobotsCache cache = supplier.get();
        assertEquals(Optional.empty(), cache.get("https://nothing.example"));
        assertEquals(Optional.empty(), cache.get(null));
    }

    @ParameterizedTest(name = "{index} => impl={0}")
    @MethodSource("cacheImplementations")
    @DisplayName("putThenGetReturnsBody")
    void putThenGetReturnsBody(String implName, Supplier<RobotsCache> supplier) {
        RobotsCache cache = supplier.get();
        cache.put("https://a.example", "User-agent: *\nDisallow: /x\n");
        assertEquals(Optional.of("User-agent: *\nDisallow: /x\n"), cache.get("https://a.example"));
        assertEquals(Optional.empty(), cache.get("https://b.example"));
    }

    @ParameterizedTest(name = "{index} => impl={0}")
    @MethodSource("cacheImplementations")
    @DisplayName("missingRobotsIsCachedAsEmptyBody")
    void missingRobotsIsCachedAsEmptyBody(String implName, Supplier<RobotsCache> supplier) {
        RobotsCache cache = supplier.get();
        cache.put("https://a.example", null);
        assertEquals(Optional.of(""), cache.get("https://a.example"));
    }

    @ParameterizedTest(name = "{index} => impl={0}")
    @MethodSource("cacheImplementations")
    @DisplayName("expireAndClearRemoveEntries")
    void expireAndClearRemoveEntries(String implName, Supplier<RobotsCache> supplier) {
        RobotsCache cache = supplier.get();
        cache.put("https://a.example", "a");
        cache.put("https://b.example", "b");
        cache.expire("https://a.example");
        assertTrue(cache.get("https://a.example").isEmpty());
        assertEquals(Optional.of("b"), cache.get("https://b.example"));

        cache.clear();
        assertTrue(cache.get("https://b.example").isEmpty());
    }

    @Test
    void inMemoryEntriesExpireAfterTtl() {
        MutableClock clock = new MutableClock(Instant.parse("2024-01-01T00:00:00Z"));
        RobotsCache cache = new InMemoryRobotsCache(Duration.ofSeconds(60), clock);
        cache.put("https://a.example", "body");

        clock.advance(Duration.ofSeconds(59));
        assertEquals(Optional.of("body"), cache.get("https://a.example"));

        clock.advance(Duration.ofSeconds(1));
        assertTrue(cache.get("https://a.example").isEmpty());
    }

    @Test
    void inMemoryRejectsNonPositiveTtl() {
        assertThrows(IllegalArgumentException.class, () -> new InMemoryRobotsCache(Duration.ZERO, Clock.systemUTC()));
    }

    private static final class MutableClock extends Clock {
        private Instant now;

        MutableClock(Instant start) {
            this.now = start;
        }

        void advance(Duration d) {
            now = now.plus(d);
        }

        @Override
        public ZoneId getZone() {
            return ZoneOffset.UTC;
        }

        @Override
        public Clock withZone(ZoneId zone) {
            return this;
        }

        @Override
        public Instant instant() {
            return now;
        }
    }
}
