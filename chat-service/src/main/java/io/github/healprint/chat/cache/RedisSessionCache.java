package io.github.healprint.chat.cache;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.quarkus.redis.client.RedisClientName;
import io.quarkus.redis.datasource.ReactiveRedisDataSource;
import io.quarkus.redis.datasource.keys.ReactiveKeyCommands;
import io.quarkus.redis.datasource.value.ReactiveValueCommands;
import io.quarkus.redis.datasource.value.SetArgs;
import jakarta.annotation.PostConstruct;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Any;
import jakarta.enterprise.inject.Instance;
import jakarta.inject.Inject;
import java.time.Duration;
import java.util.Optional;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;

@ApplicationScoped
public class RedisSessionCache implements SessionCache {
    private static final Logger LOG = Logger.getLogger(RedisSessionCache.class);

    private final boolean redisEnabled;
    private final String clientName;
    private final Duration timeout;
    private final Instance<ReactiveRedisDataSource> redisSources;
    private final MeterRegistry meterRegistry;
    private volatile ReactiveKeyCommands<String> keys;
    private volatile ReactiveValueCommands<String, String> values;
    private Counter cacheHits;
    private Counter cacheMisses;
    private Counter cacheErrors;

    @Inject
    public RedisSessionCache(
            @ConfigProperty(name = "healprint.cache.type") Optional<String> cacheType,
            @ConfigProperty(name = "healprint.cache.redis.client") Optional<String> clientName,
            @ConfigProperty(name = "healprint.cache.timeout", defaultValue = "PT2S")
                    Duration timeout,
            @Any Instance<ReactiveRedisDataSource> redisSources,
            MeterRegistry meterRegistry) {
        this.redisEnabled = cacheType.map("redis"::equalsIgnoreCase).orElse(false);
        this.clientName = clientName.filter(it -> !it.isBlank()).orElse(null);
        this.timeout = timeout;
        this.redisSources = redisSources;
        this.meterRegistry = meterRegistry;
    }

    @PostConstruct
    void init() {
        cacheHits = meterRegistry.counter("healprint.cache.hits", "backend", "redis");
        cacheMisses = meterRegistry.counter("healprint.cache.misses", "backend", "redis");
        cacheErrors = meterRegistry.counter("healprint.cache.errors", "backend", "redis");

        if (!redisEnabled) {
            LOG.info("Session cache type is not redis - cache disabled");
            return;
        }

        Instance<ReactiveRedisDataSource> selected =
                clientName != null
                        ? redisSources.select(RedisClientName.Literal.of(clientName))
                        : redisSources;
        if (selected.isUnsatisfied()) {
            LOG.warnf(
                    "Session cache is enabled (healprint.cache.type=redis) but Redis client '%s'"
                            + " is not available - cache disabled",
                    clientName == null ? "<default>" : clientName);
            return;
        }

        ReactiveRedisDataSource dataSource = selected.get();
        try {
            dataSource.execute("PING").await().atMost(timeout);
        } catch (Exception e) {
            LOG.errorf(e, "Failed to connect to Redis - cache disabled");
            return;
        }
        keys = dataSource.key();
        values = dataSource.value(String.class);
        LOG.info("Redis session cache connection established");
    }

    @Override
    public boolean available() {
        return keys != null && values != null;
    }

    @Override
    public boolean put(String key, String value, Duration ttl) {
        if (!available()) {
            return false;
        }
        try {
            values.set(key, value, new SetArgs().ex(ttl)).await().atMost(timeout);
            LOG.debugf("Cached %s", key);
            return true;
        } catch (Exception e) {
            LOG.warnf(e, "Failed to write %s to Redis session cache", key);
            cacheErrors.increment();
            return false;
        }
    }

    @Override
    public CacheLookup get(String key) {
        if (!available()) {
            cacheMisses.increment();
            return CacheLookup.degraded();
        }
        try {
            String json = values.get(key).await().atMost(timeout);
            if (json == null) {
                cacheMisses.increment();
                return CacheLookup.miss();
            }
            cacheHits.increment();
            return CacheLookup.hit(json);
        } catch (Exception e) {
            LOG.warnf(e, "Failed to read %s from Redis session cache", key);
            cacheErrors.increment();
            return CacheLookup.degraded();
        }
    }

    @Override
    public boolean delete(String key) {
        if (!available()) {
            return false;
        }
        try {
            keys.del(key).await().atMost(timeout);
            LOG.debugf("Invalidated %s", key);
            return true;
        } catch (Exception e) {
            LOG.warnf(e, "Failed to invalidate %s in Redis session cache", key);
            cacheErrors.increment();
            return false;
        }
    }
}
