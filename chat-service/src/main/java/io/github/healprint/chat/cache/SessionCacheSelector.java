package io.github.healprint.chat.cache;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.eclipse.microprofile.config.inject.ConfigProperty;

/** Selects the SessionCache implementation named by {@code healprint.cache.type}. */
@ApplicationScoped
public class SessionCacheSelector {

    @ConfigProperty(name = "healprint.cache.type", defaultValue = "none")
    String cacheType;

    @Inject RedisSessionCache redisCache;

    @Inject NoopSessionCache noopCache;

    public SessionCache select() {
        String type = cacheType == null ? "none" : cacheType.trim().toLowerCase();
        // The Redis cache degrades on its own when the backend is down, so it is returned even
        // when its start-up ping failed.
        return switch (type) {
            case "redis" -> redisCache;
            default -> noopCache;
        };
    }
}
