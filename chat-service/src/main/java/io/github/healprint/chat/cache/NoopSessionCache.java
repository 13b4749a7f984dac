package io.github.healprint.chat.cache;

import jakarta.enterprise.context.ApplicationScoped;
import java.time.Duration;

@ApplicationScoped
public class NoopSessionCache implements SessionCache {

    @Override
    public boolean available() {
        return false;
    }

    @Override
    public boolean put(String key, String value, Duration ttl) {
        return false;
    }

    @Override
    public CacheLookup get(String key) {
        return CacheLookup.degraded();
    }

    @Override
    public boolean delete(String key) {
        return false;
    }
}
