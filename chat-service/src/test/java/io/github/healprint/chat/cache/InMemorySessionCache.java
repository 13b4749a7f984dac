package io.github.healprint.chat.cache;

import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/** Map-backed session cache for unit tests. A disabled cache behaves like an unreachable one. */
public class InMemorySessionCache implements SessionCache {

    private final Map<String, String> entries = new HashMap<>();
    private final Map<String, Duration> ttls = new HashMap<>();
    private final List<String> deletedKeys = new ArrayList<>();
    private boolean enabled = true;
    private int hits;
    private int misses;

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    public boolean contains(String key) {
        return entries.containsKey(key);
    }

    public String raw(String key) {
        return entries.get(key);
    }

    public void seed(String key, String value) {
        entries.put(key, value);
    }

    public Duration ttl(String key) {
        return ttls.get(key);
    }

    public List<String> deletedKeys() {
        return deletedKeys;
    }

    public int hits() {
        return hits;
    }

    public int misses() {
        return misses;
    }

    @Override
    public boolean available() {
        return enabled;
    }

    @Override
    public boolean put(String key, String value, Duration ttl) {
        if (!enabled) {
            return false;
        }
        entries.put(key, value);
        ttls.put(key, ttl);
        return true;
    }

    @Override
    public CacheLookup get(String key) {
        if (!enabled) {
            misses++;
            return CacheLookup.degraded();
        }
        String value = entries.get(key);
        if (value == null) {
            misses++;
            return CacheLookup.miss();
        }
        hits++;
        return CacheLookup.hit(value);
    }

    @Override
    public boolean delete(String key) {
        if (!enabled) {
            return false;
        }
        deletedKeys.add(key);
        entries.remove(key);
        ttls.remove(key);
        return true;
    }
}
