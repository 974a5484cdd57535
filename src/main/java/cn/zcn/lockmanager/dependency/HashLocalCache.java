package cn.zcn.lockmanager.dependency;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;

/**
 * 基于 {@link ConcurrentHashMap} 的进程内缓存，过期的条目在读取时清除
 */
public class HashLocalCache implements LocalCache {

    private static class CacheEntry {
        private final Object value;
        private final long expireAtNanos;

        private CacheEntry(Object value, long expireAtNanos) {
            this.value = value;
            this.expireAtNanos = expireAtNanos;
        }

        private boolean isExpired(long now) {
            return now - expireAtNanos >= 0;
        }
    }

    private final Map<String, CacheEntry> entries = new ConcurrentHashMap<>();

    @Override
    public Object get(String key) {
        CacheEntry entry = entries.get(key);
        if (entry == null) {
            return null;
        }

        if (entry.isExpired(System.nanoTime())) {
            entries.remove(key, entry);
            return null;
        }

        return entry.value;
    }

    @Override
    public void set(String key, Object value, long ttl, TimeUnit unit) {
        if (ttl <= 0) {
            throw new IllegalArgumentException("TTL must be positive.");
        }
        entries.put(key, new CacheEntry(value, System.nanoTime() + unit.toNanos(ttl)));
    }

    @Override
    public void delete(String key) {
        entries.remove(key);
    }
}
