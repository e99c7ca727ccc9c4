package com.reasonai.infrastructure.cache;

import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Expiry;
import com.github.benmanes.caffeine.cache.Policy;
import com.github.benmanes.caffeine.cache.Ticker;

import java.time.Duration;
import java.util.Optional;

/**
 * In-process cache backed by Caffeine with a per-entry time-to-live.
 * Entries written without a ttl never expire; an overwrite resets the entry's expiry.
 *
 * @param <V> value type
 */
public class MemoryCache<V> implements Cache<V> {

    private final com.github.benmanes.caffeine.cache.Cache<String, V> store;
    private final Policy.VarExpiration<String, V> expiration;

    public MemoryCache() {
        this(Ticker.systemTicker());
    }

    public MemoryCache(Ticker ticker) {
        this.store = Caffeine.newBuilder()
                .ticker(ticker)
                .executor(Runnable::run)
                .expireAfter(new NoExpiry<String, V>())
                .build();
        this.expiration = store.policy().expireVariably()
                .orElseThrow(() -> new CacheException("Variable expiration is not enabled"));
    }

    @Override
    public Optional<V> get(String key) {
        return Optional.ofNullable(store.getIfPresent(requireKey(key)));
    }

    @Override
    public void set(String key, V value, Duration ttl) {
        if (value == null) {
            throw new IllegalArgumentException("Cache values must not be null");
        }
        if (ttl != null && ttl.isNegative()) {
            throw new IllegalArgumentException("ttl must not be negative: " + ttl);
        }
        if (ttl == null) {
            store.put(requireKey(key), value);
        } else {
            expiration.put(requireKey(key), value, ttl);
        }
    }

    @Override
    public void delete(String key) {
        store.invalidate(requireKey(key));
    }

    @Override
    public boolean exists(String key) {
        return get(key).isPresent();
    }

    @Override
    public void clear() {
        store.invalidateAll();
    }

    @Override
    public int size() {
        store.cleanUp();
        return (int) store.estimatedSize();
    }

    private static String requireKey(String key) {
        if (key == null) {
            throw new IllegalArgumentException("Cache key must not be null");
        }
        return key;
    }

    /**
     * Default expiry for plain puts. Entries with a ttl are written through
     * {@link Policy.VarExpiration#put(Object, Object, Duration)} instead.
     */
    private static final class NoExpiry<K, V> implements Expiry<K, V> {

        @Override
        public long expireAfterCreate(K key, V value, long currentTime) {
            return Long.MAX_VALUE;
        }

        @Override
        public long expireAfterUpdate(K key, V value, long currentTime, long currentDuration) {
            return Long.MAX_VALUE;
        }

        @Override
        public long expireAfterRead(K key, V value, long currentTime, long currentDuration) {
            return currentDuration;
        }
    }
}
