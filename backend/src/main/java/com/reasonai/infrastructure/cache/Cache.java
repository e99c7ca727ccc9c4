package com.reasonai.infrastructure.cache;

import java.time.Duration;
import java.util.Optional;

/**
 * Key/value store with per-entry expiry, shared by concurrent pipeline runs.
 * Implementations must be linearizable per key.
 *
 * @param <V> value type
 */
public interface Cache<V> {

    /**
     * @return the value, or empty when the key is missing or its entry has expired
     */
    Optional<V> get(String key);

    /**
     * Store a value that never expires.
     */
    default void set(String key, V value) {
        set(key, value, null);
    }

    /**
     * @param ttl time-to-live, {@code null} for no expiry
     */
    void set(String key, V value, Duration ttl);

    void delete(String key);

    /**
     * Same expiry check as {@link #get(String)}.
     */
    boolean exists(String key);

    /**
     * Remove every entry, expired or not.
     */
    void clear();

    int size();
}
