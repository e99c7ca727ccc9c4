package com.reasonai.infrastructure.cache;

/**
 * Storage-layer fault. Callers treat it as a cache miss.
 */
public class CacheException extends RuntimeException {

    public CacheException(String message) {
        super(message);
    }

    public CacheException(String message, Throwable cause) {
        super(message, cause);
    }
}
