package com.components.sourcing.cache;

/**
 * Raised by a {@link CacheStore} when the backing storage cannot serve a call.
 */
public class CacheStoreException extends RuntimeException {

    public CacheStoreException(final String message) {
        super(message);
    }

    public CacheStoreException(final String message, final Throwable cause) {
        super(message, cause);
    }
}
