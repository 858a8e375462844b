package com.components.sourcing.cache;

import java.time.Instant;
import java.util.UUID;

/**
 * One cached result set as held by a {@link CacheStore}.
 *
 * @param id             store-wide identity
 * @param key            normalized query (trimmed, upper-cased)
 * @param payload        serialized offer list
 * @param sourceCount    number of offers in {@code payload}
 * @param createdAt      insertion time
 * @param expiresAt      {@code createdAt + ttl}; never changes
 * @param lastAccessedAt time of the latest hit, {@code createdAt} initially
 * @param searchCount    1 at creation, +1 per hit
 */
public record CacheEntry(
        UUID id,
        String key,
        String payload,
        int sourceCount,
        Instant createdAt,
        Instant expiresAt,
        Instant lastAccessedAt,
        int searchCount
) {

    public static CacheEntry create(final String key,
                                    final String payload,
                                    final int sourceCount,
                                    final Instant now,
                                    final java.time.Duration ttl) {
        return new CacheEntry(UUID.randomUUID(), key, payload, sourceCount,
                now, now.plus(ttl), now, 1);
    }

    /**
     * @return {@code true} while {@code now} is strictly before the expiry
     */
    public boolean isLive(final Instant now) {
        return now.isBefore(expiresAt);
    }

    public CacheEntry withAccess(final Instant at) {
        return new CacheEntry(id, key, payload, sourceCount, createdAt, expiresAt, at, searchCount + 1);
    }
}
