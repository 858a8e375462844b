package com.components.sourcing.cache;

import java.time.Instant;
import java.util.Optional;
import java.util.UUID;

/**
 * Keyed backing store for cached result sets.
 * <p>
 * Entries are inserted, never upserted: a key may hold several entries and
 * readers pick the most recent live one. Implementations must allow
 * concurrent readers alongside writers of the same key. Any storage problem
 * surfaces as a {@link CacheStoreException}.
 * </p>
 */
public interface CacheStore {

    void insert(CacheEntry entry);

    /**
     * @return the most recently created entry of {@code key} that is live at {@code now}
     */
    Optional<CacheEntry> findLatestLive(String key, Instant now);

    /**
     * Bumps {@code searchCount} and sets {@code lastAccessedAt}.
     *
     * @return the updated entry, or empty if it no longer exists
     */
    Optional<CacheEntry> recordAccess(String key, UUID id, Instant at);

    /**
     * @return number of entries removed (live or expired)
     */
    int deleteByKey(String key);

    /**
     * @return number of entries that were no longer live at {@code now} and got removed
     */
    int deleteExpired(Instant now);

    int countLive(Instant now);
}
