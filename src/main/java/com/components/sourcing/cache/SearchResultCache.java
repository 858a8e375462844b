package com.components.sourcing.cache;

import com.components.sourcing.config.CacheProperties;
import com.components.sourcing.model.Offer;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicLong;

/**
 * <h2>SearchResultCache</h2>
 *
 * <p>Time-boxed cache of aggregated search results, keyed by the normalized
 * query and backed by a {@link CacheStore}.</p>
 *
 * <ul>
 *   <li>An entry is a hit while {@code now < expiresAt}. A hit bumps the
 *       entry's {@code searchCount} and {@code lastAccessedAt}; the expiry is
 *       fixed at insertion.</li>
 *   <li>Empty result lists are never stored.</li>
 *   <li>Every operation swallows store failures: lookups report
 *       {@link CacheLookup.Status#UNAVAILABLE}, writes report
 *       {@link CacheWrite#FAILED}, maintenance reports nothing done. A broken
 *       cache only costs latency.</li>
 * </ul>
 */
@Slf4j
@Component
public class SearchResultCache {

    private static final TypeReference<List<Offer>> OFFER_LIST = new TypeReference<>() { };

    private final CacheStore store;

    private final ObjectMapper mapper;

    private final CacheProperties props;

    private final Clock clock;

    private final AtomicLong hits = new AtomicLong();

    private final AtomicLong misses = new AtomicLong();

    private final AtomicLong errors = new AtomicLong();

    private final AtomicLong invalidations = new AtomicLong();

    public SearchResultCache(final CacheStore store,
                             @Qualifier("sourcingObjectMapper") final ObjectMapper mapper,
                             final CacheProperties props,
                             final Clock clock) {
        this.store = store;
        this.mapper = mapper;
        this.props = props;
        this.clock = clock;
        log.info("Search result cache {} (ttl: {})",
                props.isEnabled() ? "enabled" : "disabled", props.getTtl());
    }

    /**
     * Query text to cache key: trimmed and upper-cased, so {@code " lm358 "}
     * and {@code "LM358"} share an entry.
     */
    public static String keyOf(final String query) {
        return query == null ? "" : query.trim().toUpperCase(Locale.ROOT);
    }

    public CacheLookup get(final String query) {
        if (!props.isEnabled()) {
            return CacheLookup.miss();
        }
        String key = keyOf(query);
        try {
            Instant now = clock.instant();
            Optional<CacheEntry> live = store.findLatestLive(key, now);
            if (live.isEmpty()) {
                misses.incrementAndGet();
                log.info("Cache MISS for {}", key);
                return CacheLookup.miss();
            }
            CacheEntry entry = live.get();
            List<Offer> offers = decode(entry);
            int searchCount = store.recordAccess(key, entry.id(), now)
                    .map(CacheEntry::searchCount)
                    .orElse(entry.searchCount());
            hits.incrementAndGet();
            log.info("Cache HIT for {} ({} offers, age {}s, {} searches)",
                    key, offers.size(), Duration.between(entry.createdAt(), now).toSeconds(), searchCount);
            return CacheLookup.hit(offers, searchCount);
        } catch (RuntimeException ex) {
            errors.incrementAndGet();
            log.warn("Cache lookup failed for {}: {}", key, ex.toString());
            return CacheLookup.unavailable();
        }
    }

    public CacheWrite set(final String query, final List<Offer> offers) {
        if (!props.isEnabled()) {
            return CacheWrite.SKIPPED_DISABLED;
        }
        if (offers == null || offers.isEmpty()) {
            return CacheWrite.SKIPPED_EMPTY;
        }
        String key = keyOf(query);
        try {
            String payload = mapper.writeValueAsString(offers);
            store.insert(CacheEntry.create(key, payload, offers.size(), clock.instant(), props.getTtl()));
            log.info("Cached {} offers for {}", offers.size(), key);
            return CacheWrite.STORED;
        } catch (JsonProcessingException | RuntimeException ex) {
            errors.incrementAndGet();
            log.warn("Cache write failed for {}: {}", key, ex.toString());
            return CacheWrite.FAILED;
        }
    }

    /**
     * Drops every entry of the query's key. Calling it twice is harmless.
     *
     * @return {@code false} only when the store failed or caching is disabled
     */
    public boolean invalidate(final String query) {
        if (!props.isEnabled()) {
            return false;
        }
        String key = keyOf(query);
        try {
            int removed = store.deleteByKey(key);
            invalidations.incrementAndGet();
            log.info("Invalidated {} cache entries for {}", removed, key);
            return true;
        } catch (RuntimeException ex) {
            errors.incrementAndGet();
            log.warn("Cache invalidation failed for {}: {}", key, ex.toString());
            return false;
        }
    }

    /**
     * @return number of expired entries removed
     */
    public int cleanupExpired() {
        if (!props.isEnabled()) {
            return 0;
        }
        try {
            int removed = store.deleteExpired(clock.instant());
            log.info("Cache cleanup removed {} expired entries", removed);
            return removed;
        } catch (RuntimeException ex) {
            errors.incrementAndGet();
            log.warn("Cache cleanup failed: {}", ex.toString());
            return 0;
        }
    }

    public CacheStats stats() {
        int live = 0;
        if (props.isEnabled()) {
            try {
                live = store.countLive(clock.instant());
            } catch (RuntimeException ex) {
                errors.incrementAndGet();
                log.warn("Cache stats unavailable: {}", ex.toString());
            }
        }
        return new CacheStats(hits.get(), misses.get(), errors.get(), invalidations.get(), live);
    }

    private List<Offer> decode(final CacheEntry entry) {
        try {
            return mapper.readValue(entry.payload(), OFFER_LIST);
        } catch (JsonProcessingException ex) {
            throw new CacheStoreException("Unreadable payload in entry " + entry.id(), ex);
        }
    }
}
