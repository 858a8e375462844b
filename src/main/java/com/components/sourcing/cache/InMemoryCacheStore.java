package com.components.sourcing.cache;

import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Single-node {@link CacheStore}.
 * <p>
 * Each key maps to an immutable list of entries in insertion order. Writers
 * replace the list inside {@link ConcurrentHashMap#compute}, which serialises
 * writes per key; readers see a consistent snapshot without locking.
 * </p>
 */
@Component
public class InMemoryCacheStore implements CacheStore {

    private final Map<String, List<CacheEntry>> entries = new ConcurrentHashMap<>();

    @Override
    public void insert(final CacheEntry entry) {
        entries.compute(entry.key(), (key, current) -> {
            List<CacheEntry> next = current == null ? new ArrayList<>(1) : new ArrayList<>(current);
            next.add(entry);
            return List.copyOf(next);
        });
    }

    @Override
    public Optional<CacheEntry> findLatestLive(final String key, final Instant now) {
        List<CacheEntry> snapshot = entries.getOrDefault(key, List.of());
        CacheEntry latest = null;
        for (CacheEntry entry : snapshot) {
            if (entry.isLive(now) && (latest == null || !entry.createdAt().isBefore(latest.createdAt()))) {
                latest = entry;
            }
        }
        return Optional.ofNullable(latest);
    }

    @Override
    public Optional<CacheEntry> recordAccess(final String key, final UUID id, final Instant at) {
        AtomicReference<CacheEntry> updated = new AtomicReference<>();
        entries.computeIfPresent(key, (k, current) -> {
            List<CacheEntry> next = new ArrayList<>(current.size());
            for (CacheEntry entry : current) {
                if (entry.id().equals(id)) {
                    CacheEntry touched = entry.withAccess(at);
                    updated.set(touched);
                    next.add(touched);
                } else {
                    next.add(entry);
                }
            }
            return List.copyOf(next);
        });
        return Optional.ofNullable(updated.get());
    }

    @Override
    public int deleteByKey(final String key) {
        List<CacheEntry> removed = entries.remove(key);
        return removed == null ? 0 : removed.size();
    }

    @Override
    public int deleteExpired(final Instant now) {
        AtomicInteger removed = new AtomicInteger();
        for (String key : entries.keySet()) {
            entries.computeIfPresent(key, (k, current) -> {
                List<CacheEntry> live = current.stream().filter(e -> e.isLive(now)).toList();
                removed.addAndGet(current.size() - live.size());
                return live.isEmpty() ? null : live;
            });
        }
        return removed.get();
    }

    @Override
    public int countLive(final Instant now) {
        int count = 0;
        for (List<CacheEntry> list : entries.values()) {
            for (CacheEntry entry : list) {
                if (entry.isLive(now)) {
                    count++;
                }
            }
        }
        return count;
    }
}
