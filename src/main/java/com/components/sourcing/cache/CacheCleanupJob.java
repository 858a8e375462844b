package com.components.sourcing.cache;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Periodically purges expired cache entries.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class CacheCleanupJob {

    private final SearchResultCache cache;

    @Scheduled(initialDelayString = "${sourcing.cache.cleanup-interval:PT1H}",
            fixedDelayString = "${sourcing.cache.cleanup-interval:PT1H}")
    public void purgeExpired() {
        int removed = cache.cleanupExpired();
        log.debug("Scheduled cache cleanup removed {} entries. {}", removed, cache.stats().summary());
    }
}
