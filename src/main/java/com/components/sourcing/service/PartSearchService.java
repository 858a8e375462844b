package com.components.sourcing.service;

import com.components.sourcing.cache.CacheLookup;
import com.components.sourcing.cache.SearchResultCache;
import com.components.sourcing.engine.AggregationEngine;
import com.components.sourcing.model.Offer;
import com.components.sourcing.model.SourceTypes;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.util.List;

/**
 * Cache-or-compute entry point for part searches.
 * <p>
 * A live cache entry answers directly. Otherwise the {@link AggregationEngine}
 * runs and its result is written back, unless it holds nothing but the
 * no-results stand-in. Concurrent misses for one query are not coalesced;
 * each runs its own aggregation and the last write wins on the next read.
 * </p>
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class PartSearchService {

    private final SearchResultCache cache;

    private final AggregationEngine engine;

    /**
     * @param query part number or free text, must not be blank
     * @return offers sorted ascending by price
     * @throws IllegalArgumentException if {@code query} is blank; raised on the
     *                                  calling thread before any cache or connector work
     */
    public Mono<List<Offer>> search(final String query) {
        if (StringUtils.isBlank(query)) {
            throw new IllegalArgumentException("Search query must not be blank");
        }
        return Mono.defer(() -> {
            CacheLookup lookup = cache.get(query);
            if (lookup.isHit()) {
                return Mono.just(lookup.offers());
            }
            // connectors get the query exactly as received
            return engine.aggregate(query).doOnNext(offers -> {
                if (isCacheable(offers)) {
                    cache.set(query, offers);
                } else {
                    log.info("Not caching '{}': no live source answered", query);
                }
            });
        });
    }

    static boolean isCacheable(final List<Offer> offers) {
        return offers.stream().anyMatch(o -> !SourceTypes.FALLBACK.equals(o.sourceType()));
    }
}
