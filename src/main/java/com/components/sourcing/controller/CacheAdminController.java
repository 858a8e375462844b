package com.components.sourcing.controller;

import com.components.sourcing.cache.CacheStats;
import com.components.sourcing.cache.SearchResultCache;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

/**
 * Maintenance endpoints for the search-result cache.
 * <ul>
 *   <li><code>DELETE /cache/{query}</code>: drop every entry of a query (204, or 503 when the store failed)</li>
 *   <li><code>POST /cache/cleanup</code>: purge expired entries now, returns <code>{"removed": n}</code></li>
 *   <li><code>GET /cache/stats</code>: hit/miss counters and live entry count</li>
 * </ul>
 */
@RestController
@RequestMapping("/cache")
@RequiredArgsConstructor
public class CacheAdminController {

    private final SearchResultCache cache;

    @DeleteMapping("/{query}")
    public ResponseEntity<Void> invalidate(@PathVariable("query") final String query) {
        if (cache.invalidate(query)) {
            return ResponseEntity.noContent().build();
        }
        return ResponseEntity.status(503).build();
    }

    @PostMapping("/cleanup")
    public Map<String, Integer> cleanup() {
        return Map.of("removed", cache.cleanupExpired());
    }

    @GetMapping("/stats")
    public CacheStats stats() {
        return cache.stats();
    }
}
