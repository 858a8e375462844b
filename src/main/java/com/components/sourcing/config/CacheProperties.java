package com.components.sourcing.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

/**
 * Search-result cache settings bound from {@code sourcing.cache}.
 */
@Data
@Configuration
@ConfigurationProperties(prefix = "sourcing.cache")
public class CacheProperties {

    /** When {@code false} every lookup misses and every write is skipped. */
    private boolean enabled = true;

    /** Lifetime of a cached result set. */
    private Duration ttl = Duration.ofHours(1);

    /** Delay between two runs of the expired-entry cleanup. */
    private Duration cleanupInterval = Duration.ofHours(1);
}
