package com.components.sourcing.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

/**
 * Fan-out settings bound from {@code sourcing.aggregation}.
 */
@Data
@Configuration
@ConfigurationProperties(prefix = "sourcing.aggregation")
public class AggregationProperties {

    /**
     * Deadline applied to each connector task unless the connector declares
     * its own. There is no deadline across the whole batch.
     */
    private Duration connectorTimeout = Duration.ofSeconds(12);

    /** Number of connector outcomes kept for the market activity feed. */
    private int activityLogSize = 50;
}
