package com.components.sourcing.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.List;

/**
 * Dashboard snapshot of the secondary market. Apart from {@code recentLogs}
 * (taken from recent connector activity) the figures are synthetic.
 */
public record MarketStatus(
        @JsonProperty("market_temperature") String marketTemperature,
        @JsonProperty("global_stock_index") int globalStockIndex,
        @JsonProperty("active_brokers") int activeBrokers,
        @JsonProperty("price_drift") double priceDrift,
        @JsonProperty("last_sync") Instant lastSync,
        @JsonProperty("recent_logs") List<String> recentLogs
) {
}
