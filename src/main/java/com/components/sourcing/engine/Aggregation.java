package com.components.sourcing.engine;

import com.components.sourcing.connector.ConnectorResult;
import com.components.sourcing.model.Offer;

import java.util.List;

/**
 * Result of one fan-out: the sorted offers plus every connector outcome.
 *
 * @param offers   offers sorted ascending by price
 * @param outcomes one entry per connector, in declaration order
 * @param fallbackUsed whether the terminal fallback replaced an empty result
 */
public record Aggregation(List<Offer> offers, List<ConnectorResult> outcomes, boolean fallbackUsed) {

    public Aggregation {
        offers = List.copyOf(offers);
        outcomes = List.copyOf(outcomes);
    }

    public long failedConnectors() {
        return outcomes.stream().filter(o -> !o.isSuccess()).count();
    }
}
