package com.components.sourcing.connector;

import com.components.sourcing.model.RawOffer;

import java.util.List;

/**
 * Lowest-tier source, consulted once after a fan-out in which no connector
 * produced a single offer.
 */
@FunctionalInterface
public interface TerminalFallback {

    /**
     * @param query the raw search text
     * @return the offers standing in for an empty result
     */
    List<RawOffer> whenNothingFound(String query);
}
