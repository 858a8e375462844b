package com.components.sourcing.connector;

import com.components.sourcing.model.RawOffer;

import java.time.Duration;
import java.util.List;
import java.util.Optional;

/**
 * Defines the contract every upstream source implements: quote a part number.
 * <p>
 * Implementations encapsulate whatever the source needs (an authenticated
 * API, a scraped page, an AI extraction step or a static deep link) and
 * return loosely-typed {@link RawOffer}s with source-specific field names.
 * </p>
 */
public interface PriceConnector {

    /**
     * @return short identifier used in logs and diagnostics, e.g. {@code "mouser"}
     */
    String name();

    /**
     * Looks up offers for the given query.
     * <p>
     * Must not throw: transport, auth and parsing problems are logged and
     * turned into an empty list. The aggregation engine still guards every
     * call, so a connector that breaks this rule only loses its own offers.
     * </p>
     *
     * @param query the raw search text, passed through unchanged
     * @return a non-null, possibly empty list of offers
     */
    List<RawOffer> fetchPrices(String query);

    /**
     * @return a deadline tighter or looser than the engine default, if this
     *         connector needs one
     */
    default Optional<Duration> timeout() {
        return Optional.empty();
    }
}
