package com.components.sourcing.connector;

import com.components.sourcing.model.RawOffer;
import com.components.sourcing.model.SourceTypes;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Answers a search that no distributor could serve with a single
 * "no results found" offer, so callers always get something to show.
 * This is the only place where data is fabricated.
 */
@Slf4j
@Component
public class NoResultsFallback implements TerminalFallback {

    static final String DISTRIBUTOR = "System (No Results)";

    @Override
    public List<RawOffer> whenNothingFound(final String query) {
        log.warn("No source returned offers for '{}', substituting placeholder", query);
        return List.of(RawOffer.builder()
                .put("distributor", DISTRIBUTOR)
                .put("mpn", query)
                .put("manufacturer", "N/A")
                .put("stock", 0)
                .put("price", 0.0)
                .put("currency", "USD")
                .put("condition", "Unknown")
                .put("risk_level", "High")
                .put("source_type", SourceTypes.FALLBACK)
                .put("description", "No stock found in verified distributors.")
                .put("delivery", "Unavailable")
                .put("date_code", "N/A")
                .build());
    }
}
