package com.components.sourcing.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.List;

/**
 * Canonical, post-normalization quote for one part from one source.
 * <p>
 * Immutable; pricing produces a new instance through {@link #withPricing}.
 * A negative {@code stock} means "unknown, see distributor".
 * {@code priceHistory} is synthetic jitter around {@code price} for UI
 * sparklines, not recorded history.
 * </p>
 */
public record Offer(
        @JsonProperty("id") String id,
        @JsonProperty("mpn") String mpn,
        @JsonProperty("manufacturer") String manufacturer,
        @JsonProperty("distributor") String distributor,
        @JsonProperty("source_type") String sourceType,
        @JsonProperty("stock") int stock,
        @JsonProperty("price") double price,
        @JsonProperty("price_history") List<Double> priceHistory,
        @JsonProperty("currency") String currency,
        @JsonProperty("delivery") String delivery,
        @JsonProperty("condition") String condition,
        @JsonProperty("date_code") String dateCode,
        @JsonProperty("is_eol") boolean eol,
        @JsonProperty("risk_level") RiskLevel riskLevel,
        @JsonProperty("updated_at") Instant updatedAt,
        @JsonProperty("datasheet") String datasheet,
        @JsonProperty("description") String description
) {

    public Offer {
        priceHistory = (priceHistory == null) ? List.of() : List.copyOf(priceHistory);
    }

    /**
     * @param localizedPrice price in the reporting currency, margin included
     * @param reportingCurrency currency code of {@code localizedPrice}
     * @param history synthetic history around {@code localizedPrice}
     * @return a copy carrying the localized price data
     */
    public Offer withPricing(final double localizedPrice,
                             final String reportingCurrency,
                             final List<Double> history) {
        return new Offer(id, mpn, manufacturer, distributor, sourceType, stock,
                localizedPrice, history, reportingCurrency, delivery, condition,
                dateCode, eol, riskLevel, updatedAt, datasheet, description);
    }
}
