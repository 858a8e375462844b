package com.components.sourcing.pricing;

import com.components.sourcing.config.PricingProperties;
import com.components.sourcing.model.Offer;
import lombok.Getter;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Random;

/**
 * <h2>PricingTransform</h2>
 *
 * <p>Turns a source price into the price shown to the buyer:</p>
 * <ol>
 *   <li>USD prices are converted with the configured exchange rate and rounded
 *       to a whole unit of the reporting currency. Any other currency passes
 *       through unconverted.</li>
 *   <li>The source-type margin from the {@link MarginTable} is applied and the
 *       result rounded again.</li>
 * </ol>
 * <p>It also synthesises the short price history used for sparklines.</p>
 */
@Component
public class PricingTransform {

    public static final String USD = "USD";

    private final double exchangeRate;

    @Getter
    private final String reportingCurrency;

    @Getter
    private final MarginTable marginTable;

    private final int historySize;

    private final double historyJitter;

    private final Random random;

    public PricingTransform(final PricingProperties props, final Random random) {
        this.exchangeRate = props.getExchangeRate();
        this.reportingCurrency = props.getReportingCurrency();
        this.marginTable = new MarginTable(props.getMargins(), props.getDefaultMargin());
        this.historySize = props.getHistorySize();
        this.historyJitter = props.getHistoryJitter();
        this.random = random;
    }

    /**
     * @param rawPrice    price as quoted by the source
     * @param rawCurrency currency code of {@code rawPrice}
     * @param sourceType  source-type tag selecting the margin
     * @return final price in the reporting currency
     */
    public double price(final double rawPrice, final String rawCurrency, final String sourceType) {
        double localized = localize(rawPrice, rawCurrency);
        return Math.round(localized * marginTable.marginFor(sourceType));
    }

    /**
     * Currency step only. Only USD is converted; other currencies pass through unchanged.
     */
    public double localize(final double rawPrice, final String rawCurrency) {
        if (USD.equals(rawCurrency)) {
            return Math.round(rawPrice * exchangeRate);
        }
        return rawPrice;
    }

    /**
     * @param price final price
     * @return {@code historySize} values, each {@code round(price * u)} with
     *         {@code u} uniform in {@code [1 - jitter, 1 + jitter]}
     */
    public List<Double> history(final double price) {
        List<Double> points = new ArrayList<>(historySize);
        for (int i = 0; i < historySize; i++) {
            double factor = 1.0 - historyJitter + random.nextDouble() * 2 * historyJitter;
            points.add((double) Math.round(price * factor));
        }
        return points;
    }

    /**
     * Prices a normalized offer whose {@code price}/{@code currency} are still
     * in source terms.
     *
     * @param offer normalizer output
     * @return copy with localized price, reporting currency and a fresh history
     */
    public Offer apply(final Offer offer) {
        double finalPrice = price(offer.price(), offer.currency(), offer.sourceType());
        return offer.withPricing(finalPrice, reportingCurrency, history(finalPrice));
    }
}
