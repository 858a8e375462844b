package com.components.sourcing.config;

import com.components.sourcing.model.SourceTypes;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Pricing parameters bound from {@code sourcing.pricing}.
 *
 * <p>Example application.yml snippet:
 * <pre>
 * sourcing:
 *   pricing:
 *     exchange-rate: 1450.0
 *     reporting-currency: KRW
 *     default-margin: 1.15
 *     margins:
 *       "[Meta Scraper]": 1.25
 *       "[API]": 1.12
 * </pre>
 * Source types containing spaces need the bracket notation shown above.</p>
 */
@Data
@Validated
@Configuration
@ConfigurationProperties(prefix = "sourcing.pricing")
public class PricingProperties {

    /** Units of reporting currency per USD. */
    @DecimalMin("0.0")
    private double exchangeRate = 1450.0;

    /** Currency every {@code Offer} is reported in after pricing. */
    @NotBlank
    private String reportingCurrency = "KRW";

    /** Margin for source types missing from {@link #margins}. */
    @DecimalMin("0.0")
    private double defaultMargin = 1.15;

    /** Source type → margin multiplier. */
    private Map<String, Double> margins = defaultMargins();

    /** Number of synthetic price-history points. */
    @Min(1)
    private int historySize = 7;

    /** Maximum relative deviation of a history point from the price. */
    @DecimalMin("0.0")
    private double historyJitter = 0.15;

    public static Map<String, Double> defaultMargins() {
        Map<String, Double> margins = new LinkedHashMap<>();
        margins.put(SourceTypes.META_SCRAPER, 1.25);
        margins.put(SourceTypes.DIRECT_SCRAPER, 1.18);
        margins.put(SourceTypes.API, 1.12);
        margins.put(SourceTypes.OFFICIAL_API, 1.10);
        margins.put(SourceTypes.DEEP_LINK, 1.05);
        margins.put(SourceTypes.EOL_PARTNER, 1.20);
        margins.put(SourceTypes.FALLBACK, 1.00);
        return margins;
    }
}
