package com.components.sourcing.pricing;

import com.components.sourcing.config.PricingProperties;
import com.components.sourcing.model.Offer;
import com.components.sourcing.model.RiskLevel;
import com.components.sourcing.model.SourceTypes;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.Random;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class PricingTransformTest {

    private PricingTransform pricing;

    @BeforeEach
    void setUp() {
        pricing = new PricingTransform(new PricingProperties(), new Random(42));
    }

    @Test
    void shouldConvertUsdAndApplyApiMargin() {
        // 10 USD -> 14 500 KRW -> x1.12
        assertThat(pricing.price(10.0, "USD", SourceTypes.API)).isEqualTo(16240.0);
    }

    @Test
    void shouldApplyMetaScraperMargin() {
        // 64.20 USD -> 93 090 KRW -> x1.25
        assertThat(pricing.price(64.20, "USD", SourceTypes.META_SCRAPER)).isEqualTo(116363.0);
    }

    @Test
    void shouldUseDefaultMarginForUnknownSourceType() {
        assertThat(pricing.price(10.0, "USD", "FindChips (AI Parsed)")).isEqualTo(16675.0);
        assertThat(pricing.price(10.0, "USD", null)).isEqualTo(16675.0);
    }

    @Test
    void shouldPassNonUsdPricesThroughUnconverted() {
        assertThat(pricing.localize(20000.0, "KRW")).isEqualTo(20000.0);
        assertThat(pricing.price(100.0, "EUR", SourceTypes.API)).isEqualTo(112.0);
    }

    @Test
    void shouldKeepZeroPriceAtZero() {
        assertThat(pricing.price(0.0, "USD", SourceTypes.DEEP_LINK)).isZero();
    }

    @Test
    void shouldProduceSevenHistoryPointsWithinJitterBand() {
        // Given
        double price = 16240.0;

        // When
        List<Double> history = pricing.history(price);

        // Then
        assertThat(history).hasSize(7).allSatisfy(point -> {
            assertThat(point).isBetween(price * 0.85 - 0.5, price * 1.15 + 0.5);
            assertThat(point).isCloseTo(Math.rint(point), within(0.0));
        });
    }

    @Test
    void shouldPriceOfferIntoReportingCurrency() {
        // Given
        Offer offer = new Offer("abc123def456", "LM358", "TI", "Mouser", SourceTypes.API, 100,
                10.0, List.of(), "USD", "In Stock", "New", "2024+", false, RiskLevel.LOW,
                Instant.EPOCH, "", "");

        // When
        Offer priced = pricing.apply(offer);

        // Then
        assertThat(priced.price()).isEqualTo(16240.0);
        assertThat(priced.currency()).isEqualTo("KRW");
        assertThat(priced.priceHistory()).hasSize(7);
        assertThat(priced.id()).isEqualTo(offer.id());
        assertThat(priced.stock()).isEqualTo(100);
    }

    @Test
    void shouldExposeConfiguredMarginTable() {
        MarginTable table = pricing.getMarginTable();

        assertThat(table.entries())
                .containsEntry(SourceTypes.META_SCRAPER, 1.25)
                .containsEntry(SourceTypes.DIRECT_SCRAPER, 1.18)
                .containsEntry(SourceTypes.API, 1.12)
                .containsEntry(SourceTypes.OFFICIAL_API, 1.10)
                .containsEntry(SourceTypes.DEEP_LINK, 1.05)
                .containsEntry(SourceTypes.EOL_PARTNER, 1.20)
                .containsEntry(SourceTypes.FALLBACK, 1.00);
        assertThat(table.defaultMargin()).isEqualTo(1.15);
    }
}
