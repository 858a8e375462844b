package com.components.sourcing.connector;

import com.components.sourcing.model.RawOffer;
import com.components.sourcing.model.SourceTypes;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class NoResultsFallbackTest {

    @Test
    void shouldDescribeEmptySearch() {
        // When
        List<RawOffer> offers = new NoResultsFallback().whenNothingFound("XYZ-404");

        // Then
        assertThat(offers).singleElement().satisfies(offer -> assertThat(offer.fields())
                .containsEntry("distributor", NoResultsFallback.DISTRIBUTOR)
                .containsEntry("mpn", "XYZ-404")
                .containsEntry("source_type", SourceTypes.FALLBACK)
                .containsEntry("risk_level", "High")
                .containsEntry("stock", 0)
                .containsEntry("price", 0.0)
                .containsEntry("delivery", "Unavailable"));
    }
}
