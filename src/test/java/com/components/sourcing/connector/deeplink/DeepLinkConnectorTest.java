package com.components.sourcing.connector.deeplink;

import com.components.sourcing.config.DeepLinkProperties;
import com.components.sourcing.config.DeepLinkProperties.DeepLink;
import com.components.sourcing.model.RawOffer;
import com.components.sourcing.model.SourceTypes;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class DeepLinkConnectorTest {

    private DeepLinkConnector connector;

    @BeforeEach
    void setUp() {
        DeepLink rs = new DeepLink();
        rs.setDistributor("RS Components");
        rs.setUrlTemplate("https://uk.rs-online.com/web/c/?searchTerm={query}");

        DeepLink rochester = new DeepLink();
        rochester.setDistributor("Rochester Electronics (EOL)");
        rochester.setUrlTemplate("https://www.rocelec.com/search?q={query}");
        rochester.setSourceType(SourceTypes.EOL_PARTNER);
        rochester.setCondition("Authorized EOL");
        rochester.setStock(0);

        DeepLinkProperties props = new DeepLinkProperties();
        props.setDeepLinks(List.of(rs, rochester));
        connector = new DeepLinkConnector(props);
    }

    @Test
    void shouldAnswerOneStubPerDistributor() {
        // When
        List<RawOffer> offers = connector.fetchPrices("lm358 dr");

        // Then
        assertThat(offers).hasSize(2);
        assertThat(offers.get(0).fields())
                .containsEntry("distributor", "RS Components")
                .containsEntry("mpn", "LM358 DR")
                .containsEntry("stock", -1)
                .containsEntry("source_type", SourceTypes.DEEP_LINK)
                .containsEntry("delivery", "Check Website")
                .containsEntry("datasheet", "https://uk.rs-online.com/web/c/?searchTerm=lm358+dr");
        assertThat(offers.get(1).fields())
                .containsEntry("source_type", SourceTypes.EOL_PARTNER)
                .containsEntry("condition", "Authorized EOL")
                .containsEntry("stock", 0)
                .containsEntry("datasheet", "https://www.rocelec.com/search?q=lm358+dr");
    }

    @Test
    void shouldIgnoreBlankQuery() {
        assertThat(connector.fetchPrices(" ")).isEmpty();
        assertThat(connector.timeout()).isEmpty();
    }
}
