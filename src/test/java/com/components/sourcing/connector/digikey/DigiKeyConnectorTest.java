package com.components.sourcing.connector.digikey;

import com.components.sourcing.config.ConnectorCfg;
import com.components.sourcing.config.ConnectorConfigFactory;
import com.components.sourcing.config.JacksonSourcingConfig;
import com.components.sourcing.model.RawOffer;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.web.reactive.function.client.WebClient;

import java.time.Clock;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class DigiKeyConnectorTest {

    @Mock
    private ConnectorConfigFactory factory;

    private final ObjectMapper mapper = JacksonSourcingConfig.newMapper();

    private DigiKeyConnector connector;

    @BeforeEach
    void setUp() {
        ConnectorCfg cfg = new ConnectorCfg();
        cfg.setBaseUrl("https://api.digikey.com");
        cfg.setSearchPath("/products/v4/search/keyword");
        cfg.setTokenUrl("https://api.digikey.com/v1/oauth2/token");
        when(factory.forConnector("digikey")).thenReturn(cfg);
        connector = new DigiKeyConnector(factory, WebClient.builder(), mapper, Clock.systemUTC());
    }

    @Test
    void shouldParseKeywordSearchProducts() throws Exception {
        // Given
        var root = mapper.readTree("""
                {
                  "Products": [
                    {
                      "ManufacturerProductNumber": "STM32F103C8T6",
                      "Manufacturer": {"Name": "STMicroelectronics"},
                      "QuantityAvailable": 5120,
                      "UnitPrice": 4.87,
                      "DatasheetUrl": "https://www.st.com/resource/en/datasheet/stm32f103c8.pdf",
                      "Description": {"ProductDescription": "IC MCU 32BIT 64KB FLASH 48LQFP"}
                    },
                    {
                      "ManufacturerProductNumber": "STM32F103C8T7",
                      "Manufacturer": {"Name": "STMicroelectronics"},
                      "QuantityAvailable": 0,
                      "UnitPrice": 0
                    }
                  ]
                }
                """);

        // When
        List<RawOffer> offers = connector.parseResults(root, "STM32F103");

        // Then
        assertThat(offers).hasSize(2);
        assertThat(offers.get(0).fields())
                .containsEntry("distributor", "Digi-Key Electronics (API)")
                .containsEntry("mpn", "STM32F103C8T6")
                .containsEntry("manufacturer", "STMicroelectronics")
                .containsEntry("stock", 5120)
                .containsEntry("price", 4.87)
                .containsEntry("description", "IC MCU 32BIT 64KB FLASH 48LQFP")
                .containsEntry("delivery", "Immediate");
        assertThat(offers.get(1).fields())
                .containsEntry("price", 0.0)
                .containsEntry("delivery", "Backorder");
    }

    @Test
    void shouldReturnNothingWhenProductsMissing() throws Exception {
        assertThat(connector.parseResults(mapper.readTree("{\"ProductsCount\": 0}"), "X")).isEmpty();
    }

    @Test
    void shouldSkipCallWithoutClientCredentials() {
        assertThat(connector.fetchPrices("STM32F103")).isEmpty();
    }
}
