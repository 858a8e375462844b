package com.components.sourcing.connector.winsource;

import com.components.sourcing.config.ConnectorConfigFactory;
import com.components.sourcing.connector.HttpPriceConnector;
import com.components.sourcing.model.RawOffer;
import com.components.sourcing.model.SourceTypes;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Service;
import org.springframework.util.LinkedMultiValueMap;
import org.springframework.util.MultiValueMap;
import org.springframework.web.reactive.function.client.WebClient;

import java.net.URI;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * <h2>Win Source connector</h2>
 *
 * <p>Queries the Win Source search API with a bearer token. Without a token
 * it answers with a single demo offer so the dashboard still shows a broker
 * row.</p>
 */
@Slf4j
@Service
@ConditionalOnProperty(prefix = "sourcing.connectors.configs.winsource", name = "enabled",
        havingValue = "true", matchIfMissing = true)
public class WinSourceConnector extends HttpPriceConnector {

    public WinSourceConnector(final ConnectorConfigFactory factory,
                              final WebClient.Builder builder,
                              @Qualifier("sourcingObjectMapper") final ObjectMapper om) {
        super("winsource", factory.forConnector("winsource"), builder, om);
    }

    @Override
    protected List<RawOffer> doFetch(final String query) {
        String token = getCfg().getAccessToken();
        if (StringUtils.isBlank(token)) {
            log.info("Win Source access token missing, serving demo offer for '{}'", query);
            return demoOffers(query);
        }

        MultiValueMap<String, String> q = new LinkedMultiValueMap<>();
        q.add("q", query);
        URI uri = buildUri(getCfg().getBaseUrl(), getCfg().getSearchPath(), q);

        return parseResults(getJson(uri, h -> h.setBearerAuth(token)), query);
    }

    List<RawOffer> parseResults(final JsonNode root, final String query) {
        JsonNode items = root.path("results");
        if (!items.isArray()) {
            return List.of();
        }
        List<RawOffer> offers = new ArrayList<>();
        for (JsonNode item : items) {
            offers.add(RawOffer.builder()
                    .put("distributor", "Win Source")
                    .put("mpn", textOr(item, "part_number", query))
                    .put("manufacturer", textOr(item, "manufacturer", "Unknown"))
                    .put("stock", item.path("stock_quantity").asInt(0))
                    .put("price", item.path("price").asDouble(0.0))
                    .put("currency", textOr(item, "currency", "USD"))
                    .put("condition", "New")
                    .put("risk_level", "Low")
                    .put("source_type", SourceTypes.OFFICIAL_API)
                    .put("datasheet", textOr(item, "datasheet", ""))
                    .put("description", textOr(item, "description", ""))
                    .put("date_code", textOr(item, "datecode", "2023+"))
                    .put("delivery", "3-5 Days")
                    .build());
        }
        return offers;
    }

    List<RawOffer> demoOffers(final String query) {
        return List.of(RawOffer.builder()
                .put("distributor", "Win Source Electronics")
                .put("mpn", query.toUpperCase(Locale.ROOT))
                .put("manufacturer", "Various")
                .put("stock", 850)
                .put("price", 15.20)
                .put("currency", "USD")
                .put("condition", "New Original")
                .put("risk_level", "Low")
                .put("source_type", "Official API (Demo)")
                .put("description", "High reliability component")
                .put("delivery", "2-3 Days")
                .put("date_code", "2024")
                .put("datasheet", "https://www.win-source.net/")
                .build());
    }
}
