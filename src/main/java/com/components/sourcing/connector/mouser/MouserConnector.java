package com.components.sourcing.connector.mouser;

import com.components.sourcing.config.ConnectorConfigFactory;
import com.components.sourcing.connector.HttpPriceConnector;
import com.components.sourcing.model.RawOffer;
import com.components.sourcing.model.SourceTypes;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
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

/**
 * <h2>Mouser – Search API v1 connector</h2>
 *
 * <p>POSTs a part-number search to
 * <code>https://api.mouser.com/api/v1/search/partnumber?apiKey=…</code> and
 * maps {@code SearchResults.Parts[*]} into raw offers. Stock is read from the
 * leading number of the {@code Availability} text ("1,234 In Stock"), price
 * from the first price break.</p>
 */
@Slf4j
@Service
@ConditionalOnProperty(prefix = "sourcing.connectors.configs.mouser", name = "enabled",
        havingValue = "true", matchIfMissing = true)
public class MouserConnector extends HttpPriceConnector {

    static final String PLACEHOLDER_KEY = "YOUR_MOUSER_KEY";

    static final String DISTRIBUTOR = "Mouser Electronics (API)";

    public MouserConnector(final ConnectorConfigFactory factory,
                           final WebClient.Builder builder,
                           @Qualifier("sourcingObjectMapper") final ObjectMapper om) {
        super("mouser", factory.forConnector("mouser"), builder, om);
    }

    @Override
    protected boolean isReady() {
        String key = getCfg().getApiKey();
        return StringUtils.isNotBlank(key) && !PLACEHOLDER_KEY.equals(key);
    }

    @Override
    protected List<RawOffer> doFetch(final String query) {
        MultiValueMap<String, String> q = new LinkedMultiValueMap<>();
        q.add("apiKey", getCfg().getApiKey());
        URI uri = buildUri(getCfg().getBaseUrl(), getCfg().getSearchPath(), q);

        ObjectNode body = getMapper().createObjectNode();
        body.putObject("SearchByPartRequest")
                .put("mouserPartNumber", query)
                .put("partSearchOptions", "string");

        return parseResults(postJson(uri, body, h -> { }), query);
    }

    List<RawOffer> parseResults(final JsonNode root, final String query) {
        JsonNode parts = root.path("SearchResults").path("Parts");
        if (!parts.isArray() || parts.isEmpty()) {
            if (root.path("Errors").isArray() && !root.path("Errors").isEmpty()) {
                log.warn("Mouser reported errors: {}", root.path("Errors"));
            }
            return List.of();
        }

        List<RawOffer> offers = new ArrayList<>();
        for (JsonNode item : parts) {
            double price = 0.0;
            String currency = "USD";
            JsonNode breaks = item.path("PriceBreaks");
            if (breaks.isArray() && !breaks.isEmpty()) {
                JsonNode first = breaks.get(0);
                price = parsePrice(textOr(first, "Price", "0"));
                currency = textOr(first, "Currency", "USD");
            }

            offers.add(RawOffer.builder()
                    .put("distributor", DISTRIBUTOR)
                    .put("mpn", textOr(item, "ManufacturerPartNumber", query))
                    .put("manufacturer", textOr(item, "Manufacturer", "Unknown"))
                    .put("stock", parseStock(textOr(item, "Availability", "0")))
                    .put("price", price)
                    .put("currency", currency)
                    .put("condition", "New")
                    .put("risk_level", "Low")
                    .put("source_type", SourceTypes.OFFICIAL_API)
                    .put("datasheet", textOr(item, "DataSheetUrl", ""))
                    .put("description", textOr(item, "Description", ""))
                    .put("date_code", "2024+")
                    .put("delivery", textOr(item, "LeadTime", "In Stock"))
                    .build());
        }
        return offers;
    }

    /**
     * "1,234 In Stock" → 1234; anything without digits → 0.
     */
    static int parseStock(final String availability) {
        String firstToken = availability.trim().split("\\s+")[0];
        String digits = firstToken.replaceAll("\\D", "");
        if (digits.isEmpty()) {
            return 0;
        }
        try {
            return Integer.parseInt(digits);
        } catch (NumberFormatException ex) {
            return Integer.MAX_VALUE;
        }
    }

    /**
     * "$1,234.50" → 1234.5; unreadable → 0.
     */
    static double parsePrice(final String text) {
        String cleaned = text.replace("$", "").replace(",", "").trim();
        try {
            return Double.parseDouble(cleaned);
        } catch (NumberFormatException ex) {
            return 0.0;
        }
    }
}
