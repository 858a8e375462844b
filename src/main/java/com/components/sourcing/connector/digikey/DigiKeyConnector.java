package com.components.sourcing.connector.digikey;

import com.components.sourcing.config.ConnectorCfg;
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
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicReference;

/**
 * <h2>Digi-Key – Product Information API v4 connector</h2>
 *
 * <p>Authenticates with the OAuth2 client-credentials grant, caches the
 * access token until one minute before it expires, then runs a keyword
 * search and maps {@code Products[*]} into raw offers.</p>
 */
@Slf4j
@Service
@ConditionalOnProperty(prefix = "sourcing.connectors.configs.digikey", name = "enabled",
        havingValue = "true", matchIfMissing = true)
public class DigiKeyConnector extends HttpPriceConnector {

    static final String DISTRIBUTOR = "Digi-Key Electronics (API)";

    /** Token is refreshed this many seconds before the server-side expiry. */
    private static final long EXPIRY_MARGIN_SECONDS = 60;

    private final Clock clock;

    private final AtomicReference<AccessToken> token = new AtomicReference<>();

    record AccessToken(String value, Instant expiresAt) {
    }

    public DigiKeyConnector(final ConnectorConfigFactory factory,
                            final WebClient.Builder builder,
                            @Qualifier("sourcingObjectMapper") final ObjectMapper om,
                            final Clock clock) {
        super("digikey", factory.forConnector("digikey"), builder, om);
        this.clock = clock;
    }

    @Override
    protected boolean isReady() {
        return StringUtils.isNoneBlank(getCfg().getClientId(), getCfg().getClientSecret());
    }

    @Override
    protected List<RawOffer> doFetch(final String query) {
        String bearer = accessToken();
        if (bearer == null) {
            log.warn("Skipping Digi-Key: no access token");
            return List.of();
        }

        ConnectorCfg cfg = getCfg();
        URI uri = buildUri(cfg.getBaseUrl(), cfg.getSearchPath(), null);
        Map<String, Object> body = Map.of("Keywords", query, "Limit", cfg.getLimit());

        JsonNode rsp = postJson(uri, body, h -> {
            h.setBearerAuth(bearer);
            h.set("X-DIGIKEY-Client-Id", cfg.getClientId());
            h.set("X-DIGIKEY-Locale-Site", "US");
            h.set("X-DIGIKEY-Locale-Language", "en");
        });
        return parseResults(rsp, query);
    }

    /**
     * @return a valid bearer token, fetching a new one when the cached token
     *         is missing or about to expire; {@code null} if the exchange failed
     */
    String accessToken() {
        AccessToken current = token.get();
        Instant now = Instant.now(clock);
        if (current != null && now.isBefore(current.expiresAt())) {
            return current.value();
        }

        MultiValueMap<String, String> form = new LinkedMultiValueMap<>();
        form.add("grant_type", "client_credentials");
        form.add("client_id", getCfg().getClientId());
        form.add("client_secret", getCfg().getClientSecret());

        try {
            JsonNode rsp = postForm(URI.create(getCfg().getTokenUrl()), form);
            String value = textOr(rsp, "access_token", null);
            if (value == null) {
                log.warn("Digi-Key token response carried no access_token");
                return null;
            }
            long expiresIn = rsp.path("expires_in").asLong(3600);
            token.set(new AccessToken(value, now.plusSeconds(expiresIn - EXPIRY_MARGIN_SECONDS)));
            return value;
        } catch (RuntimeException ex) {
            log.warn("Digi-Key token exchange failed: {}", ex.toString());
            return null;
        }
    }

    List<RawOffer> parseResults(final JsonNode root, final String query) {
        JsonNode products = root.path("Products");
        if (!products.isArray() || products.isEmpty()) {
            return List.of();
        }

        List<RawOffer> offers = new ArrayList<>();
        for (JsonNode item : products) {
            double unitPrice = item.path("UnitPrice").asDouble(0.0);
            int stock = item.path("QuantityAvailable").asInt(0);
            offers.add(RawOffer.builder()
                    .put("distributor", DISTRIBUTOR)
                    .put("mpn", textOr(item, "ManufacturerProductNumber",
                            textOr(item, "ManufacturerPartNumber", query)))
                    .put("manufacturer", textOr(item.path("Manufacturer"), "Name",
                            textOr(item.path("Manufacturer"), "Value", "Unknown")))
                    .put("stock", stock)
                    .put("price", unitPrice > 0 ? unitPrice : 0.0)
                    .put("currency", "USD")
                    .put("condition", "New")
                    .put("risk_level", "Low")
                    .put("source_type", SourceTypes.OFFICIAL_API)
                    .put("datasheet", textOr(item, "DatasheetUrl", ""))
                    .put("description", textOr(item.path("Description"), "ProductDescription",
                            textOr(item, "ProductDescription", "")))
                    .put("date_code", "2024+")
                    .put("delivery", stock > 0 ? "Immediate" : "Backorder")
                    .build());
        }
        return offers;
    }
}
