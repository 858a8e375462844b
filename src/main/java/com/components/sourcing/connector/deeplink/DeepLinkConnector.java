package com.components.sourcing.connector.deeplink;

import com.components.sourcing.config.DeepLinkProperties;
import com.components.sourcing.config.DeepLinkProperties.DeepLink;
import com.components.sourcing.connector.PriceConnector;
import com.components.sourcing.model.RawOffer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Service;

import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Locale;

/**
 * Answers every query with one "check the website" stub per configured
 * distributor (Arrow, Future, RS, Rochester, Flip…). No network traffic;
 * the {@code datasheet} field carries the distributor's search link.
 */
@Slf4j
@Service
@ConditionalOnProperty(prefix = "sourcing.connectors.configs.deeplinks", name = "enabled",
        havingValue = "true", matchIfMissing = true)
public class DeepLinkConnector implements PriceConnector {

    static final String QUERY_PLACEHOLDER = "{query}";

    private final List<DeepLink> links;

    public DeepLinkConnector(final DeepLinkProperties props) {
        this.links = List.copyOf(props.getDeepLinks());
        log.info("Registered deep links: {}", links.stream().map(DeepLink::getDistributor).toList());
    }

    @Override
    public String name() {
        return "deeplinks";
    }

    @Override
    public List<RawOffer> fetchPrices(final String query) {
        if (query == null || query.isBlank()) {
            return List.of();
        }
        String mpn = query.trim().toUpperCase(Locale.ROOT);
        String encoded = URLEncoder.encode(query.trim(), StandardCharsets.UTF_8);
        return links.stream()
                .map(link -> RawOffer.builder()
                        .put("distributor", link.getDistributor())
                        .put("mpn", mpn)
                        .put("manufacturer", link.getManufacturer())
                        .put("stock", link.getStock())
                        .put("price", 0.0)
                        .put("currency", "USD")
                        .put("condition", link.getCondition())
                        .put("risk_level", "Low")
                        .put("source_type", link.getSourceType())
                        .put("description", link.getDescription())
                        .put("delivery", link.getDelivery())
                        .put("datasheet", link.getUrlTemplate() == null
                                ? "" : link.getUrlTemplate().replace(QUERY_PLACEHOLDER, encoded))
                        .build())
                .toList();
    }
}
