package com.components.sourcing.connector.findchips;

import com.components.sourcing.ai.HtmlOfferExtractor;
import com.components.sourcing.config.ConnectorConfigFactory;
import com.components.sourcing.connector.HttpPriceConnector;
import com.components.sourcing.model.RawOffer;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Service;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.util.UriComponentsBuilder;

import java.net.URI;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * <h2>FindChips – scraped meta-search with AI extraction</h2>
 *
 * <p>Downloads <code>https://www.findchips.com/search/{mpn}</code> and lets
 * {@link HtmlOfferExtractor} turn the result table into rows. Each extracted
 * row becomes one raw offer tagged {@code "FindChips (AI Parsed)"}.</p>
 */
@Slf4j
@Service
@ConditionalOnProperty(prefix = "sourcing.connectors.configs.findchips", name = "enabled",
        havingValue = "true", matchIfMissing = true)
public class FindChipsConnector extends HttpPriceConnector {

    static final String SOURCE_TYPE = "FindChips (AI Parsed)";

    private final HtmlOfferExtractor extractor;

    public FindChipsConnector(final ConnectorConfigFactory factory,
                              final WebClient.Builder builder,
                              @Qualifier("sourcingObjectMapper") final ObjectMapper om,
                              final HtmlOfferExtractor extractor) {
        super("findchips", factory.forConnector("findchips"), builder, om);
        this.extractor = extractor;
    }

    @Override
    protected boolean isReady() {
        return extractor.isEnabled();
    }

    @Override
    protected List<RawOffer> doFetch(final String query) {
        URI uri = searchUri(query);
        String html = getHtml(uri);
        return toOffers(extractor.extract(html, query), query, uri);
    }

    URI searchUri(final String query) {
        return UriComponentsBuilder.fromUriString(getCfg().getBaseUrl())
                .path(getCfg().getSearchPath())
                .pathSegment(query)
                .encode()
                .build()
                .toUri();
    }

    List<RawOffer> toOffers(final List<Map<String, Object>> rows, final String query, final URI page) {
        List<RawOffer> offers = new ArrayList<>(rows.size());
        for (Map<String, Object> row : rows) {
            offers.add(RawOffer.builder()
                    .put("distributor", row.getOrDefault("distributor", "FindChips Source"))
                    .put("mpn", row.getOrDefault("mpn", query.toUpperCase(Locale.ROOT)))
                    .put("manufacturer", row.getOrDefault("manufacturer", "Unknown"))
                    .put("stock", row.getOrDefault("stock", 0))
                    .put("price", row.getOrDefault("price", 0.0))
                    .put("currency", row.getOrDefault("currency", "USD"))
                    .put("condition", "New")
                    .put("risk_level", "Low")
                    .put("source_type", SOURCE_TYPE)
                    .put("description", row.getOrDefault("description", "Multi-source aggregated data"))
                    .put("delivery", row.getOrDefault("delivery", "Check Distributor"))
                    .put("date_code", "2024+")
                    .put("datasheet", page.toString())
                    .build());
        }
        return offers;
    }
}
