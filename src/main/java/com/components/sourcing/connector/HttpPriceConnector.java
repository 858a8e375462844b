package com.components.sourcing.connector;

import com.components.sourcing.config.ConnectorCfg;
import com.components.sourcing.model.RawOffer;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.lang.NonNull;
import org.springframework.lang.Nullable;
import org.springframework.util.MultiValueMap;
import org.springframework.web.reactive.function.BodyInserters;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.util.UriComponentsBuilder;

import java.net.URI;
import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.function.Consumer;

/**
 * <h2>HttpPriceConnector</h2>
 *
 * <p>Reusable base class for connectors that talk HTTP to their source.</p>
 *
 * <ul>
 *   <li>Owns a {@link WebClient} cloned from the shared, pooled builder.</li>
 *   <li>Wraps {@link #fetchPrices(String)} so that blank queries, missing
 *       credentials and any runtime failure end in an empty list plus a log
 *       line, never an exception.</li>
 *   <li>Offers JSON/form/HTML helpers that block with the connector's own
 *       deadline; connectors run on Reactor's bounded-elastic scheduler, so
 *       blocking here is expected.</li>
 * </ul>
 */
@Slf4j
@Getter
public abstract class HttpPriceConnector implements PriceConnector {

    /** Used when the connector's config does not declare a timeout. */
    protected static final Duration HTTP_TIMEOUT = Duration.ofSeconds(10);

    protected static final String BROWSER_USER_AGENT =
            "Mozilla/5.0 (Macintosh; Intel Mac OS X 10_15_7) "
                    + "AppleWebKit/537.36 (KHTML, like Gecko) "
                    + "Chrome/120.0.0.0 Safari/537.36";

    private final String name;

    private final ConnectorCfg cfg;

    private final WebClient webClient;

    private final ObjectMapper mapper;

    protected HttpPriceConnector(final String name,
                                 final ConnectorCfg cfg,
                                 final WebClient.Builder builder,
                                 final ObjectMapper mapper) {
        this.name = name;
        this.cfg = cfg;
        this.webClient = builder.clone().build();
        this.mapper = mapper;
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public Optional<Duration> timeout() {
        return Optional.ofNullable(cfg.getTimeout());
    }

    @Override
    public final List<RawOffer> fetchPrices(final String query) {
        if (StringUtils.isBlank(query)) {
            return List.of();
        }
        if (!isReady()) {
            log.warn("Skipping {}: credentials missing or invalid", name);
            return List.of();
        }
        long t0 = System.nanoTime();
        try {
            List<RawOffer> offers = doFetch(query.trim());
            log.info("{} returned {} offers for '{}' in {}ms",
                    name, offers.size(), query, (System.nanoTime() - t0) / 1_000_000);
            return offers;
        } catch (RuntimeException ex) {
            log.warn("{} failed for '{}' after {}ms: {}",
                    name, query, (System.nanoTime() - t0) / 1_000_000, ex.toString());
            return List.of();
        }
    }

    /**
     * Source-specific lookup. May throw; {@link #fetchPrices(String)} catches it.
     *
     * @param query trimmed, non-blank search text
     * @return offers found, possibly empty
     */
    protected abstract List<RawOffer> doFetch(String query);

    /**
     * @return {@code false} when the connector lacks what it needs to call its
     *         source (typically credentials); the call is then skipped
     */
    protected boolean isReady() {
        return true;
    }

    protected Duration httpTimeout() {
        return cfg.getTimeout() != null ? cfg.getTimeout() : HTTP_TIMEOUT;
    }

    protected JsonNode getJson(final URI uri, final Consumer<HttpHeaders> headers) {
        JsonNode body = webClient.get()
                .uri(uri)
                .accept(MediaType.APPLICATION_JSON)
                .headers(headers)
                .retrieve()
                .bodyToMono(JsonNode.class)
                .block(httpTimeout());
        return body != null ? body : mapper.createObjectNode();
    }

    protected JsonNode postJson(final URI uri, final Object body, final Consumer<HttpHeaders> headers) {
        JsonNode rsp = webClient.post()
                .uri(uri)
                .contentType(MediaType.APPLICATION_JSON)
                .accept(MediaType.APPLICATION_JSON)
                .headers(headers)
                .bodyValue(body)
                .retrieve()
                .bodyToMono(JsonNode.class)
                .block(httpTimeout());
        return rsp != null ? rsp : mapper.createObjectNode();
    }

    protected JsonNode postForm(final URI uri, final MultiValueMap<String, String> form) {
        JsonNode rsp = webClient.post()
                .uri(uri)
                .contentType(MediaType.APPLICATION_FORM_URLENCODED)
                .accept(MediaType.APPLICATION_JSON)
                .body(BodyInserters.fromFormData(form))
                .retrieve()
                .bodyToMono(JsonNode.class)
                .block(httpTimeout());
        return rsp != null ? rsp : mapper.createObjectNode();
    }

    /**
     * Downloads a page as text, posing as a desktop browser.
     */
    protected String getHtml(final URI uri) {
        String html = webClient.get()
                .uri(uri)
                .accept(MediaType.TEXT_HTML, MediaType.ALL)
                .header(HttpHeaders.USER_AGENT, BROWSER_USER_AGENT)
                .retrieve()
                .bodyToMono(String.class)
                .block(httpTimeout());
        return html != null ? html : "";
    }

    protected URI buildUri(@NonNull final String base,
                           @Nullable final String path,
                           @Nullable final MultiValueMap<String, String> q) {

        UriComponentsBuilder b = UriComponentsBuilder.fromUriString(base);

        if (StringUtils.isNotBlank(path)) {
            b.path(path.startsWith("/") ? path : "/" + path);
        }

        if (q != null && !q.isEmpty()) {
            b.queryParams(q);
        }
        return b.encode().build().toUri();
    }

    protected static String textOr(final JsonNode node, final String field, final String fallback) {
        JsonNode n = (node == null) ? null : node.get(field);
        return (n == null || n.isNull() || n.asText().isBlank()) ? fallback : n.asText();
    }
}
