package com.components.sourcing.ai;

import com.components.sourcing.config.OpenAIProperties;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.decorators.Decorators;
import io.github.resilience4j.retry.Retry;
import lombok.extern.slf4j.Slf4j;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.HttpHeaders;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;

import java.net.URI;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.Supplier;
import java.util.regex.Pattern;

/**
 * Extracts structured offers from a distributor's HTML page with an OpenAI
 * chat completion.
 *
 * <p>The page is first reduced with jsoup (scripts, styles and navigation
 * chrome removed) and cut to {@link OpenAIProperties#getMaxHtmlLength()}
 * characters, then sent with a prompt asking for a bare JSON array. The call
 * is wrapped in the shared Resilience4j {@link Retry} and
 * {@link CircuitBreaker}; any failure, including an unparsable answer, ends
 * in an empty list.</p>
 */
@Slf4j
@Component
public class HtmlOfferExtractor {

    /**
     * Endpoint for completions.
     */
    private static final String CHAT_COMPLETION_ENDPOINT = "/chat/completions";

    private static final String SYSTEM_PROMPT =
            "You are a data extraction assistant. Return only valid JSON arrays.";

    /**
     * User prompt; {@code %s} slots are the part number and the HTML excerpt.
     */
    private static final String USER_PROMPT_TEMPLATE = """
            Extract electronic component data from the following HTML and return ONLY a JSON array.
            Each item should have these fields:
            - distributor (string)
            - mpn (string, the manufacturer part number)
            - manufacturer (string)
            - stock (integer, 0 if unknown)
            - price (float, 0 if unknown)
            - currency (string, default "USD")
            - delivery (string)
            - description (string, brief)

            Part Number: %s

            HTML:
            %s

            Return ONLY the JSON array, no markdown formatting or explanations.""";

    private static final Pattern LEADING_FENCE = Pattern.compile("^```(?:json)?\\s*");

    private static final Pattern TRAILING_FENCE = Pattern.compile("\\s*```$");

    private final OpenAIProperties props;

    private final Retry retry;

    private final CircuitBreaker circuitBreaker;

    private final ObjectMapper mapper;

    private final WebClient openAiClientWeb;

    public HtmlOfferExtractor(final OpenAIProperties props,
                              final Retry retry,
                              final CircuitBreaker circuitBreaker,
                              @Qualifier("sourcingObjectMapper") final ObjectMapper mapper,
                              final WebClient.Builder builder) {
        this.props = Objects.requireNonNull(props);
        this.retry = Objects.requireNonNull(retry);
        this.circuitBreaker = Objects.requireNonNull(circuitBreaker);
        this.mapper = Objects.requireNonNull(mapper);
        this.openAiClientWeb = builder.clone()
                .baseUrl(props.getBaseUrl())
                .defaultHeader(HttpHeaders.AUTHORIZATION, "Bearer " + props.getKey())
                .build();
    }

    public boolean isEnabled() {
        return props.hasKey();
    }

    /**
     * @param html       raw page HTML
     * @param partNumber the part the page was fetched for
     * @return extracted rows (field name → value), empty when AI extraction is
     *         disabled or fails
     */
    public List<Map<String, Object>> extract(final String html, final String partNumber) {
        if (!isEnabled()) {
            log.warn("OpenAI API key missing, skipping AI extraction for {}", partNumber);
            return List.of();
        }
        if (html == null || html.isBlank()) {
            return List.of();
        }

        String excerpt = reduce(html, props.getMaxHtmlLength());
        Supplier<List<Map<String, Object>>> decorated = Decorators
                .ofSupplier(() -> parseRows(askModel(partNumber, excerpt)))
                .withRetry(retry)
                .withCircuitBreaker(circuitBreaker)
                .withFallback(List.of(Exception.class), ex -> {
                    log.warn("AI extraction failed for part “{}”: {}", partNumber, ex.toString());
                    return List.<Map<String, Object>>of();
                })
                .decorate();

        List<Map<String, Object>> rows = decorated.get();
        log.info("AI extraction produced {} rows for {}", rows.size(), partNumber);
        return rows;
    }

    /**
     * Strips non-content markup and truncates.
     */
    static String reduce(final String html, final int maxLength) {
        Document doc = Jsoup.parse(html);
        doc.select("script, style, noscript, svg, header, footer, nav, iframe, link, meta").remove();
        String body = doc.body() != null ? doc.body().html() : doc.html();
        if (body.length() > maxLength) {
            return body.substring(0, maxLength) + "...";
        }
        return body;
    }

    /**
     * Parses the model's answer, tolerating a surrounding markdown code fence.
     *
     * @throws IllegalStateException when the content is not a JSON array
     */
    List<Map<String, Object>> parseRows(final String content) {
        String cleaned = stripFences(content);
        try {
            JsonNode root = mapper.readTree(cleaned);
            if (root == null || !root.isArray()) {
                throw new IllegalStateException("Model answer is not a JSON array");
            }
            return mapper.convertValue(root, new TypeReference<List<Map<String, Object>>>() { });
        } catch (JsonProcessingException ex) {
            String head = cleaned.length() > 200 ? cleaned.substring(0, 200) + "..." : cleaned;
            throw new IllegalStateException("Model returned invalid JSON: " + head, ex);
        }
    }

    static String stripFences(final String content) {
        String trimmed = content == null ? "" : content.trim();
        if (trimmed.startsWith("```")) {
            trimmed = LEADING_FENCE.matcher(trimmed).replaceFirst("");
            trimmed = TRAILING_FENCE.matcher(trimmed).replaceFirst("");
        }
        return trimmed;
    }

    private String askModel(final String partNumber, final String excerpt) {
        Map<String, Object> system = Map.of("role", "system", "content", SYSTEM_PROMPT);
        Map<String, Object> user = Map.of("role", "user",
                "content", USER_PROMPT_TEMPLATE.formatted(partNumber, excerpt));
        Map<String, Object> payload = Map.of(
                "model", props.getDefaultModel(),
                "temperature", 0.1,
                "max_tokens", props.getMaxTokens(),
                "messages", List.of(system, user)
        );

        JsonNode response = openAiClientWeb.post()
                .uri(URI.create(props.getBaseUrl() + CHAT_COMPLETION_ENDPOINT))
                .bodyValue(payload)
                .retrieve()
                .bodyToMono(JsonNode.class)
                .block(props.getTimeout());

        if (response == null) {
            throw new IllegalStateException("Null response from LLM");
        }
        return response.at("/choices/0/message/content").asText();
    }
}
