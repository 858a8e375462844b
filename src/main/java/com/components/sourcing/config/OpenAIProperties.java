package com.components.sourcing.config;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

/**
 * Configuration properties for the OpenAI integration used to extract offers
 * from scraped HTML.
 *
 * <p>Example application.yml snippet:
 * <pre>
 * openai:
 *   api:
 *     key: ${OPENAI_API_KEY:}
 *     base-url: https://api.openai.com/v1
 *     default-model: gpt-4o-mini
 * </pre>
 * A blank key disables AI extraction; the connectors depending on it then
 * return no offers.</p>
 */
@Data
@Validated
@Configuration
@ConfigurationProperties(prefix = "openai.api")
public class OpenAIProperties {

    /**
     * API key for the LLM service. Optional.
     */
    private String key;

    /** The base URL for OpenAI API calls. */
    @NotBlank
    private String baseUrl = "https://api.openai.com/v1";

    /**
     * The model used for chat/completions.
     */
    @NotBlank
    private String defaultModel = "gpt-4o-mini";

    /** HTML is cut to this many characters before it is sent to the model. */
    @Min(500)
    private int maxHtmlLength = 8000;

    /** Upper bound on the tokens the model may answer with. */
    private int maxTokens = 2000;

    /** Timeout for one completion call. */
    private Duration timeout = Duration.ofSeconds(30);

    public boolean hasKey() {
        return key != null && !key.isBlank();
    }
}
