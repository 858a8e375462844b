package com.components.sourcing.config;

import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.util.ArrayList;
import java.util.List;

/**
 * <h2>{@code DeepLinkProperties}</h2>
 *
 * <p>Binds the {@code sourcing.deep-links} list: distributors that are not
 * queried at all but answered with a static "check the website" stub whose
 * {@code datasheet} points at the distributor's own search page.</p>
 *
 * <pre>
 * sourcing:
 *   deep-links:
 *     - distributor: RS Components
 *       url-template: https://uk.rs-online.com/web/c/?searchTerm={query}
 * </pre>
 */
@Data
@Configuration
@ConfigurationProperties(prefix = "sourcing")
public class DeepLinkProperties {

    private List<DeepLink> deepLinks = new ArrayList<>();

    /**
     * One stub row. {@code {query}} in {@link #urlTemplate} is replaced by the
     * URL-encoded search term.
     */
    @Data
    @NoArgsConstructor
    public static class DeepLink {

        private String distributor;

        private String urlTemplate;

        private String sourceType = "Deep Link";

        private String manufacturer = "Various";

        private String condition = "New";

        /** {@code -1} means "unknown, check website". */
        private int stock = -1;

        private String delivery = "Check Website";

        private String description = "Global Distributor";
    }
}
