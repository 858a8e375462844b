package com.components.sourcing.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Binds connector-specific configuration from <code>application.yml</code>
 * under the <code>sourcing.connectors.configs</code> prefix. Each entry in the bound
 * map corresponds to a {@link ConnectorCfg} keyed by the connector id.
 * <p>
 * Example YAML:
 * <pre>{@code
 * sourcing:
 *   connectors:
 *     configs:
 *       mouser:
 *         base-url: https://api.mouser.com
 *         search-path: /api/v1/search/partnumber
 *         api-key: ${MOUSER_API_KEY:}
 *       digikey:
 *         base-url: https://api.digikey.com
 *         # ...
 * }</pre>
 */
@Component
@ConfigurationProperties(prefix = "sourcing.connectors")
@Getter
@Setter
public class ConnectorProperties {

    /**
     * Map of connector ids to their {@link ConnectorCfg}, preserving
     * declaration order.
     */
    private final Map<String, ConnectorCfg> configs = new LinkedHashMap<>();

    /**
     * Retrieves the {@link ConnectorCfg} for the given connector id.
     *
     * @param name the connector id
     * @return the matching config, or {@code null} if none is declared
     */
    public ConnectorCfg forName(final String name) {
        return configs.get(name);
    }
}
