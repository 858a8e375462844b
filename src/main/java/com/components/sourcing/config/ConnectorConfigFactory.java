package com.components.sourcing.config;

import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * Factory component producing {@link ConnectorCfg} instances for a given
 * connector id. It delegates to {@link ConnectorProperties} to look up the
 * section declared under <code>sourcing.connectors.configs.{id}</code>.
 *
 * <p>Usage:</p>
 * <pre>{@code
 * ConnectorCfg mouserCfg = configFactory.forConnector("mouser");
 * }</pre>
 */
@Component
@RequiredArgsConstructor
public class ConnectorConfigFactory {

    private final ConnectorProperties connectorProps;

    /**
     * Retrieves the {@link ConnectorCfg} for the specified connector id.
     *
     * @param id the connector id
     * @return the corresponding {@link ConnectorCfg}
     * @throws IllegalArgumentException if no configuration section is found
     */
    public ConnectorCfg forConnector(final String id) {
        return Optional.ofNullable(connectorProps.forName(id))
                .orElseThrow(() -> new IllegalArgumentException(
                        "No <sourcing.connectors.configs." + id + "> section found in application.yml"));
    }
}
