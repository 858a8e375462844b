package com.components.sourcing.config;

import lombok.Getter;
import lombok.Setter;

import java.time.Duration;

/**
 * Holds configuration properties for one upstream source connector.
 * <p>
 * Each instance carries the endpoint URLs, credentials and limits a
 * connector needs to query its distributor. Credentials are usually
 * resolved from environment variables or the {@code .env} file.
 * </p>
 */
@Getter
@Setter
public class ConnectorCfg {

    /**
     * Whether the connector bean should be active.
     */
    private boolean enabled = true;

    /**
     * The base URL to which {@link #searchPath} is relative.
     * <p>For example, "https://api.mouser.com".</p>
     */
    private String baseUrl;

    /**
     * The path (relative to {@link #baseUrl}) used to perform part searches.
     * <p>For example, "/api/v1/search/partnumber".</p>
     */
    private String searchPath;

    /**
     * Absolute OAuth2 token endpoint, for sources using client credentials.
     */
    private String tokenUrl;

    /** Query-string API key (Mouser style). */
    private String apiKey;

    /** Static bearer token (Win Source style). */
    private String accessToken;

    /** OAuth2 client id. */
    private String clientId;

    /** OAuth2 client secret. */
    private String clientSecret;

    /**
     * Upper bound on records requested from the source, where it supports one.
     */
    private int limit = 10;

    /**
     * Deadline for one complete {@code fetchPrices} call. When unset, the
     * aggregation-wide connector timeout applies.
     */
    private Duration timeout;
}
