package com.components.sourcing.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

/**
 * Outbound HTTP settings shared by all connectors, bound from {@code sourcing.http}.
 */
@Data
@Configuration
@ConfigurationProperties(prefix = "sourcing.http")
public class HttpClientProperties {

    private Duration connectTimeout = Duration.ofSeconds(10);

    /** Per-response read deadline; connector deadlines usually cut in first. */
    private Duration responseTimeout = Duration.ofSeconds(15);

    private int maxConnections = 50;

    private Duration pendingAcquireTimeout = Duration.ofSeconds(2);

    /** Scraped HTML pages easily exceed the 256 KiB codec default. */
    private int maxInMemorySize = 4 * 1024 * 1024;

    /** Dump raw traffic at DEBUG on {@code reactor.netty.http.client.HttpClient}. */
    private boolean wiretap;
}
