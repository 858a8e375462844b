package com.components.sourcing.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.netty.channel.ChannelOption;
import io.netty.handler.logging.LogLevel;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.MediaType;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.http.codec.ClientCodecConfigurer;
import org.springframework.http.codec.json.Jackson2JsonDecoder;
import org.springframework.http.codec.json.Jackson2JsonEncoder;
import org.springframework.web.reactive.function.client.ExchangeFilterFunction;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;
import reactor.netty.http.client.HttpClient;
import reactor.netty.resources.ConnectionProvider;
import reactor.netty.transport.logging.AdvancedByteBufFormat;

/**
 * Shared {@link WebClient.Builder} for connectors and the AI extractor.
 * <p>
 * One pooled Reactor Netty client serves every source; JSON goes through the
 * sourcing {@link ObjectMapper}. Consumers {@code clone()} the builder
 * before adding their own headers or base URL.
 * </p>
 */
@Slf4j
@Configuration
public class WebClientConfiguration {

    @Bean
    public WebClient.Builder webClientBuilder(@Qualifier("sourcingObjectMapper") final ObjectMapper mapper,
                                              final HttpClientProperties props) {
        ConnectionProvider pool = ConnectionProvider.builder("connector-pool")
                .maxConnections(props.getMaxConnections())
                .pendingAcquireTimeout(props.getPendingAcquireTimeout())
                .build();

        HttpClient httpClient = HttpClient.create(pool)
                .followRedirect(true)
                .compress(true)
                .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, (int) props.getConnectTimeout().toMillis())
                .responseTimeout(props.getResponseTimeout());
        if (props.isWiretap()) {
            httpClient = httpClient.wiretap("reactor.netty.http.client.HttpClient",
                    LogLevel.DEBUG, AdvancedByteBufFormat.TEXTUAL);
        }

        log.info("Outbound HTTP pool: {} connections, connect {} / response {}",
                props.getMaxConnections(), props.getConnectTimeout(), props.getResponseTimeout());

        return WebClient.builder()
                .clientConnector(new ReactorClientHttpConnector(httpClient))
                .codecs(codecs -> configureCodecs(codecs, mapper, props.getMaxInMemorySize()))
                .filter(traceExchange());
    }

    private static void configureCodecs(final ClientCodecConfigurer codecs,
                                        final ObjectMapper mapper,
                                        final int maxInMemorySize) {
        codecs.defaultCodecs().jackson2JsonEncoder(new Jackson2JsonEncoder(mapper, MediaType.APPLICATION_JSON));
        codecs.defaultCodecs().jackson2JsonDecoder(new Jackson2JsonDecoder(mapper, MediaType.APPLICATION_JSON));
        codecs.defaultCodecs().maxInMemorySize(maxInMemorySize);
    }

    private static ExchangeFilterFunction traceExchange() {
        return (request, next) -> {
            long t0 = System.nanoTime();
            log.debug("--> {} {}", request.method(), request.url().getHost());
            return next.exchange(request).flatMap(response -> {
                log.debug("<-- {} {} in {}ms", response.statusCode().value(), request.url().getHost(),
                        (System.nanoTime() - t0) / 1_000_000);
                return Mono.just(response);
            });
        };
    }
}
