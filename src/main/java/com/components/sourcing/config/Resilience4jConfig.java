package com.components.sourcing.config;

import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.circuitbreaker.CircuitBreakerConfig;
import io.github.resilience4j.circuitbreaker.CircuitBreakerRegistry;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import io.github.resilience4j.retry.RetryRegistry;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

/**
 * <h2>Resilience4j Configuration</h2>
 *
 * <p>
 * Exposes the Resilience4j registries and the named policies guarding the
 * AI-assisted HTML extraction. Services inject the policies instead of
 * instantiating them.
 * </p>
 */
@Configuration
public class Resilience4jConfig {

    /** Name shared by the retry and the breaker around OpenAI calls. */
    public static final String AI_EXTRACTION = "aiHtmlExtraction";

    /**
     * Creates the global {@link RetryRegistry}; two attempts at most, since a
     * slow model eats into the connector deadline.
     *
     * @return registry holding every named {@link Retry}
     */
    @Bean
    public RetryRegistry retryRegistry() {
        return RetryRegistry.of(RetryConfig.custom()
                .maxAttempts(2)
                .waitDuration(Duration.ofMillis(500))
                .build());
    }

    /**
     * Creates the global {@link CircuitBreakerRegistry}.
     *
     * @return registry holding every named {@link CircuitBreaker}
     */
    @Bean
    public CircuitBreakerRegistry circuitBreakerRegistry() {
        return CircuitBreakerRegistry.of(CircuitBreakerConfig.custom()
                .slidingWindowSize(10)
                .failureRateThreshold(50)
                .waitDurationInOpenState(Duration.ofMinutes(1))
                .build());
    }

    /**
     * Retry policy for AI extraction calls.
     *
     * @param registry the global {@link RetryRegistry}
     * @return a {@link Retry} named {@value #AI_EXTRACTION}
     */
    @Bean
    public Retry aiRetry(final RetryRegistry registry) {
        return registry.retry(AI_EXTRACTION);
    }

    /**
     * Circuit breaker for AI extraction calls. When the model keeps failing
     * the breaker opens and scraping connectors return nothing until it
     * recovers.
     *
     * @param registry the global {@link CircuitBreakerRegistry}
     * @return a {@link CircuitBreaker} named {@value #AI_EXTRACTION}
     */
    @Bean
    public CircuitBreaker aiCircuitBreaker(final CircuitBreakerRegistry registry) {
        return registry.circuitBreaker(AI_EXTRACTION);
    }
}
