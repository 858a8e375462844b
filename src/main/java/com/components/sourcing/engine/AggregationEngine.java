package com.components.sourcing.engine;

import com.components.sourcing.config.AggregationProperties;
import com.components.sourcing.connector.ConnectorResult;
import com.components.sourcing.connector.PriceConnector;
import com.components.sourcing.connector.TerminalFallback;
import com.components.sourcing.model.Offer;
import com.components.sourcing.model.RawOffer;
import com.components.sourcing.normalize.OfferNormalizer;
import com.components.sourcing.pricing.PricingTransform;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.concurrent.TimeoutException;

/**
 * <h2>AggregationEngine</h2>
 *
 * <p>Fans a query out to every {@link PriceConnector}, waits for all of them,
 * and turns what came back into one price-sorted list of {@link Offer}s.</p>
 *
 * <ul>
 *   <li>Each connector runs as its own task on the {@link Scheduler} (Reactor's
 *       bounded-elastic pool by default) with its own deadline. A failure or a
 *       timeout costs that connector's offers only.</li>
 *   <li>The barrier has no deadline of its own; per-task deadlines bound it.</li>
 *   <li>Results are flattened in connector order, normalized, priced and
 *       stably sorted by price on the collecting thread.</li>
 *   <li>When the fan-out produced nothing, the {@link TerminalFallback} (if
 *       any) is asked once for a stand-in.</li>
 *   <li>Cancelling the returned {@link Mono} cancels all outstanding tasks.</li>
 * </ul>
 */
@Slf4j
@Service
public class AggregationEngine {

    private final List<PriceConnector> connectors;

    @Nullable
    private final TerminalFallback fallback;

    private final OfferNormalizer normalizer;

    private final PricingTransform pricing;

    private final Duration defaultTimeout;

    private final ActivityLog activityLog;

    private final Scheduler scheduler;

    @Autowired
    public AggregationEngine(final List<PriceConnector> connectors,
                             final ObjectProvider<TerminalFallback> fallback,
                             final OfferNormalizer normalizer,
                             final PricingTransform pricing,
                             final AggregationProperties props,
                             final ActivityLog activityLog) {
        this(connectors, fallback.getIfAvailable(), normalizer, pricing,
                props.getConnectorTimeout(), activityLog, Schedulers.boundedElastic());
    }

    public AggregationEngine(final List<PriceConnector> connectors,
                             @Nullable final TerminalFallback fallback,
                             final OfferNormalizer normalizer,
                             final PricingTransform pricing,
                             final Duration defaultTimeout,
                             final ActivityLog activityLog,
                             final Scheduler scheduler) {
        this.connectors = List.copyOf(connectors);
        this.fallback = fallback;
        this.normalizer = normalizer;
        this.pricing = pricing;
        this.defaultTimeout = defaultTimeout;
        this.activityLog = activityLog;
        this.scheduler = scheduler;
        log.info("Aggregation engine wired with connectors {} (fallback: {})",
                this.connectors.stream().map(PriceConnector::name).toList(), fallback != null);
    }

    /**
     * @param query raw search text, handed to every connector unchanged
     * @return offers sorted ascending by price; never an error signal
     */
    public Mono<List<Offer>> aggregate(final String query) {
        return aggregateDetailed(query).map(Aggregation::offers);
    }

    /**
     * Same as {@link #aggregate(String)} but keeps every connector outcome.
     */
    public Mono<Aggregation> aggregateDetailed(final String query) {
        return Mono.defer(() -> {
            long t0 = System.nanoTime();
            return Flux.fromIterable(connectors)
                    .flatMapSequential(connector -> invoke(connector, query))
                    .collectList()
                    .map(outcomes -> assemble(query, outcomes, t0));
        });
    }

    private Mono<ConnectorResult> invoke(final PriceConnector connector, final String query) {
        Duration deadline = connector.timeout().orElse(defaultTimeout);
        return Mono.defer(() -> {
            long start = System.nanoTime();
            return Mono.fromCallable(() -> connector.fetchPrices(query))
                    .defaultIfEmpty(List.of())
                    .subscribeOn(scheduler)
                    .timeout(deadline)
                    .map(offers -> ConnectorResult.success(connector.name(), offers, since(start)))
                    .onErrorResume(TimeoutException.class, ex -> {
                        log.warn("Connector {} timed out after {}ms for '{}'",
                                connector.name(), deadline.toMillis(), query);
                        return Mono.just(ConnectorResult.timedOut(connector.name(), since(start)));
                    })
                    .onErrorResume(ex -> {
                        log.warn("Connector {} failed for '{}': {}", connector.name(), query, ex.toString());
                        return Mono.just(ConnectorResult.failure(connector.name(), ex, since(start)));
                    })
                    .doOnNext(outcome -> activityLog.record(query, outcome));
        });
    }

    private Aggregation assemble(final String query, final List<ConnectorResult> outcomes, final long t0) {
        List<RawOffer> raw = new ArrayList<>();
        outcomes.forEach(outcome -> raw.addAll(outcome.offers()));

        boolean fallbackUsed = false;
        if (raw.isEmpty() && fallback != null) {
            try {
                raw.addAll(fallback.whenNothingFound(query));
                fallbackUsed = true;
            } catch (RuntimeException ex) {
                log.warn("Terminal fallback failed for '{}': {}", query, ex.toString());
            }
        }

        List<Offer> offers = new ArrayList<>(raw.size());
        for (RawOffer rawOffer : raw) {
            offers.add(pricing.apply(normalizer.normalize(rawOffer)));
        }
        // List.sort is stable: equal prices keep arrival order
        offers.sort(Comparator.comparingDouble(Offer::price));

        Aggregation aggregation = new Aggregation(offers, outcomes, fallbackUsed);
        log.info("Aggregated '{}': {} offers from {} connectors ({} failed{}) in {}ms",
                query, offers.size(), outcomes.size(), aggregation.failedConnectors(),
                fallbackUsed ? ", fallback used" : "", (System.nanoTime() - t0) / 1_000_000);
        return aggregation;
    }

    private static Duration since(final long startNanos) {
        return Duration.ofNanos(System.nanoTime() - startNanos);
    }
}
