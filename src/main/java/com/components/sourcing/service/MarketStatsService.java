package com.components.sourcing.service;

import com.components.sourcing.engine.ActivityLog;
import com.components.sourcing.model.MarketStatus;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Random;

/**
 * Builds the market dashboard snapshot.
 * <p>
 * The headline figures are synthetic. {@code recent_logs} shows real
 * connector activity when there is any, topped up with scan lines so the
 * feed always has {@link #RECENT_LOG_COUNT} entries.
 * </p>
 */
@Service
@RequiredArgsConstructor
public class MarketStatsService {

    public static final int RECENT_LOG_COUNT = 5;

    static final List<String> TEMPERATURES = List.of("STABLE", "VOLATILE", "CRITICAL");

    static final List<String> SCAN_SOURCES = List.of(
            "Digi-Key Global API",
            "Mouser Electronics",
            "Win Source Scraper",
            "Verical Deep-Link",
            "Global Broker Index #12",
            "Asian Secondary Market Scan");

    static final List<String> SCAN_STATUSES = List.of(
            "[CONNECTING]",
            "[AUTH_SUCCESS]",
            "[SCRAPING_DOM]",
            "[PARSING_JSON]",
            "[EXTRACTING_STOCK]",
            "[CALCULATING_MARGIN]");

    static final String SCAN_SUBJECT = "MARKET_SCAN";

    static final int STOCK_INDEX_MIN = 120_000;
    static final int STOCK_INDEX_MAX = 500_000;
    static final int BROKERS_MIN = 45;
    static final int BROKERS_MAX = 82;
    static final double DRIFT_MIN = -5.5;
    static final double DRIFT_MAX = 12.4;

    private final ActivityLog activityLog;

    private final Clock clock;

    private final Random random;

    public MarketStatus snapshot() {
        List<String> logs = new ArrayList<>(activityLog.recent(RECENT_LOG_COUNT));
        while (logs.size() < RECENT_LOG_COUNT) {
            logs.add(scanLine());
        }
        double drift = DRIFT_MIN + random.nextDouble() * (DRIFT_MAX - DRIFT_MIN);
        return new MarketStatus(
                pick(TEMPERATURES),
                between(STOCK_INDEX_MIN, STOCK_INDEX_MAX),
                between(BROKERS_MIN, BROKERS_MAX),
                Math.round(drift * 100) / 100.0,
                clock.instant(),
                logs);
    }

    private String scanLine() {
        return pick(SCAN_STATUSES) + " " + pick(SCAN_SOURCES) + " for " + SCAN_SUBJECT;
    }

    private <T> T pick(final List<T> values) {
        return values.get(random.nextInt(values.size()));
    }

    /** Inclusive on both ends. */
    private int between(final int min, final int max) {
        return min + random.nextInt(max - min + 1);
    }
}
