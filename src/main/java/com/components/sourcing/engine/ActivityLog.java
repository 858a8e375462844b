package com.components.sourcing.engine;

import com.components.sourcing.config.AggregationProperties;
import com.components.sourcing.connector.ConnectorResult;
import org.springframework.stereotype.Component;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Locale;

/**
 * Bounded, thread-safe feed of recent connector outcomes, newest first.
 */
@Component
public class ActivityLog {

    private final int capacity;

    private final Deque<String> lines = new ArrayDeque<>();

    public ActivityLog(final AggregationProperties props) {
        this.capacity = Math.max(1, props.getActivityLogSize());
    }

    public void record(final String query, final ConnectorResult outcome) {
        String line = switch (outcome.status()) {
            case SUCCESS -> "[%s] %s for %s: %d offers in %dms".formatted(
                    "FETCHED", outcome.connector(), query.toUpperCase(Locale.ROOT),
                    outcome.offers().size(), outcome.elapsed().toMillis());
            case TIMED_OUT -> "[TIMEOUT] %s for %s after %dms".formatted(
                    outcome.connector(), query.toUpperCase(Locale.ROOT), outcome.elapsed().toMillis());
            case FAILED -> "[FAILED] %s for %s: %s".formatted(
                    outcome.connector(), query.toUpperCase(Locale.ROOT), outcome.error());
        };
        synchronized (lines) {
            lines.addFirst(line);
            while (lines.size() > capacity) {
                lines.removeLast();
            }
        }
    }

    /**
     * @param limit maximum number of lines
     * @return up to {@code limit} most recent lines, newest first
     */
    public List<String> recent(final int limit) {
        synchronized (lines) {
            List<String> out = new ArrayList<>(Math.min(limit, lines.size()));
            for (String line : lines) {
                if (out.size() == limit) {
                    break;
                }
                out.add(line);
            }
            return out;
        }
    }
}
