package com.components.sourcing.connector;

import com.components.sourcing.model.RawOffer;

import java.time.Duration;
import java.util.List;

/**
 * Outcome of one connector task inside a fan-out.
 *
 * @param connector connector name
 * @param status    how the task ended
 * @param offers    offers produced; empty unless {@code status} is {@link Status#SUCCESS}
 * @param error     short failure description, {@code null} on success
 * @param elapsed   wall-clock duration of the task
 */
public record ConnectorResult(
        String connector,
        Status status,
        List<RawOffer> offers,
        String error,
        Duration elapsed
) {

    public enum Status {
        SUCCESS,
        FAILED,
        TIMED_OUT
    }

    public ConnectorResult {
        offers = (offers == null) ? List.of() : List.copyOf(offers);
    }

    public static ConnectorResult success(final String connector,
                                          final List<RawOffer> offers,
                                          final Duration elapsed) {
        return new ConnectorResult(connector, Status.SUCCESS, offers, null, elapsed);
    }

    public static ConnectorResult failure(final String connector,
                                          final Throwable cause,
                                          final Duration elapsed) {
        return new ConnectorResult(connector, Status.FAILED, List.of(), String.valueOf(cause), elapsed);
    }

    public static ConnectorResult timedOut(final String connector, final Duration elapsed) {
        return new ConnectorResult(connector, Status.TIMED_OUT, List.of(),
                "no answer within " + elapsed.toMillis() + "ms", elapsed);
    }

    public boolean isSuccess() {
        return status == Status.SUCCESS;
    }
}
