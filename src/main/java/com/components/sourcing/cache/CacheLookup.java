package com.components.sourcing.cache;

import com.components.sourcing.model.Offer;

import java.util.List;

/**
 * Outcome of {@link SearchResultCache#get(String)}. Callers treat
 * {@link Status#UNAVAILABLE} exactly like {@link Status#MISS}.
 *
 * @param status lookup outcome
 * @param offers cached offers; empty unless {@code status} is {@link Status#HIT}
 * @param searchCount hit counter of the entry after this hit, 0 otherwise
 */
public record CacheLookup(Status status, List<Offer> offers, int searchCount) {

    public enum Status {
        HIT,
        MISS,
        UNAVAILABLE
    }

    public CacheLookup {
        offers = offers == null ? List.of() : List.copyOf(offers);
    }

    public static CacheLookup hit(final List<Offer> offers, final int searchCount) {
        return new CacheLookup(Status.HIT, offers, searchCount);
    }

    public static CacheLookup miss() {
        return new CacheLookup(Status.MISS, List.of(), 0);
    }

    public static CacheLookup unavailable() {
        return new CacheLookup(Status.UNAVAILABLE, List.of(), 0);
    }

    public boolean isHit() {
        return status == Status.HIT;
    }
}
