package com.components.sourcing.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;

/**
 * Acknowledgement of a procurement lock request.
 *
 * @param trackingId reference handed back to the buyer, e.g. {@code RARE-3F9A0C11B2D4}
 * @param status     always {@code LOCKED_PENDING_PO}
 * @param expiresAt  end of the 24h lock window
 */
public record LockConfirmation(
        @JsonProperty("tracking_id") String trackingId,
        @JsonProperty("status") String status,
        @JsonProperty("expires_at") Instant expiresAt
) {
}
