package com.components.sourcing.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;

/**
 * Request payload for a procurement lock.
 *
 * @param partId   id of the {@code Offer} to lock; must not be blank
 * @param quantity number of units, at least one (defaults to 1 when omitted)
 */
public record ProcurementLockRequest(
        @JsonProperty("part_id") @NotBlank String partId,
        @JsonProperty("quantity") @Min(1) Integer quantity
) {

    public ProcurementLockRequest {
        if (quantity == null) {
            quantity = 1;
        }
    }
}
