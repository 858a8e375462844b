package com.components.sourcing.service;

import com.components.sourcing.model.LockConfirmation;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.util.Locale;
import java.util.UUID;

/**
 * Issues procurement lock confirmations.
 * <p>
 * Stateless: nothing is reserved anywhere, the buyer only gets a tracking
 * reference and the end of the lock window.
 * </p>
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ProcurementService {

    public static final String STATUS_PENDING_PO = "LOCKED_PENDING_PO";

    public static final String TRACKING_PREFIX = "RARE-";

    public static final Duration LOCK_WINDOW = Duration.ofHours(24);

    private final Clock clock;

    public LockConfirmation lock(final String partId, final int quantity) {
        if (StringUtils.isBlank(partId)) {
            throw new IllegalArgumentException("part_id must not be blank");
        }
        if (quantity < 1) {
            throw new IllegalArgumentException("quantity must be at least 1, got " + quantity);
        }
        String trackingId = TRACKING_PREFIX + UUID.randomUUID().toString()
                .replace("-", "")
                .substring(0, 12)
                .toUpperCase(Locale.ROOT);
        LockConfirmation confirmation = new LockConfirmation(trackingId, STATUS_PENDING_PO,
                clock.instant().plus(LOCK_WINDOW));
        log.info("Procurement lock {} issued for part {} x{}", trackingId, partId, quantity);
        return confirmation;
    }
}
