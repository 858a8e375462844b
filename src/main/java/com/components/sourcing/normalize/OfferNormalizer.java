package com.components.sourcing.normalize;

import com.components.sourcing.model.Offer;
import com.components.sourcing.model.RawOffer;
import com.components.sourcing.model.RiskLevel;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.apache.commons.lang3.math.NumberUtils;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.UUID;

import static com.components.sourcing.normalize.FieldAliases.*;

/**
 * Maps a loosely-typed {@link RawOffer} to a canonical {@link Offer}.
 * <p>
 * Never fails: every absent or unreadable field takes the default from
 * {@link FieldAliases#DEFAULTS}. Price and currency stay in source terms;
 * {@code PricingTransform} localizes them afterwards.
 * </p>
 */
@Slf4j
@Component
public class OfferNormalizer {

    static final int ID_LENGTH = 12;

    private final Clock clock;

    public OfferNormalizer(final Clock clock) {
        this.clock = clock;
    }

    public Offer normalize(final RawOffer raw) {
        String condition = text(raw, CONDITION);
        RiskLevel computed = RiskRules.classify(condition);
        RiskLevel risk = raw.first(aliasesOf(RISK_LEVEL))
                .map(String::valueOf)
                .flatMap(RiskLevel::parse)
                .orElse(computed);

        return new Offer(
                newId(),
                text(raw, MPN),
                text(raw, MANUFACTURER),
                text(raw, DISTRIBUTOR),
                text(raw, SOURCE_TYPE),
                integer(raw, STOCK),
                decimal(raw, PRICE),
                List.of(),
                text(raw, CURRENCY),
                text(raw, DELIVERY),
                condition,
                text(raw, DATE_CODE),
                RiskRules.isEol(condition),
                risk,
                Instant.now(clock),
                text(raw, DATASHEET),
                text(raw, DESCRIPTION));
    }

    static String newId() {
        return UUID.randomUUID().toString().substring(0, ID_LENGTH);
    }

    private static String text(final RawOffer raw, final String field) {
        return raw.first(aliasesOf(field))
                .map(String::valueOf)
                .orElse((String) DEFAULTS.get(field));
    }

    private static int integer(final RawOffer raw, final String field) {
        Object value = raw.first(aliasesOf(field)).orElse(null);
        if (value instanceof Number number) {
            return number.intValue();
        }
        if (value instanceof String s) {
            String trimmed = s.trim();
            if (NumberUtils.isParsable(trimmed)) {
                return (int) Double.parseDouble(trimmed);
            }
            if (StringUtils.isNotBlank(trimmed)) {
                log.debug("Unreadable {} '{}', using default", field, s);
            }
        }
        return (Integer) DEFAULTS.get(field);
    }

    private static double decimal(final RawOffer raw, final String field) {
        Object value = raw.first(aliasesOf(field)).orElse(null);
        if (value instanceof Number number) {
            return number.doubleValue();
        }
        if (value instanceof String s) {
            String cleaned = s.replace("$", "").replace(",", "").trim();
            if (NumberUtils.isParsable(cleaned)) {
                return Double.parseDouble(cleaned);
            }
            if (StringUtils.isNotBlank(cleaned)) {
                log.debug("Unreadable {} '{}', using default", field, s);
            }
        }
        return (Double) DEFAULTS.get(field);
    }
}
