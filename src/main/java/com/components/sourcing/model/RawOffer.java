package com.components.sourcing.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * One loosely-typed quote exactly as a connector produced it.
 * <p>
 * Keys are source-defined (e.g. {@code price} vs {@code price_usd},
 * {@code manufacturer} vs {@code mfr}); the {@code OfferNormalizer} resolves
 * them into an {@link Offer}. Values may be {@code null}.
 * </p>
 *
 * @param fields unmodifiable view of the source fields, insertion order preserved
 */
public record RawOffer(Map<String, Object> fields) {

    public RawOffer {
        fields = (fields == null)
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(fields));
    }

    public static RawOffer of(final Map<String, Object> fields) {
        return new RawOffer(fields);
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Returns the first non-null value among the given keys.
     *
     * @param keys candidate keys, highest priority first
     * @return the resolved value, or empty when none of the keys carries one
     */
    public Optional<Object> first(final List<String> keys) {
        for (String key : keys) {
            Object value = fields.get(key);
            if (value != null) {
                return Optional.of(value);
            }
        }
        return Optional.empty();
    }

    public Object get(final String key) {
        return fields.get(key);
    }

    /**
     * Fluent builder used by connectors; {@code null} values are skipped so
     * that the normalizer's defaults apply.
     */
    public static final class Builder {

        private final Map<String, Object> fields = new LinkedHashMap<>();

        private Builder() {
        }

        public Builder put(final String key, final Object value) {
            if (value != null) {
                fields.put(key, value);
            }
            return this;
        }

        public RawOffer build() {
            return new RawOffer(fields);
        }
    }
}
