package com.components.sourcing.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;
import java.util.Optional;

/**
 * Sourcing risk attached to every {@link Offer}.
 */
public enum RiskLevel {

    LOW("Low"),
    MEDIUM("Medium"),
    HIGH("High");

    private final String label;

    RiskLevel(final String label) {
        this.label = label;
    }

    @JsonValue
    public String label() {
        return label;
    }

    /**
     * Lenient lookup by label or constant name, ignoring case.
     *
     * @param value raw text such as {@code "High"} or {@code "medium"}
     * @return the matching level, or empty for blank/unknown text
     */
    public static Optional<RiskLevel> parse(final String value) {
        if (value == null || value.isBlank()) {
            return Optional.empty();
        }
        String wanted = value.trim().toUpperCase(Locale.ROOT);
        for (RiskLevel level : values()) {
            if (level.name().equals(wanted)) {
                return Optional.of(level);
            }
        }
        return Optional.empty();
    }

    @JsonCreator
    static RiskLevel fromJson(final String value) {
        return parse(value).orElseThrow(() ->
                new IllegalArgumentException("Unknown risk level: " + value));
    }
}
