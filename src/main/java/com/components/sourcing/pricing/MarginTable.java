package com.components.sourcing.pricing;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Source type → margin multiplier, with a default for unknown types.
 * Lookup is exact (case-sensitive), matching the tags connectors emit.
 */
public final class MarginTable {

    private final Map<String, Double> margins;

    private final double defaultMargin;

    public MarginTable(final Map<String, Double> margins, final double defaultMargin) {
        this.margins = Collections.unmodifiableMap(new LinkedHashMap<>(margins));
        this.defaultMargin = defaultMargin;
    }

    public double marginFor(final String sourceType) {
        if (sourceType == null) {
            return defaultMargin;
        }
        return margins.getOrDefault(sourceType, defaultMargin);
    }

    /**
     * @return every configured entry, in declaration order
     */
    public Map<String, Double> entries() {
        return margins;
    }

    public double defaultMargin() {
        return defaultMargin;
    }
}
