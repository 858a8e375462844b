package com.components.sourcing.normalize;

import com.components.sourcing.model.RiskLevel;

import java.util.List;

/**
 * Condition-text markers driving risk and EOL classification. Matching is a
 * case-sensitive substring test; the first matching rule wins.
 */
public final class RiskRules {

    /**
     * @param marker substring looked up in the condition text
     * @param level  risk assigned when the marker is present
     */
    public record Rule(String marker, RiskLevel level) {
    }

    public static final List<Rule> RULES = List.of(
            new Rule("Refurbished", RiskLevel.HIGH),
            new Rule("Old Stock", RiskLevel.MEDIUM)
    );

    public static final RiskLevel DEFAULT_LEVEL = RiskLevel.LOW;

    /** Any of these in the condition marks the part end-of-life. */
    public static final List<String> EOL_MARKERS = List.of("Old Stock", "Refurbished");

    private RiskRules() {
    }

    public static RiskLevel classify(final String condition) {
        if (condition == null) {
            return DEFAULT_LEVEL;
        }
        for (Rule rule : RULES) {
            if (condition.contains(rule.marker())) {
                return rule.level();
            }
        }
        return DEFAULT_LEVEL;
    }

    public static boolean isEol(final String condition) {
        return condition != null && EOL_MARKERS.stream().anyMatch(condition::contains);
    }
}
