package com.components.sourcing.normalize;

import com.components.sourcing.model.RiskLevel;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class RiskRulesTest {

    @ParameterizedTest
    @CsvSource({
            "Refurbished (Certified), HIGH, true",
            "New Old Stock, MEDIUM, true",
            "New Factory, LOW, false",
            "Authorized EOL, LOW, false",
            "EOL / Obsolete, LOW, false",
            "refurbished, LOW, false"
    })
    void shouldClassifyConditionText(final String condition, final RiskLevel risk, final boolean eol) {
        assertThat(RiskRules.classify(condition)).isEqualTo(risk);
        assertThat(RiskRules.isEol(condition)).isEqualTo(eol);
    }

    @Test
    void shouldPreferFirstMatchingRule() {
        assertThat(RiskRules.classify("Refurbished Old Stock")).isEqualTo(RiskLevel.HIGH);
    }

    @Test
    void shouldTreatMissingConditionAsLowRisk() {
        assertThat(RiskRules.classify(null)).isEqualTo(RiskRules.DEFAULT_LEVEL);
        assertThat(RiskRules.isEol(null)).isFalse();
    }

    @Test
    void shouldKeepRuleTableStable() {
        assertThat(RiskRules.RULES).containsExactly(
                new RiskRules.Rule("Refurbished", RiskLevel.HIGH),
                new RiskRules.Rule("Old Stock", RiskLevel.MEDIUM));
        assertThat(RiskRules.EOL_MARKERS).containsExactlyInAnyOrder("Old Stock", "Refurbished");
    }
}
