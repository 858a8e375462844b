package com.components.sourcing.normalize;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class FieldAliasesTest {

    @Test
    void shouldListCanonicalKeyFirst() {
        FieldAliases.ALIASES.forEach((field, aliases) ->
                assertThat(aliases).first().isEqualTo(field));
    }

    @Test
    void shouldKnowLegacyAliases() {
        assertThat(FieldAliases.aliasesOf(FieldAliases.PRICE)).containsExactly("price", "price_usd");
        assertThat(FieldAliases.aliasesOf(FieldAliases.MANUFACTURER)).containsExactly("manufacturer", "mfr");
        assertThat(FieldAliases.aliasesOf(FieldAliases.SOURCE_TYPE)).containsExactly("source_type", "type");
    }

    @Test
    void shouldDefaultEveryFieldExceptRisk() {
        assertThat(FieldAliases.DEFAULTS.keySet())
                .containsExactlyInAnyOrderElementsOf(FieldAliases.ALIASES.keySet().stream()
                        .filter(field -> !field.equals(FieldAliases.RISK_LEVEL))
                        .toList());
    }

    @Test
    void shouldRejectUnknownField() {
        assertThatThrownBy(() -> FieldAliases.aliasesOf("colour"))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
