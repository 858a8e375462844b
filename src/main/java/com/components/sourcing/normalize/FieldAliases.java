package com.components.sourcing.normalize;

import java.util.List;
import java.util.Map;

import static java.util.Map.entry;

/**
 * Canonical field → raw keys to try, highest priority first, and the value
 * used when none of them is present.
 */
public final class FieldAliases {

    public static final String MPN = "mpn";
    public static final String MANUFACTURER = "manufacturer";
    public static final String DISTRIBUTOR = "distributor";
    public static final String SOURCE_TYPE = "source_type";
    public static final String STOCK = "stock";
    public static final String PRICE = "price";
    public static final String CURRENCY = "currency";
    public static final String DELIVERY = "delivery";
    public static final String CONDITION = "condition";
    public static final String DATE_CODE = "date_code";
    public static final String DATASHEET = "datasheet";
    public static final String DESCRIPTION = "description";
    public static final String RISK_LEVEL = "risk_level";

    /** Raw keys per canonical field. */
    public static final Map<String, List<String>> ALIASES = Map.ofEntries(
            entry(MPN, List.of("mpn")),
            entry(MANUFACTURER, List.of("manufacturer", "mfr")),
            entry(DISTRIBUTOR, List.of("distributor")),
            entry(SOURCE_TYPE, List.of("source_type", "type")),
            entry(STOCK, List.of("stock")),
            entry(PRICE, List.of("price", "price_usd")),
            entry(CURRENCY, List.of("currency")),
            entry(DELIVERY, List.of("delivery")),
            entry(CONDITION, List.of("condition")),
            entry(DATE_CODE, List.of("date_code")),
            entry(DATASHEET, List.of("datasheet")),
            entry(DESCRIPTION, List.of("description")),
            entry(RISK_LEVEL, List.of("risk_level"))
    );

    /** Defaults for absent fields; risk level has none, it is computed. */
    public static final Map<String, Object> DEFAULTS = Map.ofEntries(
            entry(MPN, "N/A"),
            entry(MANUFACTURER, "Unknown"),
            entry(DISTRIBUTOR, "Unknown"),
            entry(SOURCE_TYPE, "API"),
            entry(STOCK, 0),
            entry(PRICE, 0.0),
            entry(CURRENCY, "USD"),
            entry(DELIVERY, "Unknown"),
            entry(CONDITION, "New"),
            entry(DATE_CODE, "N/A"),
            entry(DATASHEET, ""),
            entry(DESCRIPTION, "")
    );

    private FieldAliases() {
    }

    public static List<String> aliasesOf(final String field) {
        List<String> aliases = ALIASES.get(field);
        if (aliases == null) {
            throw new IllegalArgumentException("Unknown offer field: " + field);
        }
        return aliases;
    }
}
