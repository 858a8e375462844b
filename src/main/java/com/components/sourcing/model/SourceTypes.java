package com.components.sourcing.model;

/**
 * Well-known values of the open {@code source_type} tag.
 * Connectors may emit other values; pricing treats them with the default margin.
 */
public final class SourceTypes {

    public static final String API = "API";
    public static final String OFFICIAL_API = "Official API";
    public static final String DIRECT_SCRAPER = "Direct Scraper";
    public static final String META_SCRAPER = "Meta Scraper";
    public static final String DEEP_LINK = "Deep Link";
    public static final String EOL_PARTNER = "EOL Partner";
    public static final String FALLBACK = "Fallback";

    private SourceTypes() {
    }
}
