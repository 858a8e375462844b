package com.components.sourcing.cache;

/**
 * Outcome of {@link SearchResultCache#set}.
 */
public enum CacheWrite {
    STORED,
    SKIPPED_EMPTY,
    SKIPPED_DISABLED,
    FAILED;

    public boolean stored() {
        return this == STORED;
    }
}
