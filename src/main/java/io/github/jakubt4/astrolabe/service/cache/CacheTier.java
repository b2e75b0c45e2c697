package io.github.jakubt4.astrolabe.service.cache;

/**
 * Lifetime class of a cached analysis.
 */
public enum CacheTier {
    /** Depends on birth data only. */
    NATAL,
    /** Depends on an as-of date or on transiting positions. */
    DATED
}
