package io.github.jakubt4.astrolabe.service.cache;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Expiry;
import com.github.benmanes.caffeine.cache.Ticker;
import com.github.benmanes.caffeine.cache.stats.CacheStats;
import io.github.jakubt4.astrolabe.config.AstrolabeProperties;
import lombok.extern.slf4j.Slf4j;

import java.util.function.Supplier;

/**
 * Size-bounded result cache with per-tier time-to-live.
 *
 * <p>Values are computed outside the cache: concurrent misses for the same key may both
 * compute, and the last {@code put} wins. A disabled cache always recomputes.
 */
@Slf4j
public class ResultCache {

    private final boolean enabled;
    private final Cache<CacheKey, Entry> cache;

    public ResultCache(final AstrolabeProperties.Cache properties) {
        this(properties, Ticker.systemTicker());
    }

    public ResultCache(final AstrolabeProperties.Cache properties, final Ticker ticker) {
        this.enabled = properties.enabled();
        final var builder = Caffeine.newBuilder()
                .maximumSize(properties.maximumSize())
                .expireAfter(new TierExpiry(properties.natalTtl().toNanos(), properties.datedTtl().toNanos()))
                .ticker(ticker);
        if (properties.recordStats()) {
            builder.recordStats();
        }
        this.cache = builder.build();
        log.info("Result cache {} [maximumSize={}, natalTtl={}, datedTtl={}]", enabled ? "enabled" : "disabled",
                properties.maximumSize(), properties.natalTtl(), properties.datedTtl());
    }

    public Object getOrCompute(final CacheKey key, final CacheTier tier, final Supplier<?> computation) {
        if (!enabled) {
            return computation.get();
        }
        final var cached = cache.getIfPresent(key);
        if (cached != null) {
            log.debug("Cache hit [{}]", key.analysisId());
            return cached.value();
        }
        final var value = computation.get();
        cache.put(key, new Entry(tier, value));
        return value;
    }

    public boolean contains(final CacheKey key) {
        return enabled && cache.getIfPresent(key) != null;
    }

    public void invalidateAll() {
        cache.invalidateAll();
    }

    public long size() {
        cache.cleanUp();
        return cache.estimatedSize();
    }

    public CacheStats stats() {
        return cache.stats();
    }

    private record Entry(CacheTier tier, Object value) {
    }

    private record TierExpiry(long natalNanos, long datedNanos) implements Expiry<CacheKey, Entry> {

        @Override
        public long expireAfterCreate(final CacheKey key, final Entry entry, final long currentTime) {
            return entry.tier() == CacheTier.NATAL ? natalNanos : datedNanos;
        }

        @Override
        public long expireAfterUpdate(final CacheKey key, final Entry entry, final long currentTime,
                                      final long currentDuration) {
            return expireAfterCreate(key, entry, currentTime);
        }

        @Override
        public long expireAfterRead(final CacheKey key, final Entry entry, final long currentTime,
                                    final long currentDuration) {
            return currentDuration;
        }
    }
}
