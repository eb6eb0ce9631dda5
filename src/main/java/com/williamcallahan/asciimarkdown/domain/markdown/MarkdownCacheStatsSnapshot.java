package com.williamcallahan.asciimarkdown.domain.markdown;

import com.github.benmanes.caffeine.cache.stats.CacheStats;

import java.util.Locale;
import java.util.Objects;

/**
 * Point-in-time statistics of the plain-text render cache.
 */
public record MarkdownCacheStatsSnapshot(
    long hitCount,
    long missCount,
    long evictionCount,
    long size,
    String hitRate
) implements MarkdownCacheStatsResponse {
    public MarkdownCacheStatsSnapshot {
        Objects.requireNonNull(hitRate, "Hit rate string cannot be null");
        if (hitCount < 0 || missCount < 0 || evictionCount < 0 || size < 0) {
            throw new IllegalArgumentException("Cache stats must be non-negative");
        }
    }

    /**
     * Builds a snapshot from Caffeine statistics.
     *
     * @param stats cache statistics
     * @param size estimated number of entries
     * @return snapshot with the hit rate formatted as a percentage
     */
    public static MarkdownCacheStatsSnapshot from(CacheStats stats, long size) {
        return new MarkdownCacheStatsSnapshot(
            stats.hitCount(),
            stats.missCount(),
            stats.evictionCount(),
            size,
            String.format(Locale.ROOT, "%.2f%%", stats.hitRate() * 100)
        );
    }
}
