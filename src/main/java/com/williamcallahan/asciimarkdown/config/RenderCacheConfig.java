package com.williamcallahan.asciimarkdown.config;

import java.time.Duration;
import java.util.Locale;

/**
 * Sizing of the rendered-document cache.
 */
public class RenderCacheConfig {

    private static final long MAX_SIZE_DEF = 500L;
    private static final Duration TTL_DEF = Duration.ofMinutes(30);
    private static final String MAX_SIZE_KEY = "app.cache.max-size";
    private static final String TTL_KEY = "app.cache.ttl";
    private static final String NON_NEG_FMT = "%s must be 0 or greater.";
    private static final String POSITIVE_FMT = "%s must be a positive duration.";

    private long maxSize = MAX_SIZE_DEF;
    private Duration ttl = TTL_DEF;

    /**
     * Creates cache configuration.
     */
    public RenderCacheConfig() {
    }

    /**
     * Validates cache sizing. A maximum size of zero disables caching.
     */
    public void validateConfiguration() {
        if (maxSize < 0) {
            throw new IllegalArgumentException(String.format(Locale.ROOT, NON_NEG_FMT, MAX_SIZE_KEY));
        }
        if (ttl == null || ttl.isNegative() || ttl.isZero()) {
            throw new IllegalArgumentException(String.format(Locale.ROOT, POSITIVE_FMT, TTL_KEY));
        }
    }

    public long getMaxSize() {
        return maxSize;
    }

    public void setMaxSize(final long maxSize) {
        this.maxSize = maxSize;
    }

    public Duration getTtl() {
        return ttl;
    }

    public void setTtl(final Duration ttl) {
        this.ttl = ttl;
    }
}
