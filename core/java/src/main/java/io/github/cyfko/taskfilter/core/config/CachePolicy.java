package io.github.cyfko.taskfilter.core.config;

import java.time.Duration;
import java.util.Objects;

/**
 * Configuration of the filter definition cache.
 *
 * <h2>Configurable Limits</h2>
 * <ul>
 *   <li><strong>cacheEnabled</strong>: cache bulk definition reads (default: true)</li>
 *   <li><strong>ttl</strong>: age after which an entry is no longer a hit (default: 5 minutes)</li>
 *   <li><strong>sweepInterval</strong>: period of the memory sweep, longer than the TTL (default: 10 minutes)</li>
 *   <li><strong>maxEntries</strong>: maximum number of id sets kept (default: 1000)</li>
 * </ul>
 *
 * <h2>Preset Configurations</h2>
 * <pre>{@code
 * CachePolicy policy = CachePolicy.defaults();
 * CachePolicy off    = CachePolicy.none();
 * CachePolicy quick  = CachePolicy.custom(Duration.ofSeconds(30), Duration.ofMinutes(1), 200);
 * }</pre>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public record CachePolicy(
        boolean cacheEnabled,
        Duration ttl,
        Duration sweepInterval,
        int maxEntries
) {

    public static final Duration DEFAULT_TTL = Duration.ofMinutes(5);
    public static final Duration DEFAULT_SWEEP_INTERVAL = Duration.ofMinutes(10);
    public static final int DEFAULT_MAX_ENTRIES = 1000;

    /**
     * Canonical constructor with validation.
     */
    public CachePolicy {
        Objects.requireNonNull(ttl, "ttl cannot be null");
        Objects.requireNonNull(sweepInterval, "sweepInterval cannot be null");
        if (ttl.isNegative() || ttl.isZero()) {
            throw new IllegalArgumentException("ttl must be positive, got: " + ttl);
        }
        if (sweepInterval.compareTo(ttl) <= 0) {
            throw new IllegalArgumentException(
                    "sweepInterval must be longer than ttl, got: " + sweepInterval + " <= " + ttl);
        }
        if (maxEntries <= 0) {
            throw new IllegalArgumentException("maxEntries must be positive, got: " + maxEntries);
        }
    }

    /**
     * Default configuration: 5 minutes TTL, 10 minutes sweep, 1000 entries.
     *
     * @return default configuration
     */
    public static CachePolicy defaults() {
        return new CachePolicy(true, DEFAULT_TTL, DEFAULT_SWEEP_INTERVAL, DEFAULT_MAX_ENTRIES);
    }

    /**
     * Caching completely disabled: every compile call reads storage.
     *
     * @return a policy with caching disabled
     */
    public static CachePolicy none() {
        return new CachePolicy(false, DEFAULT_TTL, DEFAULT_SWEEP_INTERVAL, 1);
    }

    public static CachePolicy custom(Duration ttl, Duration sweepInterval, int maxEntries) {
        return new CachePolicy(true, ttl, sweepInterval, maxEntries);
    }
}
