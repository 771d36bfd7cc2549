package io.github.cyfko.taskfilter.spring.autoconfigure;

import io.github.cyfko.taskfilter.core.api.PlaceholderStyle;
import io.github.cyfko.taskfilter.core.config.CachePolicy;
import io.github.cyfko.taskfilter.core.config.CompilerConfig;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * Settings bound from the {@code taskfilter.*} namespace.
 *
 * <pre>
 * taskfilter.cache.enabled=true
 * taskfilter.cache.ttl=5m
 * taskfilter.cache.sweep-interval=10m
 * taskfilter.cache.max-entries=1000
 * taskfilter.placeholder-style=dollar
 * </pre>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
@ConfigurationProperties(prefix = "taskfilter")
public class TaskFilterProperties {
    private Cache cache = new Cache();
    private PlaceholderStyle placeholderStyle = PlaceholderStyle.DOLLAR;

    public static class Cache {
        private boolean enabled = true;
        private Duration ttl = CachePolicy.DEFAULT_TTL;
        private Duration sweepInterval = CachePolicy.DEFAULT_SWEEP_INTERVAL;
        private int maxEntries = CachePolicy.DEFAULT_MAX_ENTRIES;

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public Duration getTtl() {
            return ttl;
        }

        public void setTtl(Duration ttl) {
            this.ttl = ttl;
        }

        public Duration getSweepInterval() {
            return sweepInterval;
        }

        public void setSweepInterval(Duration sweepInterval) {
            this.sweepInterval = sweepInterval;
        }

        public int getMaxEntries() {
            return maxEntries;
        }

        public void setMaxEntries(int maxEntries) {
            this.maxEntries = maxEntries;
        }
    }

    public Cache getCache() {
        return cache;
    }

    public void setCache(Cache cache) {
        this.cache = cache;
    }

    public PlaceholderStyle getPlaceholderStyle() {
        return placeholderStyle;
    }

    public void setPlaceholderStyle(PlaceholderStyle placeholderStyle) {
        this.placeholderStyle = placeholderStyle;
    }

    /**
     * @return the cache policy described by these settings, validated
     * @throws IllegalArgumentException if the durations or size are invalid
     */
    public CachePolicy toCachePolicy() {
        return new CachePolicy(cache.enabled, cache.ttl, cache.sweepInterval, cache.maxEntries);
    }

    public CompilerConfig toCompilerConfig() {
        return CompilerConfig.of(placeholderStyle);
    }
}
