package io.github.cyfko.taskfilter.spring.event;

import io.github.cyfko.taskfilter.core.cache.FilterCache;
import org.springframework.context.ApplicationListener;

import java.util.Objects;
import java.util.logging.Logger;

/**
 * Clears the {@link FilterCache} whenever a {@link FilterDefinitionsChangedEvent} is published.
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public class FilterCacheInvalidationListener implements ApplicationListener<FilterDefinitionsChangedEvent> {

    private static final Logger logger = Logger.getLogger(FilterCacheInvalidationListener.class.getName());

    private final FilterCache cache;

    public FilterCacheInvalidationListener(FilterCache cache) {
        this.cache = Objects.requireNonNull(cache, "cache cannot be null");
    }

    @Override
    public void onApplicationEvent(FilterDefinitionsChangedEvent event) {
        cache.invalidateAll();
        logger.fine(() -> "Filter cache invalidated after change of definitions " + event.getDefinitionIds());
    }
}
