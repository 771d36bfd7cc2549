package io.github.cyfko.taskfilter.core.cache;

import java.util.Objects;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Periodically evicts expired entries of a {@link FilterCache}.
 * <p>
 * Runs on one daemon thread at the policy's sweep interval. Sweeping bounds memory only;
 * hit/miss decisions never depend on it.
 * </p>
 *
 * <pre>{@code
 * try (FilterCacheSweeper sweeper = FilterCacheSweeper.start(cache)) {
 *     // serve requests
 * }
 * }</pre>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public class FilterCacheSweeper implements AutoCloseable {

    private static final Logger logger = Logger.getLogger(FilterCacheSweeper.class.getName());

    private final FilterCache cache;
    private final ScheduledExecutorService scheduler;

    private FilterCacheSweeper(FilterCache cache) {
        this.cache = cache;
        this.scheduler = Executors.newSingleThreadScheduledExecutor(runnable -> {
            Thread thread = new Thread(runnable, "filter-cache-sweeper");
            thread.setDaemon(true);
            return thread;
        });
    }

    /**
     * Starts sweeping at the interval of the cache's policy.
     *
     * @param cache the cache to sweep
     * @return the running sweeper
     */
    public static FilterCacheSweeper start(FilterCache cache) {
        Objects.requireNonNull(cache, "cache cannot be null");
        FilterCacheSweeper sweeper = new FilterCacheSweeper(cache);
        long intervalMillis = cache.getPolicy().sweepInterval().toMillis();
        sweeper.scheduler.scheduleAtFixedRate(sweeper::sweep, intervalMillis, intervalMillis, TimeUnit.MILLISECONDS);
        logger.info(() -> "Filter cache sweeper started, interval " + cache.getPolicy().sweepInterval());
        return sweeper;
    }

    /**
     * Runs one sweep.
     * <p>
     * A failing sweep is logged and must not cancel the schedule, which is what an
     * exception escaping the task would do.
     * </p>
     *
     * @return number of entries evicted, 0 on failure
     */
    int sweep() {
        try {
            int evicted = cache.sweepExpired();
            if (evicted > 0) {
                logger.fine(() -> "Evicted " + evicted + " expired filter cache entries");
            }
            return evicted;
        } catch (RuntimeException e) {
            logger.log(Level.WARNING, "Filter cache sweep failed", e);
            return 0;
        }
    }

    public boolean isRunning() {
        return !scheduler.isShutdown();
    }

    @Override
    public void close() {
        scheduler.shutdownNow();
        logger.info("Filter cache sweeper stopped");
    }
}
