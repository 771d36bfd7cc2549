package io.github.cyfko.taskfilter.core.cache;

import io.github.cyfko.taskfilter.core.config.CachePolicy;
import io.github.cyfko.taskfilter.core.model.FilterRow;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Collection;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.TreeSet;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.stream.Collectors;

/**
 * TTL-bounded cache from a filter-id set to the rows fetched for that set.
 * <p>
 * Keys are canonical: ids are de-duplicated, sorted and comma-joined, so {@code [3, 1]}
 * and {@code [1, 3, 3]} share the entry {@code "1,3"}. Because the key space is every
 * combination of ids, there is no per-id invalidation: any create, update or delete of a
 * persisted filter definition must call {@link #invalidateAll()}.
 * </p>
 *
 * <h2>Expiry</h2>
 * <p>
 * {@link #get(Collection)} is the only authority on hits: an entry older than the TTL is
 * a miss even while it still sits in memory. {@link #sweepExpired()} (run periodically by
 * {@link FilterCacheSweeper}) only reclaims that memory. Time comes from the injected
 * {@link Clock}, which lets tests move time without sleeping.
 * </p>
 *
 * <h2>Thread Safety</h2>
 * <p>
 * All operations are guarded by a {@link ReadWriteLock}. Staleness of up to one TTL
 * between a definition change and a concurrent read is accepted.
 * </p>
 *
 * <pre>{@code
 * FilterCache cache = new FilterCache(CachePolicy.defaults(), Clock.systemUTC());
 * cache.put(List.of(3L, 1L), rows);
 * cache.get(List.of(1L, 3L));   // Optional[rows] for the next 5 minutes
 * cache.invalidateAll();
 * }</pre>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public class FilterCache {

    private final CachePolicy policy;
    private final Clock clock;
    private final Map<String, Entry> entries = new LinkedHashMap<>();
    private final ReadWriteLock lock = new ReentrantReadWriteLock();

    private record Entry(List<FilterRow> rows, Instant insertedAt) {}

    public FilterCache(CachePolicy policy, Clock clock) {
        this.policy = Objects.requireNonNull(policy, "policy cannot be null");
        this.clock = Objects.requireNonNull(clock, "clock cannot be null");
    }

    public FilterCache(CachePolicy policy) {
        this(policy, Clock.systemUTC());
    }

    /**
     * Builds the canonical key of an id set.
     *
     * @param filterIds ids, order and duplicates irrelevant
     * @return the key, e.g. {@code "1,3,12"}
     */
    public static String keyOf(Collection<Long> filterIds) {
        return new TreeSet<>(filterIds).stream()
                .map(String::valueOf)
                .collect(Collectors.joining(","));
    }

    /**
     * Looks up the rows of an id set.
     *
     * @param filterIds the id set
     * @return the cached rows, or empty if absent, expired or caching is disabled
     */
    public Optional<List<FilterRow>> get(Collection<Long> filterIds) {
        if (!policy.cacheEnabled()) {
            return Optional.empty();
        }
        String key = keyOf(filterIds);
        lock.readLock().lock();
        try {
            Entry entry = entries.get(key);
            if (entry == null || isExpired(entry, clock.instant())) {
                return Optional.empty();
            }
            return Optional.of(entry.rows());
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Stores the rows of an id set, stamped with the current instant.
     * <p>
     * When the cache is full the oldest insertion is evicted.
     * </p>
     *
     * @param filterIds the id set
     * @param rows      rows fetched for exactly that set
     */
    public void put(Collection<Long> filterIds, List<FilterRow> rows) {
        if (!policy.cacheEnabled()) {
            return;
        }
        String key = keyOf(filterIds);
        Entry entry = new Entry(List.copyOf(rows), clock.instant());
        lock.writeLock().lock();
        try {
            entries.remove(key);
            entries.put(key, entry);
            Iterator<String> oldest = entries.keySet().iterator();
            while (entries.size() > policy.maxEntries() && oldest.hasNext()) {
                oldest.next();
                oldest.remove();
            }
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * Drops every entry.
     */
    public void invalidateAll() {
        lock.writeLock().lock();
        try {
            entries.clear();
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * Physically removes entries older than the TTL.
     *
     * @return number of entries removed
     */
    public int sweepExpired() {
        Instant now = clock.instant();
        lock.writeLock().lock();
        try {
            int before = entries.size();
            entries.values().removeIf(entry -> isExpired(entry, now));
            return before - entries.size();
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * @return number of entries physically held, expired ones included
     */
    public int size() {
        lock.readLock().lock();
        try {
            return entries.size();
        } finally {
            lock.readLock().unlock();
        }
    }

    public CachePolicy getPolicy() {
        return policy;
    }

    private boolean isExpired(Entry entry, Instant now) {
        return Duration.between(entry.insertedAt(), now).compareTo(policy.ttl()) >= 0;
    }
}
