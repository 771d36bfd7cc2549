package io.github.cyfko.taskfilter.core.spi;

import io.github.cyfko.taskfilter.core.model.FilterRow;

import java.util.List;

/**
 * Storage-facing contract consumed by the compiler: one bulk read of filter definitions.
 * <p>
 * Implementations return, in a single round trip, every requested definition and every
 * condition it owns, left-joined so that a definition without conditions still appears
 * once with all condition columns {@code null}. Ids that match nothing are simply absent
 * from the result.
 * </p>
 * <p>
 * Any failure must surface as an exception; an implementation must never answer an
 * unreachable store with an empty list, since the compiler would then treat the
 * requested filters as if they did not exist.
 * </p>
 *
 * <pre>{@code
 * FilterDefinitionStore store = ids -> jdbc.query(BULK_SQL, rowMapper, ids);
 * }</pre>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
@FunctionalInterface
public interface FilterDefinitionStore {

    /**
     * Fetches the flat rows of the given definitions.
     *
     * @param definitionIds ids to read, non-empty
     * @return flat rows ordered by definition id then condition id
     * @throws RuntimeException if storage cannot be read
     */
    List<FilterRow> fetch(List<Long> definitionIds);
}
