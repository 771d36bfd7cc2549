package io.github.cyfko.taskfilter.spring.service;

import io.github.cyfko.taskfilter.core.compiler.CompiledFilter;
import io.github.cyfko.taskfilter.core.compiler.FilterCompileRequest;
import io.github.cyfko.taskfilter.core.exception.FilterFetchException;
import io.github.cyfko.taskfilter.spring.event.FilterDefinitionsChangedEvent;

/**
 * Entry point for request handlers that build filtered task listings.
 *
 * <h2>Usage Context</h2>
 * <ul>
 *   <li>Injectable bean registered by the autoconfiguration</li>
 *   <li>Compiles the filters of a listing request into a predicate and its values</li>
 *   <li>Clears cached definitions after out-of-band changes</li>
 * </ul>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 * @see FilterDefinitionsChangedEvent
 */
public interface TaskFilterService {

    /**
     * @param request the filters to compile
     * @return the predicate and its values
     * @throws FilterFetchException if the definitions cannot be read
     */
    CompiledFilter compile(FilterCompileRequest request);

    /**
     * Drops every cached definition. Prefer publishing a {@link FilterDefinitionsChangedEvent}.
     */
    void invalidateDefinitions();
}
