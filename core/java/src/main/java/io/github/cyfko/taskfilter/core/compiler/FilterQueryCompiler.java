package io.github.cyfko.taskfilter.core.compiler;

import io.github.cyfko.taskfilter.core.api.CombiningOperator;
import io.github.cyfko.taskfilter.core.cache.FilterCache;
import io.github.cyfko.taskfilter.core.config.CompilerConfig;
import io.github.cyfko.taskfilter.core.exception.FilterFetchException;
import io.github.cyfko.taskfilter.core.model.CustomFilter;
import io.github.cyfko.taskfilter.core.model.FilterCondition;
import io.github.cyfko.taskfilter.core.model.FilterDefinition;
import io.github.cyfko.taskfilter.core.model.FilterDefinitions;
import io.github.cyfko.taskfilter.core.model.FilterRow;
import io.github.cyfko.taskfilter.core.spi.FilterDefinitionStore;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Compiles the filters enabled on a task listing into one parameterized predicate.
 *
 * <p><strong>Pipeline:</strong></p>
 * <ol>
 *   <li>No filter ids and no custom filters: return an absent predicate, bind nothing</li>
 *   <li>Look the id set up in the {@link FilterCache}; on a miss issue exactly one bulk
 *       {@link FilterDefinitionStore#fetch(List)} and cache the raw rows</li>
 *   <li>Rebuild the definitions from the rows</li>
 *   <li>Per definition, compile each condition and join survivors with the definition's
 *       own {@link CombiningOperator}, wrapped in parentheses</li>
 *   <li>Per custom filter, the same, never cached</li>
 *   <li>Join every surviving fragment with {@code AND}: each enabled filter narrows the
 *       results, filters never alternate</li>
 * </ol>
 *
 * <p><strong>Error Handling:</strong></p>
 * <ul>
 *   <li>Uncompilable conditions are dropped (see {@link ConditionCompiler})</li>
 *   <li>Any storage failure aborts the whole call with {@link FilterFetchException}</li>
 * </ul>
 *
 * <pre>{@code
 * FilterQueryCompiler compiler = new FilterQueryCompiler(store, new FilterCache(CachePolicy.defaults()));
 * CompiledFilter compiled = compiler.compile(List.of(7L, 9L), List.of(), userId, Map.of(), params.size() + 1);
 * compiled.predicate().ifPresent(p -> sql.append(" AND ").append(p));
 * params.addAll(compiled.values());
 * }</pre>
 *
 * <p>Instances are thread-safe and meant to be shared.</p>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public class FilterQueryCompiler {

    private static final Logger logger = Logger.getLogger(FilterQueryCompiler.class.getName());

    private final FilterDefinitionStore store;
    private final FilterCache cache;
    private final ConditionCompiler conditionCompiler;
    private final CompilerConfig config;

    public FilterQueryCompiler(FilterDefinitionStore store, FilterCache cache,
                               ConditionCompiler conditionCompiler, CompilerConfig config) {
        this.store = Objects.requireNonNull(store, "store cannot be null");
        this.cache = Objects.requireNonNull(cache, "cache cannot be null");
        this.conditionCompiler = Objects.requireNonNull(conditionCompiler, "conditionCompiler cannot be null");
        this.config = Objects.requireNonNull(config, "config cannot be null");
    }

    public FilterQueryCompiler(FilterDefinitionStore store, FilterCache cache) {
        this(store, cache, new ConditionCompiler(), CompilerConfig.defaults());
    }

    /**
     * Positional form of {@link #compile(FilterCompileRequest)}.
     *
     * @param filterIds          enabled persisted filter ids, may be {@code null}
     * @param customFilters      ad hoc filters, may be {@code null}
     * @param userId             authenticated user
     * @param thresholdOverrides day overrides by filter name, may be {@code null}
     * @param startIndex         index of the first placeholder
     * @return the compiled predicate and values
     * @throws FilterFetchException if the definitions cannot be read
     */
    public CompiledFilter compile(List<Long> filterIds, List<CustomFilter> customFilters, Long userId,
                                  Map<String, ? extends Number> thresholdOverrides, int startIndex) {
        return compile(new FilterCompileRequest(filterIds, customFilters, userId,
                ThresholdOverrides.of(thresholdOverrides), startIndex));
    }

    /**
     * Compiles a request.
     *
     * @param request the request
     * @return the compiled predicate and values
     * @throws FilterFetchException if the definitions cannot be read
     */
    public CompiledFilter compile(FilterCompileRequest request) {
        Objects.requireNonNull(request, "request cannot be null");
        if (request.isEmpty()) {
            return CompiledFilter.absent(request.startIndex());
        }

        ParameterBuilder params = new ParameterBuilder(request.startIndex(), config.placeholderStyle());
        CompileContext context = new CompileContext(params, request.userId(), null, request.thresholdOverrides());
        List<String> fragments = new ArrayList<>();

        if (!request.filterIds().isEmpty()) {
            for (FilterDefinition definition : FilterDefinitions.fromRows(loadRows(request.filterIds()))) {
                combine(definition.conditions(), definition.operator(), context.forFilter(definition.name()))
                        .ifPresent(fragments::add);
            }
        }
        for (CustomFilter custom : request.customFilters()) {
            combine(custom.conditions(), custom.logic(), context.forFilter(custom.name()))
                    .ifPresent(fragments::add);
        }

        Optional<String> predicate = fragments.isEmpty()
                ? Optional.empty()
                : Optional.of(String.join(CombiningOperator.AND.separator(), fragments));
        return new CompiledFilter(predicate, params.values(), params.nextIndex());
    }

    private List<FilterRow> loadRows(List<Long> filterIds) {
        Optional<List<FilterRow>> cached = cache.get(filterIds);
        if (cached.isPresent()) {
            logger.fine(() -> "Filter cache hit for " + FilterCache.keyOf(filterIds));
            return cached.get();
        }

        logger.fine(() -> "Filter cache miss for " + FilterCache.keyOf(filterIds));
        List<FilterRow> rows;
        try {
            rows = store.fetch(filterIds);
        } catch (RuntimeException e) {
            logger.log(Level.WARNING, "Failed to fetch filter definitions " + filterIds, e);
            throw new FilterFetchException("Failed to fetch filter definitions " + filterIds, e);
        }
        if (rows == null) {
            throw new FilterFetchException("Filter definition store returned no result for " + filterIds);
        }
        cache.put(filterIds, rows);
        return rows;
    }

    private Optional<String> combine(List<FilterCondition> conditions, CombiningOperator operator, CompileContext context) {
        List<String> parts = new ArrayList<>(conditions.size());
        for (FilterCondition condition : conditions) {
            conditionCompiler.compile(condition, context).ifPresent(parts::add);
        }
        if (parts.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of("(" + String.join(operator.separator(), parts) + ")");
    }
}
