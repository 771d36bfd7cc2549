package io.github.cyfko.taskfilter.spring.service.impl;

import io.github.cyfko.taskfilter.core.cache.FilterCache;
import io.github.cyfko.taskfilter.core.compiler.CompiledFilter;
import io.github.cyfko.taskfilter.core.compiler.FilterCompileRequest;
import io.github.cyfko.taskfilter.core.compiler.FilterQueryCompiler;
import io.github.cyfko.taskfilter.spring.service.TaskFilterService;

import java.util.Objects;

/**
 * Default {@link TaskFilterService} backed by a {@link FilterQueryCompiler}.
 * <p>
 * The cache handed in must be the one the compiler's definition store reads through,
 * so that {@link #invalidateDefinitions()} affects the next compilation.
 * </p>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public class TaskFilterServiceImpl implements TaskFilterService {

    private final FilterQueryCompiler compiler;
    private final FilterCache cache;

    /**
     * @param compiler compiler used for every request
     * @param cache    definition cache shared with the compiler's store
     */
    public TaskFilterServiceImpl(FilterQueryCompiler compiler, FilterCache cache) {
        this.compiler = Objects.requireNonNull(compiler, "compiler cannot be null");
        this.cache = Objects.requireNonNull(cache, "cache cannot be null");
    }

    @Override
    public CompiledFilter compile(FilterCompileRequest request) {
        return compiler.compile(request);
    }

    @Override
    public void invalidateDefinitions() {
        cache.invalidateAll();
    }
}
