package io.github.cyfko.taskfilter.core.compiler;

import java.util.Objects;

/**
 * Per-call state shared by every condition compiled into one statement.
 *
 * @param parameters  the statement's parameter builder
 * @param userId      authenticated user, substituted for {@code current_user_id}; may be {@code null}
 * @param filterName  name of the filter owning the conditions, may be {@code null}
 * @param overrides   threshold overrides
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public record CompileContext(
        ParameterBuilder parameters,
        Long userId,
        String filterName,
        ThresholdOverrides overrides
) {

    public CompileContext {
        Objects.requireNonNull(parameters, "parameters cannot be null");
        overrides = overrides == null ? ThresholdOverrides.none() : overrides;
    }

    /**
     * Same call state, scoped to another owning filter.
     */
    public CompileContext forFilter(String name) {
        return new CompileContext(parameters, userId, name, overrides);
    }
}
