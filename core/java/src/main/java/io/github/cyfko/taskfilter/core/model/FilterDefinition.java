package io.github.cyfko.taskfilter.core.model;

import io.github.cyfko.taskfilter.core.api.CombiningOperator;
import io.github.cyfko.taskfilter.core.api.ViewMode;
import io.github.cyfko.taskfilter.core.exception.FilterDefinitionException;

import java.time.Instant;
import java.util.List;

/**
 * A persisted, named filter template owned by a (user, workspace) pair.
 * <p>
 * The compiler treats definitions as read-only. When rebuilt from the bulk read of
 * {@link io.github.cyfko.taskfilter.core.spi.FilterDefinitionStore}, only the id, name,
 * operator and conditions are known; the remaining attributes are {@code null}/{@code false}.
 * </p>
 *
 * @param id           storage identifier
 * @param name         display name, also the key of threshold overrides
 * @param viewMode     view the filter belongs to, may be {@code null}
 * @param operator     logic joining the conditions
 * @param defaultFilter whether the filter is enabled by default
 * @param createdAt    creation time, may be {@code null}
 * @param conditions   ordered conditions, possibly empty
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public record FilterDefinition(
        Long id,
        String name,
        ViewMode viewMode,
        CombiningOperator operator,
        boolean defaultFilter,
        Instant createdAt,
        List<FilterCondition> conditions
) {

    public FilterDefinition {
        if (id == null) {
            throw new FilterDefinitionException("Filter definition id cannot be null");
        }
        operator = operator == null ? CombiningOperator.AND : operator;
        conditions = conditions == null ? List.of() : List.copyOf(conditions);
    }

    /**
     * Creates the reduced form produced by row reconstruction.
     */
    public static FilterDefinition of(Long id, String name, CombiningOperator operator, List<FilterCondition> conditions) {
        return new FilterDefinition(id, name, null, operator, false, null, conditions);
    }
}
