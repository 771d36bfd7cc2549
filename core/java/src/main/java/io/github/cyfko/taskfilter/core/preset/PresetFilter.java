package io.github.cyfko.taskfilter.core.preset;

import io.github.cyfko.taskfilter.core.api.CombiningOperator;
import io.github.cyfko.taskfilter.core.api.ViewMode;
import io.github.cyfko.taskfilter.core.exception.FilterDefinitionException;
import io.github.cyfko.taskfilter.core.model.CustomFilter;
import io.github.cyfko.taskfilter.core.model.FilterCondition;

import java.util.List;
import java.util.Objects;

/**
 * Template of a built-in filter installed for every workspace member.
 *
 * @param name          unique name within a (user, workspace) pair
 * @param viewMode      view the filter belongs to
 * @param operator      logic joining the conditions
 * @param defaultFilter whether the filter starts enabled
 * @param conditions    conditions, in insertion order
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public record PresetFilter(
        String name,
        ViewMode viewMode,
        CombiningOperator operator,
        boolean defaultFilter,
        List<FilterCondition> conditions
) {

    public PresetFilter {
        if (name == null || name.isBlank()) {
            throw new FilterDefinitionException("Preset filter name cannot be blank");
        }
        Objects.requireNonNull(viewMode, "viewMode cannot be null");
        Objects.requireNonNull(operator, "operator cannot be null");
        conditions = List.copyOf(conditions);
    }

    /**
     * Same filter in ad hoc form, e.g. to preview it before it is persisted.
     */
    public CustomFilter toCustomFilter() {
        return new CustomFilter(null, name, operator, conditions);
    }
}
