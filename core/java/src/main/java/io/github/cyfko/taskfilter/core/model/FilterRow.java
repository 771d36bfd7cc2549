package io.github.cyfko.taskfilter.core.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * One flat row of the bulk definition read: a definition left-joined with one of its
 * conditions.
 * <p>
 * A definition without conditions appears exactly once with every condition column
 * set to {@code null}. Rows are what the cache stores, so they stay raw: no enum
 * resolution happens until {@link FilterDefinitions#fromRows(List)}.
 * </p>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public record FilterRow(
        Long definitionId,
        String name,
        String combiningOperator,
        Long conditionId,
        String conditionKind,
        String field,
        String dateFrom,
        String dateTo,
        String conditionOperator,
        List<Object> values,
        String unit
) {

    public FilterRow {
        Objects.requireNonNull(definitionId, "definitionId cannot be null");
        values = values == null ? null : Collections.unmodifiableList(new ArrayList<>(values));
    }

    /**
     * Row of a definition that owns no condition.
     */
    public static FilterRow withoutCondition(Long definitionId, String name, String combiningOperator) {
        return new FilterRow(definitionId, name, combiningOperator, null, null, null, null, null, null, null, null);
    }

    /**
     * @return {@code true} if this row carries a condition
     */
    public boolean hasCondition() {
        return conditionId != null || conditionKind != null;
    }
}
