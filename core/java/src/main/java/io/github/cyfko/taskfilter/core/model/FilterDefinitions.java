package io.github.cyfko.taskfilter.core.model;

import io.github.cyfko.taskfilter.core.api.CombiningOperator;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Rebuilds {@link FilterDefinition} groupings from the flat rows of the bulk read.
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public final class FilterDefinitions {

    private FilterDefinitions() {}

    /**
     * Groups rows by definition id.
     * <p>
     * Definitions keep the order of their first row and conditions keep row order. A
     * definition whose only row has no condition is returned with an empty condition list.
     * </p>
     *
     * @param rows flat rows, possibly empty
     * @return the definitions, never {@code null}
     */
    public static List<FilterDefinition> fromRows(List<FilterRow> rows) {
        Map<Long, FilterRow> heads = new LinkedHashMap<>();
        Map<Long, List<FilterCondition>> conditions = new LinkedHashMap<>();

        for (FilterRow row : rows) {
            heads.putIfAbsent(row.definitionId(), row);
            List<FilterCondition> owned = conditions.computeIfAbsent(row.definitionId(), k -> new ArrayList<>());
            if (row.hasCondition()) {
                owned.add(FilterCondition.of(
                        row.conditionId(),
                        row.conditionKind(),
                        row.field(),
                        row.conditionOperator(),
                        row.values(),
                        row.dateFrom(),
                        row.dateTo(),
                        row.unit()));
            }
        }

        List<FilterDefinition> definitions = new ArrayList<>(heads.size());
        for (FilterRow head : heads.values()) {
            definitions.add(FilterDefinition.of(
                    head.definitionId(),
                    head.name(),
                    CombiningOperator.fromString(head.combiningOperator()),
                    conditions.get(head.definitionId())));
        }
        return definitions;
    }
}
