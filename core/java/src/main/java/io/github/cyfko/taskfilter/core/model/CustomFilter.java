package io.github.cyfko.taskfilter.core.model;

import io.github.cyfko.taskfilter.core.api.CombiningOperator;

import java.util.List;

/**
 * An ad hoc filter supplied inline with a listing request.
 * <p>
 * Custom filters are compiled fresh on every call and never reach the cache. The
 * combining field is called {@code logic} on the wire but behaves exactly like
 * {@link FilterDefinition#operator()}.
 * </p>
 *
 * @param id         client-side identifier, informational only
 * @param name       optional name; when present it is also used for threshold overrides
 * @param logic      logic joining the conditions
 * @param conditions ordered conditions
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public record CustomFilter(String id, String name, CombiningOperator logic, List<FilterCondition> conditions) {

    public CustomFilter {
        logic = logic == null ? CombiningOperator.AND : logic;
        conditions = conditions == null ? List.of() : List.copyOf(conditions);
    }

    public static CustomFilter of(CombiningOperator logic, FilterCondition... conditions) {
        return new CustomFilter(null, null, logic, List.of(conditions));
    }
}
