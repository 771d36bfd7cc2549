package io.github.cyfko.taskfilter.core.compiler;

import io.github.cyfko.taskfilter.core.model.CustomFilter;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Input of one {@link FilterQueryCompiler#compile(FilterCompileRequest)} call.
 *
 * <pre>{@code
 * FilterCompileRequest request = FilterCompileRequest.builder()
 *     .userId(42L)
 *     .filterIds(List.of(7L, 9L))
 *     .customFilter(CustomFilter.of(CombiningOperator.OR,
 *             FilterCondition.list("priority", "=", "urgent"),
 *             FilterCondition.list("status", "=", "paused")))
 *     .thresholdOverride("Unchanged in Past 14 Days", 3)
 *     .startIndex(2)
 *     .build();
 * }</pre>
 *
 * @param filterIds          enabled persisted filter ids
 * @param customFilters      ad hoc filters
 * @param userId             authenticated user
 * @param thresholdOverrides date_diff overrides by filter name
 * @param startIndex         index of the first placeholder, at least 1
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public record FilterCompileRequest(
        List<Long> filterIds,
        List<CustomFilter> customFilters,
        Long userId,
        ThresholdOverrides thresholdOverrides,
        int startIndex
) {

    public FilterCompileRequest {
        filterIds = filterIds == null ? List.of() : List.copyOf(filterIds);
        customFilters = customFilters == null ? List.of() : List.copyOf(customFilters);
        thresholdOverrides = thresholdOverrides == null ? ThresholdOverrides.none() : thresholdOverrides;
        if (startIndex < 1) {
            throw new IllegalArgumentException("startIndex must be at least 1, got: " + startIndex);
        }
    }

    /**
     * @return {@code true} if there is nothing to compile
     */
    public boolean isEmpty() {
        return filterIds.isEmpty() && customFilters.isEmpty();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private final List<Long> filterIds = new ArrayList<>();
        private final List<CustomFilter> customFilters = new ArrayList<>();
        private final Map<String, Number> overrides = new LinkedHashMap<>();
        private Long userId;
        private int startIndex = 1;

        public Builder filterIds(List<Long> ids) {
            if (ids != null) filterIds.addAll(ids);
            return this;
        }

        public Builder customFilters(List<CustomFilter> filters) {
            if (filters != null) customFilters.addAll(filters);
            return this;
        }

        public Builder customFilter(CustomFilter filter) {
            customFilters.add(filter);
            return this;
        }

        public Builder userId(Long userId) {
            this.userId = userId;
            return this;
        }

        public Builder thresholdOverrides(Map<String, ? extends Number> values) {
            if (values != null) values.forEach(overrides::put);
            return this;
        }

        public Builder thresholdOverride(String filterName, int days) {
            overrides.put(filterName, days);
            return this;
        }

        public Builder startIndex(int startIndex) {
            this.startIndex = startIndex;
            return this;
        }

        public FilterCompileRequest build() {
            return new FilterCompileRequest(filterIds, customFilters, userId,
                    ThresholdOverrides.of(overrides), startIndex);
        }
    }
}
