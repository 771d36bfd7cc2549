package io.github.cyfko.taskfilter.core.model;

import io.github.cyfko.taskfilter.core.api.ConditionKind;
import io.github.cyfko.taskfilter.core.api.ConditionOperator;
import io.github.cyfko.taskfilter.core.api.TaskField;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * Immutable representation of one atomic test belonging to a filter.
 * <p>
 * Raw names are resolved to the closed enums at construction time; anything unknown
 * becomes an {@code UNSUPPORTED} constant, so a condition can always be built and is
 * simply dropped later by the compiler if it does not map to anything compilable.
 * </p>
 *
 * <h2>Shapes by kind</h2>
 * <ul>
 *   <li>{@link ConditionKind#LIST}: {@code field}, {@code operator}, {@code values}; set membership
 *       may also accept rows with no value through {@code includeNull}</li>
 *   <li>{@link ConditionKind#DATE_DIFF}: {@code dateFrom}, {@code dateTo}, {@code operator},
 *       threshold in {@code values}, optional {@code unit}</li>
 *   <li>{@link ConditionKind#DATE_RANGE}: {@code field}, two ISO dates in {@code values}</li>
 * </ul>
 *
 * <pre>{@code
 * FilterCondition hideDone = FilterCondition.list("status", "!=", "done");
 * FilterCondition dueSoon  = FilterCondition.dateDiff("today", "due_date", "<=", 7);
 * FilterCondition q1       = FilterCondition.dateRange("due_date", "2024-01-01", "2024-03-31");
 * FilterCondition mineOrUnassigned =
 *         FilterCondition.list("assignee", "in", "current_user_id").withIncludeNull(true);
 * }</pre>
 *
 * @param id        storage identifier, {@code null} for ad hoc conditions
 * @param kind      condition kind
 * @param field     subject field for list and date_range conditions
 * @param operator  operator
 * @param values    ordered literal values, never {@code null}, elements may be {@code null}
 * @param dateFrom  start of the difference for date_diff conditions
 * @param dateTo    end of the difference for date_diff conditions
 * @param unit      unit of a date_diff threshold, {@code null} meaning days
 * @param includeNull for {@code IN} and {@code NOT IN} list conditions, also match rows
 *                    where the field has no value
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public record FilterCondition(
        Long id,
        ConditionKind kind,
        TaskField field,
        ConditionOperator operator,
        List<Object> values,
        TaskField dateFrom,
        TaskField dateTo,
        String unit,
        boolean includeNull
) {

    public FilterCondition {
        kind = kind == null ? ConditionKind.UNSUPPORTED : kind;
        field = field == null ? TaskField.UNSUPPORTED : field;
        operator = operator == null ? ConditionOperator.UNSUPPORTED : operator;
        values = values == null ? List.of() : Collections.unmodifiableList(new ArrayList<>(values));
        dateFrom = dateFrom == null ? TaskField.UNSUPPORTED : dateFrom;
        dateTo = dateTo == null ? TaskField.UNSUPPORTED : dateTo;
    }

    /**
     * Builds a condition from the raw strings found in storage or in a request.
     */
    public static FilterCondition of(Long id, String kind, String field, String operator,
                                     List<?> values, String dateFrom, String dateTo, String unit) {
        return new FilterCondition(
                id,
                ConditionKind.fromCode(kind),
                TaskField.fromName(field),
                ConditionOperator.fromString(operator),
                values == null ? null : new ArrayList<>(values),
                TaskField.fromName(dateFrom),
                TaskField.fromName(dateTo),
                unit,
                false
        );
    }

    /**
     * @return a copy of this condition with the given {@code includeNull} flag
     */
    public FilterCondition withIncludeNull(boolean includeNull) {
        return new FilterCondition(id, kind, field, operator, values, dateFrom, dateTo, unit, includeNull);
    }

    public static FilterCondition list(String field, String operator, Object... values) {
        return of(null, "list", field, operator, Arrays.asList(values), null, null, null);
    }

    public static FilterCondition dateDiff(String dateFrom, String dateTo, String operator, Object... thresholds) {
        return of(null, "date_diff", null, operator, Arrays.asList(thresholds), dateFrom, dateTo, "days");
    }

    public static FilterCondition dateRange(String field, Object from, Object to) {
        return of(null, "date_range", field, "BETWEEN", Arrays.asList(from, to), null, null, null);
    }
}
