package io.github.cyfko.taskfilter.core.compiler;

import io.github.cyfko.taskfilter.core.api.ConditionOperator;
import io.github.cyfko.taskfilter.core.api.TaskField;
import io.github.cyfko.taskfilter.core.model.FilterCondition;

import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;
import java.util.logging.Logger;

/**
 * Compiles one {@link FilterCondition} into SQL predicate text.
 * <p>
 * Every literal is bound through the context's {@link ParameterBuilder}; the only text
 * that reaches the predicate comes from the closed {@link TaskField} and
 * {@link ConditionOperator} tables. Placeholders are consumed only once a condition is
 * known to compile, so a dropped condition never leaves a gap in the index sequence.
 * </p>
 *
 * <h2>Tolerant degradation</h2>
 * <p>
 * A condition that does not map to anything compilable (unknown field, kind or operator,
 * wrong number of values, a threshold that is not an exact {@code int}, an unparseable
 * date) yields {@link Optional#empty()}
 * and is logged at {@code FINE}. The rest of the filter still compiles.
 * </p>
 *
 * <h2>Generated shapes</h2>
 * <pre>{@code
 * status != done                    ->  t.status <> $1
 * priority IN [high, urgent]        ->  t.priority = ANY($1)
 * category IN [3, 4] or no category ->  (t.category_id = ANY($1) OR t.category_id IS NULL)
 * assignee = current_user_id        ->  EXISTS (SELECT 1 FROM task_assignees ta WHERE ta.task_id = t.id AND ta.user_id = $1)
 * today -> due_date <= 7            ->  (CAST(t.due_date AS DATE) - CURRENT_DATE) <= $1
 * due_date in [2024-01-01, 2024-03-31] -> CAST(t.due_date AS DATE) BETWEEN $1 AND $2
 * }</pre>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public class ConditionCompiler {

    private static final Logger logger = Logger.getLogger(ConditionCompiler.class.getName());

    /** Literal standing for the authenticated user in assignee conditions. */
    public static final String CURRENT_USER = "current_user_id";

    private static final String ASSIGNMENT_EXISTS = "SELECT 1 FROM task_assignees ta WHERE ta.task_id = t.id";
    private static final String UNASSIGNED = "NOT EXISTS (" + ASSIGNMENT_EXISTS + ")";

    /**
     * Compiles a condition.
     *
     * @param condition the condition
     * @param context   per-call state
     * @return the predicate text, or empty if the condition was dropped
     */
    public Optional<String> compile(FilterCondition condition, CompileContext context) {
        Objects.requireNonNull(condition, "condition cannot be null");
        Objects.requireNonNull(context, "context cannot be null");

        Optional<String> fragment = switch (condition.kind()) {
            case LIST -> compileList(condition, context);
            case DATE_DIFF -> compileDateDiff(condition, context);
            case DATE_RANGE -> compileDateRange(condition, context);
            case UNSUPPORTED -> Optional.empty();
        };

        if (fragment.isEmpty()) {
            logger.fine(() -> "Dropped uncompilable condition " + condition
                    + " of filter '" + context.filterName() + "'");
        }
        return fragment;
    }

    // ---------------------------------------------------------------- list

    private Optional<String> compileList(FilterCondition condition, CompileContext context) {
        TaskField field = condition.field();
        if (field == TaskField.ASSIGNEE) {
            return compileAssignee(condition, context);
        }
        if (!field.hasExpression()) {
            return Optional.empty();
        }

        String expression = field.expression();
        ConditionOperator op = condition.operator();
        List<Object> values = condition.values();
        ParameterBuilder params = context.parameters();

        if (op.isNullCheck()) {
            return Optional.of(expression + (op == ConditionOperator.IS_NULL ? " IS NULL" : " IS NOT NULL"));
        }
        if (op.isScalarComparison()) {
            if (values.size() != 1 || values.get(0) == null) {
                return Optional.empty();
            }
            return Optional.of(expression + " " + op.sqlComparison() + " " + params.add(values.get(0)));
        }
        if (op.isSetMembership()) {
            List<Object> members = flatten(values);
            if (members.contains(null)) {
                return Optional.empty();
            }
            if (members.isEmpty()) {
                return op == ConditionOperator.IN && condition.includeNull()
                        ? Optional.of(expression + " IS NULL")
                        : Optional.empty();
            }
            String predicate = membership(op, expression, params.addArray(members), params);
            return Optional.of(condition.includeNull() ? "(" + predicate + " OR " + expression + " IS NULL)" : predicate);
        }
        if (op == ConditionOperator.BETWEEN) {
            if (values.size() != 2 || values.contains(null)) {
                return Optional.empty();
            }
            String low = params.add(values.get(0));
            String high = params.add(values.get(1));
            return Optional.of(expression + " BETWEEN " + low + " AND " + high);
        }
        return Optional.empty();
    }

    private Optional<String> compileAssignee(FilterCondition condition, CompileContext context) {
        ConditionOperator op = condition.operator();
        ParameterBuilder params = context.parameters();

        switch (op) {
            case IS_NULL:
                return Optional.of(UNASSIGNED);
            case NOT_NULL:
                return Optional.of("EXISTS (" + ASSIGNMENT_EXISTS + ")");
            case EQ:
            case NE: {
                if (condition.values().size() != 1) {
                    return Optional.empty();
                }
                Optional<Long> user = resolveUser(condition.values().get(0), context.userId());
                if (user.isEmpty()) {
                    return Optional.empty();
                }
                String subquery = "(" + ASSIGNMENT_EXISTS + " AND ta.user_id = " + params.add(user.get()) + ")";
                return Optional.of((op == ConditionOperator.EQ ? "EXISTS " : "NOT EXISTS ") + subquery);
            }
            case IN:
            case NOT_IN: {
                List<Long> users = new ArrayList<>();
                for (Object raw : flatten(condition.values())) {
                    Optional<Long> user = resolveUser(raw, context.userId());
                    if (user.isEmpty()) {
                        return Optional.empty();
                    }
                    users.add(user.get());
                }
                boolean orUnassigned = op == ConditionOperator.IN && condition.includeNull();
                if (users.isEmpty()) {
                    return orUnassigned ? Optional.of(UNASSIGNED) : Optional.empty();
                }
                String token = params.addArray(users);
                String subquery = "(" + ASSIGNMENT_EXISTS + " AND " + params.style().membership("ta.user_id", token) + ")";
                if (op == ConditionOperator.NOT_IN) {
                    // unassigned tasks already satisfy NOT EXISTS
                    return Optional.of("NOT EXISTS " + subquery);
                }
                return Optional.of(orUnassigned ? "(EXISTS " + subquery + " OR " + UNASSIGNED + ")" : "EXISTS " + subquery);
            }
            default:
                return Optional.empty();
        }
    }

    // ---------------------------------------------------------- date_diff

    private Optional<String> compileDateDiff(FilterCondition condition, CompileContext context) {
        TaskField from = condition.dateFrom();
        TaskField to = condition.dateTo();
        if (!from.isDate() || !to.isDate()) {
            return Optional.empty();
        }
        int daysPerUnit = daysPerUnit(condition.unit());
        if (daysPerUnit == 0) {
            return Optional.empty();
        }

        String difference = "(" + asDate(to) + " - " + asDate(from) + ")";
        ConditionOperator op = condition.operator();
        ParameterBuilder params = context.parameters();

        if (op.isScalarComparison()) {
            Optional<Integer> threshold = context.overrides().forFilter(context.filterName());
            if (threshold.isEmpty()) {
                if (condition.values().size() != 1) {
                    return Optional.empty();
                }
                threshold = IntegralValues.toInt(condition.values().get(0))
                        .flatMap(n -> IntegralValues.scale(n, daysPerUnit));
            }
            if (threshold.isEmpty()) {
                return Optional.empty();
            }
            return Optional.of(difference + " " + op.sqlComparison() + " " + params.add(threshold.get()));
        }
        if (op == ConditionOperator.BETWEEN) {
            if (condition.values().size() != 2) {
                return Optional.empty();
            }
            Optional<Integer> low = IntegralValues.toInt(condition.values().get(0))
                    .flatMap(n -> IntegralValues.scale(n, daysPerUnit));
            Optional<Integer> high = IntegralValues.toInt(condition.values().get(1))
                    .flatMap(n -> IntegralValues.scale(n, daysPerUnit));
            if (low.isEmpty() || high.isEmpty()) {
                return Optional.empty();
            }
            return Optional.of(difference + " BETWEEN " + params.add(low.get())
                    + " AND " + params.add(high.get()));
        }
        return Optional.empty();
    }

    // --------------------------------------------------------- date_range

    private Optional<String> compileDateRange(FilterCondition condition, CompileContext context) {
        TaskField field = condition.field();
        if (!field.isDate() || condition.values().size() != 2) {
            return Optional.empty();
        }
        Optional<LocalDate> from = parseDate(condition.values().get(0));
        Optional<LocalDate> to = parseDate(condition.values().get(1));
        if (from.isEmpty() || to.isEmpty()) {
            return Optional.empty();
        }
        ParameterBuilder params = context.parameters();
        String low = params.add(from.get());
        String high = params.add(to.get());
        return Optional.of(asDate(field) + " BETWEEN " + low + " AND " + high);
    }

    // ------------------------------------------------------------ helpers

    private static String membership(ConditionOperator op, String expression, String token, ParameterBuilder params) {
        String inSet = params.style().membership(expression, token);
        return op == ConditionOperator.IN ? inSet : "NOT (" + inSet + ")";
    }

    private static String asDate(TaskField field) {
        return field == TaskField.TODAY ? field.expression() : "CAST(" + field.expression() + " AS DATE)";
    }

    /** A single collection element is the list itself. */
    private static List<Object> flatten(List<Object> values) {
        if (values.size() == 1 && values.get(0) instanceof Collection<?> nested) {
            return new ArrayList<>(nested);
        }
        return values;
    }

    /** @return days per unit, 0 if the unit is unknown */
    private static int daysPerUnit(String unit) {
        if (unit == null) {
            return 1;
        }
        return switch (unit.trim().toLowerCase(Locale.ROOT)) {
            case "", "day", "days" -> 1;
            case "week", "weeks" -> 7;
            default -> 0;
        };
    }

    private static Optional<Long> resolveUser(Object raw, Long currentUser) {
        if (CURRENT_USER.equals(raw)) {
            return Optional.ofNullable(currentUser);
        }
        if (raw instanceof Number number) {
            return Optional.of(number.longValue());
        }
        if (raw instanceof String text) {
            try {
                return Optional.of(Long.parseLong(text.trim()));
            } catch (NumberFormatException e) {
                return Optional.empty();
            }
        }
        return Optional.empty();
    }

    private static Optional<LocalDate> parseDate(Object raw) {
        if (raw instanceof LocalDate date) {
            return Optional.of(date);
        }
        if (raw instanceof String text && text.length() >= 10) {
            try {
                return Optional.of(LocalDate.parse(text.substring(0, 10)));
            } catch (DateTimeParseException e) {
                return Optional.empty();
            }
        }
        return Optional.empty();
    }
}
