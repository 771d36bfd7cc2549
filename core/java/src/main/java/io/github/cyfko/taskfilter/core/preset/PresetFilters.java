package io.github.cyfko.taskfilter.core.preset;

import io.github.cyfko.taskfilter.core.api.CombiningOperator;
import io.github.cyfko.taskfilter.core.api.ViewMode;
import io.github.cyfko.taskfilter.core.model.FilterCondition;

import java.util.List;

import static io.github.cyfko.taskfilter.core.compiler.ConditionCompiler.CURRENT_USER;

/**
 * The built-in filters every workspace member starts with.
 *
 * <table>
 *   <caption>Presets</caption>
 *   <tr><th>Name</th><th>View</th><th>Logic</th><th>Default</th></tr>
 *   <tr><td>Hide Completed</td><td>planner</td><td>AND</td><td>yes</td></tr>
 *   <tr><td>Assigned to Me</td><td>planner</td><td>AND</td><td>no</td></tr>
 *   <tr><td>Due in 7 Days</td><td>planner</td><td>AND</td><td>no</td></tr>
 *   <tr><td>Overdue Tasks</td><td>planner</td><td>AND</td><td>no</td></tr>
 *   <tr><td>High/Urgent Priority</td><td>planner</td><td>AND</td><td>no</td></tr>
 *   <tr><td>Active in Past 7 Days</td><td>tracker</td><td>OR</td><td>yes</td></tr>
 *   <tr><td>Unchanged in Past 14 Days</td><td>tracker</td><td>AND</td><td>no</td></tr>
 *   <tr><td>Lasted More Than 1 Day</td><td>tracker</td><td>AND</td><td>no</td></tr>
 * </table>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public final class PresetFilters {

    private static final List<PresetFilter> DEFAULTS = List.of(
            new PresetFilter("Hide Completed", ViewMode.PLANNER, CombiningOperator.AND, true, List.of(
                    FilterCondition.list("status", "!=", "done"))),
            new PresetFilter("Assigned to Me", ViewMode.PLANNER, CombiningOperator.AND, false, List.of(
                    FilterCondition.list("assignee", "=", CURRENT_USER))),
            new PresetFilter("Due in 7 Days", ViewMode.PLANNER, CombiningOperator.AND, false, List.of(
                    FilterCondition.dateDiff("today", "due_date", "<=", 7))),
            new PresetFilter("Overdue Tasks", ViewMode.PLANNER, CombiningOperator.AND, false, List.of(
                    FilterCondition.dateDiff("today", "due_date", "<", 0),
                    FilterCondition.list("status", "!=", "done"))),
            new PresetFilter("High/Urgent Priority", ViewMode.PLANNER, CombiningOperator.AND, false, List.of(
                    FilterCondition.list("priority", "IN", "high", "urgent"))),
            new PresetFilter("Active in Past 7 Days", ViewMode.TRACKER, CombiningOperator.OR, true, List.of(
                    FilterCondition.list("status", "IN", "in_progress", "paused"),
                    FilterCondition.dateDiff("completion_date", "today", "<=", 7))),
            new PresetFilter("Unchanged in Past 14 Days", ViewMode.TRACKER, CombiningOperator.AND, false, List.of(
                    FilterCondition.list("status", "!=", "done"),
                    FilterCondition.dateDiff("last_modified", "today", ">", 14))),
            new PresetFilter("Lasted More Than 1 Day", ViewMode.TRACKER, CombiningOperator.AND, false, List.of(
                    FilterCondition.dateDiff("start_date", "completion_date", ">", 1)))
    );

    private PresetFilters() {}

    public static List<PresetFilter> defaults() {
        return DEFAULTS;
    }

    /**
     * @param viewMode the view
     * @return the presets of that view, in installation order
     */
    public static List<PresetFilter> forView(ViewMode viewMode) {
        return DEFAULTS.stream().filter(p -> p.viewMode() == viewMode).toList();
    }
}
