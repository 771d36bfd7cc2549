package io.github.cyfko.taskfilter.core.api;

import java.util.HashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Closed set of logical task fields a filter condition may reference.
 * <p>
 * Each constant carries the physical SQL expression it stands for. Logical names coming
 * from requests or from persisted conditions are only ever <em>looked up</em> in this
 * enum, never concatenated into generated SQL: any name outside the known set resolves
 * to {@link #UNSUPPORTED}, which compiles to nothing.
 * </p>
 *
 * <p><strong>Field categories:</strong></p>
 * <ul>
 *   <li><em>Columns</em>: {@code status}, {@code priority}, {@code title}, foreign keys
 *       {@code category} and {@code tag}</li>
 *   <li><em>Date expressions</em>: {@code due_date}, {@code completion_date},
 *       {@code created_date}, {@code last_modified}, {@code start_date}</li>
 *   <li><em>Pseudo-fields</em>: {@code today} (the database's current date, resolved at
 *       execution time so cached predicates stay correct across midnight) and
 *       {@code assignee} (an existence test against the assignment relation)</li>
 * </ul>
 *
 * <pre>{@code
 * TaskField field = TaskField.fromName("due_date");   // DUE_DATE
 * field.expression();                                 // "t.due_date"
 * TaskField.fromName("password");                     // UNSUPPORTED
 * }</pre>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public enum TaskField {

    STATUS("status", "t.status", false),
    PRIORITY("priority", "t.priority", false),
    TITLE("title", "t.title", false),
    DUE_DATE("due_date", "t.due_date", true),
    COMPLETION_DATE("completion_date", "t.completion_date", true),
    CREATED_DATE("created_date", "t.created_at", true),
    LAST_MODIFIED("last_modified", "t.last_modified", true),
    START_DATE("start_date", "t.start_date", true),

    /** Current date of the database session, never a compile-time constant. */
    TODAY("today", "CURRENT_DATE", true),

    CATEGORY("category", "t.category_id", false),
    TAG("tag", "t.tag_id", false),

    /** Many-to-many pseudo-field: has no column, compiles to an existence subquery. */
    ASSIGNEE("assignee", null, false),

    /** Anything not listed above. Never produces SQL. */
    UNSUPPORTED(null, null, false);

    private static final Map<String, TaskField> BY_NAME = new HashMap<>();

    static {
        for (TaskField field : values()) {
            if (field.logicalName != null) {
                BY_NAME.put(field.logicalName, field);
            }
        }
        BY_NAME.put("updated_at", LAST_MODIFIED);
    }

    private final String logicalName;
    private final String expression;
    private final boolean date;

    TaskField(String logicalName, String expression, boolean date) {
        this.logicalName = logicalName;
        this.expression = expression;
        this.date = date;
    }

    /**
     * Resolves a logical field name, case-insensitively.
     *
     * @param name logical name as stored or requested, may be {@code null}
     * @return the matching field, or {@link #UNSUPPORTED}; never {@code null}
     */
    public static TaskField fromName(String name) {
        if (name == null) {
            return UNSUPPORTED;
        }
        return BY_NAME.getOrDefault(name.trim().toLowerCase(Locale.ROOT), UNSUPPORTED);
    }

    /**
     * Returns the canonical logical name, e.g. {@code "due_date"}.
     *
     * @return the logical name
     * @throws UnsupportedOperationException for {@link #UNSUPPORTED}
     */
    public String logicalName() {
        if (this == UNSUPPORTED)
            throw new UnsupportedOperationException("UNSUPPORTED field has no logical name.");
        return logicalName;
    }

    /**
     * Returns the physical SQL expression of this field.
     *
     * @return the SQL expression
     * @throws UnsupportedOperationException for {@link #ASSIGNEE} and {@link #UNSUPPORTED}
     */
    public String expression() {
        if (expression == null)
            throw new UnsupportedOperationException(name() + " field has no column expression.");
        return expression;
    }

    /**
     * Indicates whether this field maps to a plain column or scalar expression.
     *
     * @return {@code true} unless this is {@link #ASSIGNEE} or {@link #UNSUPPORTED}
     */
    public boolean hasExpression() {
        return expression != null;
    }

    /**
     * Indicates whether this field may appear on either side of a date difference
     * or as the subject of a date range.
     *
     * @return {@code true} for date fields and {@link #TODAY}
     */
    public boolean isDate() {
        return date;
    }
}
