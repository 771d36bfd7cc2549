package io.github.cyfko.taskfilter.core.api;

import java.util.Locale;

/**
 * Enumeration of the operators a filter condition may use.
 * <p>
 * Each operator has a stored symbol (the form persisted in {@code filter_conditions}),
 * a short code, and the name the web client sends for ad hoc filters. Scalar comparisons
 * also have the two-letter comparator of the client's date_diff filter ({@code lt},
 * {@code le}, {@code eq}, {@code ge}, {@code gt}, {@code ne}). Parsing accepts any of
 * these forms, ignoring case.
 * </p>
 *
 * <p><strong>Operator shapes:</strong></p>
 * <ul>
 *     <li>EQ / = , NE / != , LT / &lt; , LTE / &lt;= , GT / &gt; , GTE / &gt;= : one scalar</li>
 *     <li>IN / IN , NOT_IN / NOT IN : the whole list bound as one array parameter</li>
 *     <li>IS_NULL / IS_NULL , NOT_NULL / IS_NOT_NULL : nothing bound</li>
 *     <li>BETWEEN / BETWEEN : two endpoints</li>
 * </ul>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public enum ConditionOperator {

    /** Equality: "=" */
    EQ("=", "EQ", "equals", "eq"),

    /** Inequality: "!=" */
    NE("!=", "NE", "not_equals", "ne"),

    /** Less than: "&lt;" */
    LT("<", "LT", "less_than", "lt"),

    /** Less than or equal: "&lt;=" */
    LTE("<=", "LTE", "less_than_or_equal", "le"),

    /** Greater than: "&gt;" */
    GT(">", "GT", "greater_than", "gt"),

    /** Greater than or equal: "&gt;=" */
    GTE(">=", "GTE", "greater_than_or_equal", "ge"),

    /** Set membership, the value list is bound as a single parameter. */
    IN("IN", "IN", "in", null),

    /** Negated set membership. */
    NOT_IN("NOT IN", "NOT_IN", "not_in", null),

    IS_NULL("IS_NULL", "IS NULL", "is_null", null),

    NOT_NULL("IS_NOT_NULL", "IS NOT NULL", "is_not_null", null),

    /** Inclusive range with exactly two endpoints. */
    BETWEEN("BETWEEN", "RANGE", "between", null),

    /**
     * Marker for anything that could not be parsed.
     * Conditions carrying it never compile.
     */
    UNSUPPORTED(null, null, null, null);

    private final String symbol;
    private final String code;
    private final String clientName;
    private final String comparator;

    ConditionOperator(String symbol, String code, String clientName, String comparator) {
        this.symbol = symbol;
        this.code = code;
        this.clientName = clientName;
        this.comparator = comparator;
    }

    /**
     * Finds an operator by symbol, code, client name or comparator, ignoring case.
     *
     * @param value the raw operator, may be {@code null}
     * @return matching operator, or {@link #UNSUPPORTED}; never {@code null}
     */
    public static ConditionOperator fromString(String value) {
        if (value == null) {
            return UNSUPPORTED;
        }
        String trimmed = value.trim();
        for (ConditionOperator op : values()) {
            if (op == UNSUPPORTED) continue;
            if (op.symbol.equalsIgnoreCase(trimmed)) return op;
            if (op.code.equalsIgnoreCase(trimmed)) return op;
            if (op.clientName.equals(trimmed.toLowerCase(Locale.ROOT))) return op;
            if (op.comparator != null && op.comparator.equalsIgnoreCase(trimmed)) return op;
        }
        return UNSUPPORTED;
    }

    /**
     * Returns the symbol as persisted, e.g. {@code "<="} or {@code "IS_NULL"}.
     *
     * @return the stored symbol
     * @throws UnsupportedOperationException for {@link #UNSUPPORTED}
     */
    public String getSymbol() {
        if (this == UNSUPPORTED)
            throw new UnsupportedOperationException("UNSUPPORTED operator has no symbol.");
        return symbol;
    }

    /**
     * Returns the SQL comparison token for scalar comparisons.
     *
     * @return {@code "="}, {@code "<>"}, {@code "<"}, {@code "<="}, {@code ">"} or {@code ">="}
     * @throws UnsupportedOperationException if this operator is not a scalar comparison
     */
    public String sqlComparison() {
        switch (this) {
            case EQ: return "=";
            case NE: return "<>";
            case LT: return "<";
            case LTE: return "<=";
            case GT: return ">";
            case GTE: return ">=";
            default:
                throw new UnsupportedOperationException(name() + " is not a scalar comparison.");
        }
    }

    /**
     * Indicates whether this operator compares against exactly one scalar value.
     *
     * @return {@code true} for EQ, NE, LT, LTE, GT and GTE
     */
    public boolean isScalarComparison() {
        return this == EQ || this == NE || this == LT || this == LTE || this == GT || this == GTE;
    }

    /**
     * Indicates whether this operator binds a whole list as one parameter.
     *
     * @return {@code true} for IN and NOT_IN
     */
    public boolean isSetMembership() {
        return this == IN || this == NOT_IN;
    }

    /**
     * Indicates whether this operator binds no value at all.
     *
     * @return {@code true} for IS_NULL and NOT_NULL
     */
    public boolean isNullCheck() {
        return this == IS_NULL || this == NOT_NULL;
    }
}
