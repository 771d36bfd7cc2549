package io.github.cyfko.taskfilter.core.api;

import java.util.Locale;

/**
 * Logic joining the conditions of one filter.
 * <p>
 * Across filters the compiler always uses {@link #AND}: every enabled filter is an
 * independent constraint that narrows the result set.
 * </p>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public enum CombiningOperator {

    AND(" AND "),
    OR(" OR ");

    private final String separator;

    CombiningOperator(String separator) {
        this.separator = separator;
    }

    /**
     * Parses a stored operator or a client {@code logic} value.
     * <p>
     * Anything other than {@code OR} (ignoring case) yields {@link #AND}, the narrower
     * of the two, so an unreadable value can never widen a filter.
     * </p>
     *
     * @param value raw value, may be {@code null}
     * @return the parsed operator, never {@code null}
     */
    public static CombiningOperator fromString(String value) {
        if (value != null && "OR".equals(value.trim().toUpperCase(Locale.ROOT))) {
            return OR;
        }
        return AND;
    }

    /**
     * Returns the SQL separator, padded with spaces.
     *
     * @return {@code " AND "} or {@code " OR "}
     */
    public String separator() {
        return separator;
    }
}
