package io.github.cyfko.taskfilter.core.api;

import java.util.Locale;

/**
 * Kind of a filter condition, as stored in {@code filter_conditions.condition_type}.
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public enum ConditionKind {

    /** Field compared with literal values. */
    LIST("list"),

    /** Day difference between two date expressions compared with a threshold. */
    DATE_DIFF("date_diff"),

    /** Date field between two literal dates. */
    DATE_RANGE("date_range"),

    UNSUPPORTED(null);

    private final String code;

    ConditionKind(String code) {
        this.code = code;
    }

    /**
     * Resolves a stored kind code, ignoring case.
     *
     * @param value the raw code, may be {@code null}
     * @return the matching kind, or {@link #UNSUPPORTED}
     */
    public static ConditionKind fromCode(String value) {
        if (value == null) {
            return UNSUPPORTED;
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        for (ConditionKind kind : values()) {
            if (kind.code != null && kind.code.equals(normalized)) {
                return kind;
            }
        }
        return UNSUPPORTED;
    }

    public String getCode() {
        if (this == UNSUPPORTED)
            throw new UnsupportedOperationException("UNSUPPORTED kind has no code.");
        return code;
    }
}
