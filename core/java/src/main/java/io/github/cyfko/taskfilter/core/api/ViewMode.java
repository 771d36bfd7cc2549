package io.github.cyfko.taskfilter.core.api;

import java.util.Locale;

/**
 * Task view a filter definition belongs to.
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public enum ViewMode {
    PLANNER,
    TRACKER;

    /**
     * Parses a stored view mode.
     *
     * @param value raw value, may be {@code null}
     * @return the view mode, or {@code null} when the value is absent or unknown
     */
    public static ViewMode fromString(String value) {
        if (value == null) {
            return null;
        }
        try {
            return valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            return null;
        }
    }

    public String code() {
        return name().toLowerCase(Locale.ROOT);
    }
}
