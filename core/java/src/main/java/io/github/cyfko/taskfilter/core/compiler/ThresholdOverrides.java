package io.github.cyfko.taskfilter.core.compiler;

import java.util.Collections;
import java.util.HashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Day-count overrides for date_diff thresholds, keyed by normalized filter name.
 * <p>
 * A filter name is normalized by trimming, lower-casing and collapsing whitespace runs
 * to underscores: {@code "Unchanged in Past 14 Days"} becomes
 * {@code "unchanged_in_past_14_days"}. Keys of the supplied map are normalized the same
 * way, so callers may pass either form.
 * </p>
 *
 * <pre>{@code
 * ThresholdOverrides overrides = ThresholdOverrides.of(Map.of("unchanged_in_past_14_days", 3));
 * overrides.forFilter("Unchanged in Past 14 Days"); // Optional[3]
 * }</pre>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public final class ThresholdOverrides {

    private static final Pattern WHITESPACE = Pattern.compile("\\s+");
    private static final ThresholdOverrides NONE = new ThresholdOverrides(Map.of());

    private final Map<String, Integer> days;

    private ThresholdOverrides(Map<String, Integer> days) {
        this.days = days;
    }

    public static ThresholdOverrides none() {
        return NONE;
    }

    /**
     * @param overrides filter name to day count, may be {@code null}; null keys or values are ignored
     * @return the overrides
     * @throws IllegalArgumentException if a day count is not a whole number within the {@code int} range
     */
    public static ThresholdOverrides of(Map<String, ? extends Number> overrides) {
        if (overrides == null || overrides.isEmpty()) {
            return NONE;
        }
        Map<String, Integer> normalized = new HashMap<>();
        overrides.forEach((name, value) -> {
            if (name != null && value != null) {
                Integer exact = IntegralValues.toInt(value).orElseThrow(() -> new IllegalArgumentException(
                        "Threshold override for '" + name + "' must be a whole number of days, got: " + value));
                normalized.put(normalize(name), exact);
            }
        });
        return new ThresholdOverrides(Collections.unmodifiableMap(normalized));
    }

    /**
     * Normalizes a filter name into an override key.
     *
     * @param filterName display name
     * @return the key
     */
    public static String normalize(String filterName) {
        return WHITESPACE.matcher(filterName.trim().toLowerCase(Locale.ROOT)).replaceAll("_");
    }

    /**
     * @param filterName display name of the owning filter, may be {@code null}
     * @return the override in days, if any
     */
    public Optional<Integer> forFilter(String filterName) {
        if (filterName == null || days.isEmpty()) {
            return Optional.empty();
        }
        return Optional.ofNullable(days.get(normalize(filterName)));
    }

    public boolean isEmpty() {
        return days.isEmpty();
    }
}
