package io.github.cyfko.taskfilter.core.compiler;

import io.github.cyfko.taskfilter.core.api.PlaceholderStyle;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Accumulates bound values and issues placeholder tokens for one compiled statement.
 * <p>
 * Indices start at the caller-supplied value and strictly increase: the n-th bound value
 * always sits at index {@code startIndex + n}, so several compiler invocations can
 * append to one shared statement without collisions.
 * </p>
 *
 * <pre>{@code
 * ParameterBuilder params = new ParameterBuilder(3, PlaceholderStyle.DOLLAR);
 * params.add("done");                        // "$3"
 * params.addArray(List.of("high", "urgent")); // "$4", one parameter
 * params.values();                            // ["done", ["high", "urgent"]]
 * params.nextIndex();                         // 5
 * }</pre>
 *
 * <p>Not thread-safe: one builder belongs to one compile call.</p>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public final class ParameterBuilder {

    private final int startIndex;
    private final PlaceholderStyle style;
    private final List<Object> values = new ArrayList<>();

    /**
     * @param startIndex index of the first placeholder issued, at least 1
     * @param style      placeholder convention
     */
    public ParameterBuilder(int startIndex, PlaceholderStyle style) {
        if (startIndex < 1) {
            throw new IllegalArgumentException("startIndex must be at least 1, got: " + startIndex);
        }
        this.startIndex = startIndex;
        this.style = Objects.requireNonNull(style, "style cannot be null");
    }

    /**
     * Binds one scalar value.
     *
     * @param value the value, never {@code null}
     * @return the placeholder token of the value
     */
    public String add(Object value) {
        Objects.requireNonNull(value, "bound value cannot be null");
        values.add(value);
        return style.placeholder(startIndex + values.size() - 1);
    }

    /**
     * Binds a whole list as a single parameter, for set-membership tests.
     *
     * @param items the items, copied
     * @return the placeholder token of the list
     */
    public String addArray(Collection<?> items) {
        Objects.requireNonNull(items, "bound list cannot be null");
        values.add(List.copyOf(items));
        return style.placeholder(startIndex + values.size() - 1);
    }

    /**
     * @return bound values in placeholder order, unmodifiable
     */
    public List<Object> values() {
        return Collections.unmodifiableList(values);
    }

    /**
     * @return the index the next bound value would receive
     */
    public int nextIndex() {
        return startIndex + values.size();
    }

    public int startIndex() {
        return startIndex;
    }

    public PlaceholderStyle style() {
        return style;
    }
}
