package io.github.cyfko.taskfilter.core.config;

import io.github.cyfko.taskfilter.core.api.PlaceholderStyle;

import java.util.Objects;

/**
 * Configuration of the filter compiler.
 *
 * @param placeholderStyle placeholder convention of the caller's statement
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public record CompilerConfig(PlaceholderStyle placeholderStyle) {

    public CompilerConfig {
        Objects.requireNonNull(placeholderStyle, "placeholderStyle cannot be null");
    }

    /**
     * PostgreSQL {@code $n} placeholders.
     */
    public static CompilerConfig defaults() {
        return new CompilerConfig(PlaceholderStyle.DOLLAR);
    }

    public static CompilerConfig of(PlaceholderStyle style) {
        return new CompilerConfig(style);
    }
}
