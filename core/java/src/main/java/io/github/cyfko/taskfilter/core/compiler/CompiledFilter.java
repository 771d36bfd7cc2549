package io.github.cyfko.taskfilter.core.compiler;

import java.util.List;
import java.util.Optional;

/**
 * Output of a compile call: predicate text plus the values to bind.
 * <p>
 * {@code predicate} is empty when nothing was requested or nothing survived; callers
 * then add no clause at all. The values are to be appended to the caller's own
 * parameter list, where they land exactly at the indices the placeholders name.
 * </p>
 *
 * @param predicate the combined predicate, without a leading {@code AND}
 * @param values    bound values in placeholder order
 * @param nextIndex first index still free after this predicate
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public record CompiledFilter(Optional<String> predicate, List<Object> values, int nextIndex) {

    public CompiledFilter {
        predicate = predicate == null ? Optional.empty() : predicate;
        values = values == null ? List.of() : List.copyOf(values);
    }

    static CompiledFilter absent(int startIndex) {
        return new CompiledFilter(Optional.empty(), List.of(), startIndex);
    }

    public boolean isPresent() {
        return predicate.isPresent();
    }
}
