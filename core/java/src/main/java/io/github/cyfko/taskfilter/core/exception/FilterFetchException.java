package io.github.cyfko.taskfilter.core.exception;

/**
 * Exception thrown when filter definitions cannot be read from storage.
 * <p>
 * A compile call that hits this failure aborts as a whole. Callers must treat it as a
 * hard error and must <strong>not</strong> fall back to running the listing unfiltered:
 * "filters unknown" is not the same as "no filter", and answering with the broader
 * result set would show rows outside the scope the user asked for.
 * </p>
 *
 * <pre>{@code
 * try {
 *     CompiledFilter compiled = compiler.compile(request);
 *     // ... execute listing with compiled.predicate()
 * } catch (FilterFetchException e) {
 *     // respond with a server error, never with unfiltered rows
 * }
 * }</pre>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public class FilterFetchException extends RuntimeException {

    /**
     * @param message explanation of the failure
     */
    public FilterFetchException(String message) {
        super(message);
    }

    /**
     * @param message explanation of the failure
     * @param cause   the storage error
     */
    public FilterFetchException(String message, Throwable cause) {
        super(message, cause);
    }
}
