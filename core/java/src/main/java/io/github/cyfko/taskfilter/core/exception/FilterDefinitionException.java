package io.github.cyfko.taskfilter.core.exception;

/**
 * Exception thrown when a filter model object cannot be constructed.
 * <p>
 * This signals structural errors in the model itself, such as a definition without an
 * identifier or a custom filter without a name. It is <em>not</em> used for conditions
 * that merely fail to compile: those are dropped silently by the compiler.
 * </p>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public class FilterDefinitionException extends RuntimeException {

    public FilterDefinitionException(String message) {
        super(message);
    }

    public FilterDefinitionException(String message, Throwable cause) {
        super(message, cause);
    }
}
