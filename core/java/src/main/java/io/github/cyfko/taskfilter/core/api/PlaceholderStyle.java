package io.github.cyfko.taskfilter.core.api;

/**
 * Placeholder convention of the statement a compiled predicate is merged into.
 *
 * <pre>{@code
 * PlaceholderStyle.DOLLAR.placeholder(3);                // "$3"
 * PlaceholderStyle.DOLLAR.membership("t.status", "$3");  // "t.status = ANY($3)"
 * PlaceholderStyle.JPA_POSITIONAL.placeholder(3);        // "?3"
 * PlaceholderStyle.JPA_POSITIONAL.membership("t.status", "?3"); // "t.status IN (?3)"
 * }</pre>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public enum PlaceholderStyle {

    /** PostgreSQL wire style; list parameters are bound as arrays. */
    DOLLAR("$") {
        @Override
        public String membership(String expression, String token) {
            return expression + " = ANY(" + token + ")";
        }
    },

    /** JPA native query style; list parameters are bound as collections and expanded by the provider. */
    JPA_POSITIONAL("?") {
        @Override
        public String membership(String expression, String token) {
            return expression + " IN (" + token + ")";
        }
    };

    private final String prefix;

    PlaceholderStyle(String prefix) {
        this.prefix = prefix;
    }

    /**
     * Renders the placeholder token for a 1-based parameter index.
     *
     * @param index parameter index
     * @return the token, e.g. {@code "$4"}
     */
    public String placeholder(int index) {
        return prefix + index;
    }

    /**
     * Renders "expression is one of the values bound at token".
     *
     * @param expression SQL expression under test
     * @param token      placeholder of a list parameter
     * @return the membership predicate
     */
    public abstract String membership(String expression, String token);
}
