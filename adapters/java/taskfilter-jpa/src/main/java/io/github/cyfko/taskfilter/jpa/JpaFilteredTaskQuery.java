package io.github.cyfko.taskfilter.jpa;

import io.github.cyfko.taskfilter.core.api.PlaceholderStyle;
import io.github.cyfko.taskfilter.core.cache.FilterCache;
import io.github.cyfko.taskfilter.core.compiler.CompiledFilter;
import io.github.cyfko.taskfilter.core.compiler.ConditionCompiler;
import io.github.cyfko.taskfilter.core.compiler.FilterCompileRequest;
import io.github.cyfko.taskfilter.core.compiler.FilterQueryCompiler;
import io.github.cyfko.taskfilter.core.config.CompilerConfig;
import io.github.cyfko.taskfilter.core.exception.FilterFetchException;
import io.github.cyfko.taskfilter.core.spi.FilterDefinitionStore;
import jakarta.persistence.EntityManager;
import jakarta.persistence.Query;

import java.sql.Date;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Workspace-scoped task listing narrowed by compiled filters.
 *
 * <p>The base query binds the workspace id as {@code ?1}; the compiled predicate is
 * numbered from {@code ?2} and appended with {@code AND}. An absent predicate lists the
 * whole workspace. The compiler must render {@link PlaceholderStyle#JPA_POSITIONAL}
 * placeholders, which {@link #create(EntityManager, FilterDefinitionStore, FilterCache)}
 * takes care of.</p>
 *
 * <pre>{@code
 * JpaFilteredTaskQuery tasks = JpaFilteredTaskQuery.create(em, store, cache);
 * List<TaskSummary> page = tasks.find(workspaceId, FilterCompileRequest.builder()
 *         .filterIds(List.of(7L))
 *         .userId(userId)
 *         .build());
 * }</pre>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public class JpaFilteredTaskQuery {

    static final String SELECT_SQL = "SELECT t.id, t.title, t.status, t.priority, t.due_date FROM tasks t"
            + " WHERE t.workspace_id = ?1";

    static final String COUNT_SQL = "SELECT COUNT(*) FROM tasks t WHERE t.workspace_id = ?1";

    private static final int FIRST_FILTER_INDEX = 2;

    private final EntityManager entityManager;
    private final FilterQueryCompiler compiler;

    public JpaFilteredTaskQuery(EntityManager entityManager, FilterQueryCompiler compiler) {
        this.entityManager = Objects.requireNonNull(entityManager, "entityManager cannot be null");
        this.compiler = Objects.requireNonNull(compiler, "compiler cannot be null");
    }

    /**
     * Builds a listing whose compiler renders JPA positional placeholders.
     */
    public static JpaFilteredTaskQuery create(EntityManager entityManager, FilterDefinitionStore store, FilterCache cache) {
        FilterQueryCompiler compiler = new FilterQueryCompiler(store, cache, new ConditionCompiler(),
                CompilerConfig.of(PlaceholderStyle.JPA_POSITIONAL));
        return new JpaFilteredTaskQuery(entityManager, compiler);
    }

    /**
     * Lists the tasks of a workspace that pass every enabled filter, ordered by id.
     *
     * @param workspaceId the workspace
     * @param request     filters to apply; its start index is ignored
     * @return matching tasks
     * @throws FilterFetchException if the filter definitions cannot be read
     */
    public List<TaskSummary> find(long workspaceId, FilterCompileRequest request) {
        Query query = prepare(SELECT_SQL, " ORDER BY t.id", workspaceId, request);

        @SuppressWarnings("unchecked")
        List<Object[]> results = query.getResultList();

        List<TaskSummary> tasks = new ArrayList<>(results.size());
        for (Object[] columns : results) {
            tasks.add(new TaskSummary(
                    columns[0] instanceof Number id ? id.longValue() : null,
                    (String) columns[1],
                    (String) columns[2],
                    (String) columns[3],
                    toLocalDate(columns[4])));
        }
        return tasks;
    }

    /**
     * Counts the tasks {@link #find(long, FilterCompileRequest)} would return.
     */
    public long count(long workspaceId, FilterCompileRequest request) {
        Object count = prepare(COUNT_SQL, "", workspaceId, request).getSingleResult();
        return ((Number) count).longValue();
    }

    private Query prepare(String baseSql, String suffix, long workspaceId, FilterCompileRequest request) {
        CompiledFilter compiled = compiler.compile(new FilterCompileRequest(
                request.filterIds(),
                request.customFilters(),
                request.userId(),
                request.thresholdOverrides(),
                FIRST_FILTER_INDEX));

        StringBuilder sql = new StringBuilder(baseSql);
        compiled.predicate().ifPresent(predicate -> sql.append(" AND ").append(predicate));
        sql.append(suffix);

        Query query = entityManager.createNativeQuery(sql.toString());
        query.setParameter(1, workspaceId);
        int index = FIRST_FILTER_INDEX;
        for (Object value : compiled.values()) {
            query.setParameter(index++, value);
        }
        return query;
    }

    private static LocalDate toLocalDate(Object value) {
        if (value instanceof LocalDate date) {
            return date;
        }
        if (value instanceof Date date) {
            return date.toLocalDate();
        }
        if (value instanceof LocalDateTime dateTime) {
            return dateTime.toLocalDate();
        }
        return null;
    }
}
