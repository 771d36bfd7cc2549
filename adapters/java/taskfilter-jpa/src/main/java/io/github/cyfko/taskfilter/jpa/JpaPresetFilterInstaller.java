package io.github.cyfko.taskfilter.jpa;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.cyfko.taskfilter.core.api.ConditionKind;
import io.github.cyfko.taskfilter.core.cache.FilterCache;
import io.github.cyfko.taskfilter.core.exception.FilterDefinitionException;
import io.github.cyfko.taskfilter.core.model.FilterCondition;
import io.github.cyfko.taskfilter.core.preset.PresetFilter;
import io.github.cyfko.taskfilter.core.preset.PresetFilters;
import jakarta.persistence.EntityManager;

import java.util.List;
import java.util.Objects;
import java.util.logging.Logger;

/**
 * Installs the built-in {@link PresetFilters} for a workspace member.
 * <p>
 * Presets the member already owns (matched by name) are skipped, so installing twice is
 * harmless. When anything was written the whole {@link FilterCache} is invalidated.
 * Runs inside the caller's transaction.
 * </p>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public class JpaPresetFilterInstaller {

    private static final Logger logger = Logger.getLogger(JpaPresetFilterInstaller.class.getName());

    static final String EXISTS_SQL = "SELECT COUNT(*) FROM filter_preferences"
            + " WHERE user_id = ?1 AND workspace_id = ?2 AND name = ?3";

    static final String INSERT_DEFINITION_SQL = "INSERT INTO filter_preferences"
            + " (user_id, workspace_id, name, view_mode, operator, is_default)"
            + " VALUES (?1, ?2, ?3, ?4, ?5, ?6) RETURNING id";

    static final String INSERT_CONDITION_SQL = "INSERT INTO filter_conditions"
            + " (filter_id, condition_type, field, date_from, date_to, operator, values, unit)"
            + " VALUES (?1, ?2, ?3, ?4, ?5, ?6, CAST(?7 AS JSONB), ?8)";

    private final EntityManager entityManager;
    private final ObjectMapper objectMapper;
    private final FilterCache cache;
    private final List<PresetFilter> presets;

    public JpaPresetFilterInstaller(EntityManager entityManager, ObjectMapper objectMapper,
                                    FilterCache cache, List<PresetFilter> presets) {
        this.entityManager = Objects.requireNonNull(entityManager, "entityManager cannot be null");
        this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper cannot be null");
        this.cache = Objects.requireNonNull(cache, "cache cannot be null");
        this.presets = List.copyOf(presets);
    }

    public JpaPresetFilterInstaller(EntityManager entityManager, ObjectMapper objectMapper, FilterCache cache) {
        this(entityManager, objectMapper, cache, PresetFilters.defaults());
    }

    /**
     * Installs the missing presets.
     *
     * @param userId      owner of the presets
     * @param workspaceId workspace the presets belong to
     * @return number of presets inserted
     */
    public int install(long userId, long workspaceId) {
        int installed = 0;
        for (PresetFilter preset : presets) {
            if (exists(userId, workspaceId, preset.name())) {
                continue;
            }
            long definitionId = insertDefinition(userId, workspaceId, preset);
            for (FilterCondition condition : preset.conditions()) {
                insertCondition(definitionId, condition);
            }
            installed++;
        }

        if (installed > 0) {
            cache.invalidateAll();
            int count = installed;
            logger.info(() -> "Installed " + count + " preset filters for user " + userId + " in workspace " + workspaceId);
        }
        return installed;
    }

    private boolean exists(long userId, long workspaceId, String name) {
        Object count = entityManager.createNativeQuery(EXISTS_SQL)
                .setParameter(1, userId)
                .setParameter(2, workspaceId)
                .setParameter(3, name)
                .getSingleResult();
        return count instanceof Number number && number.longValue() > 0;
    }

    private long insertDefinition(long userId, long workspaceId, PresetFilter preset) {
        Object id = entityManager.createNativeQuery(INSERT_DEFINITION_SQL)
                .setParameter(1, userId)
                .setParameter(2, workspaceId)
                .setParameter(3, preset.name())
                .setParameter(4, preset.viewMode().code())
                .setParameter(5, preset.operator().name())
                .setParameter(6, preset.defaultFilter())
                .getSingleResult();
        if (!(id instanceof Number number)) {
            throw new FilterDefinitionException("No id returned for preset filter '" + preset.name() + "'");
        }
        return number.longValue();
    }

    private void insertCondition(long definitionId, FilterCondition condition) {
        boolean dateDiff = condition.kind() == ConditionKind.DATE_DIFF;
        entityManager.createNativeQuery(INSERT_CONDITION_SQL)
                .setParameter(1, definitionId)
                .setParameter(2, condition.kind().getCode())
                .setParameter(3, dateDiff ? null : condition.field().logicalName())
                .setParameter(4, dateDiff ? condition.dateFrom().logicalName() : null)
                .setParameter(5, dateDiff ? condition.dateTo().logicalName() : null)
                .setParameter(6, condition.operator().getSymbol())
                .setParameter(7, toJson(condition))
                .setParameter(8, dateDiff ? condition.unit() : null)
                .executeUpdate();
    }

    private String toJson(FilterCondition condition) {
        try {
            return objectMapper.writeValueAsString(condition.values());
        } catch (JsonProcessingException e) {
            throw new FilterDefinitionException("Cannot serialize values of condition " + condition, e);
        }
    }
}
