package io.github.cyfko.taskfilter.jpa;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.cyfko.taskfilter.core.model.FilterRow;
import io.github.cyfko.taskfilter.core.spi.FilterDefinitionStore;
import jakarta.persistence.EntityManager;
import jakarta.persistence.Query;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * {@link FilterDefinitionStore} reading persisted filters through a JPA native query.
 *
 * <p>One round trip per call: definitions are left-joined with their conditions, so a
 * definition without conditions still yields one row (with null condition columns).</p>
 *
 * <p><strong>Schema:</strong></p>
 * <pre>
 * filter_preferences(id, user_id, workspace_id, name, view_mode, operator, is_default, created_at)
 * filter_conditions(id, filter_id, condition_type, field, date_from, date_to, operator, values JSONB, unit, created_at)
 * </pre>
 *
 * <p>The {@code values} column holds a JSON array and is decoded with Jackson. A
 * scalar is treated as a one-element array; unreadable JSON yields no values, which
 * makes the compiler drop that condition.</p>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public class JpaFilterDefinitionStore implements FilterDefinitionStore {

    private static final Logger logger = Logger.getLogger(JpaFilterDefinitionStore.class.getName());

    static final String FETCH_SQL = "SELECT fp.id, fp.name, fp.operator, fc.id, fc.condition_type, fc.field,"
            + " fc.date_from, fc.date_to, fc.operator, CAST(fc.values AS TEXT), fc.unit"
            + " FROM filter_preferences fp"
            + " LEFT JOIN filter_conditions fc ON fc.filter_id = fp.id"
            + " WHERE fp.id IN (?1)"
            + " ORDER BY fp.id, fc.id";

    private static final TypeReference<List<Object>> VALUE_LIST = new TypeReference<>() {};

    private final EntityManager entityManager;
    private final ObjectMapper objectMapper;

    public JpaFilterDefinitionStore(EntityManager entityManager, ObjectMapper objectMapper) {
        this.entityManager = Objects.requireNonNull(entityManager, "entityManager cannot be null");
        this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper cannot be null");
    }

    public JpaFilterDefinitionStore(EntityManager entityManager) {
        this(entityManager, new ObjectMapper());
    }

    @Override
    public List<FilterRow> fetch(List<Long> definitionIds) {
        if (definitionIds == null || definitionIds.isEmpty()) {
            return List.of();
        }
        Query query = entityManager.createNativeQuery(FETCH_SQL);
        query.setParameter(1, definitionIds);

        @SuppressWarnings("unchecked")
        List<Object[]> results = query.getResultList();

        List<FilterRow> rows = new ArrayList<>(results.size());
        for (Object[] columns : results) {
            rows.add(toRow(columns));
        }
        logger.fine(() -> "Read " + rows.size() + " filter rows for definitions " + definitionIds);
        return rows;
    }

    private FilterRow toRow(Object[] columns) {
        Long conditionId = toLong(columns[3]);
        return new FilterRow(
                toLong(columns[0]),
                asString(columns[1]),
                asString(columns[2]),
                conditionId,
                asString(columns[4]),
                asString(columns[5]),
                asString(columns[6]),
                asString(columns[7]),
                asString(columns[8]),
                conditionId == null ? null : parseValues(conditionId, asString(columns[9])),
                asString(columns[10]));
    }

    List<Object> parseValues(Long conditionId, String json) {
        if (json == null || json.isBlank()) {
            return List.of();
        }
        try {
            JsonNode node = objectMapper.readTree(json);
            if (node == null || node.isNull()) {
                return List.of();
            }
            if (node.isArray()) {
                return objectMapper.convertValue(node, VALUE_LIST);
            }
            List<Object> single = new ArrayList<>(1);
            single.add(objectMapper.treeToValue(node, Object.class));
            return single;
        } catch (JsonProcessingException e) {
            logger.log(Level.WARNING, "Unreadable values for filter condition " + conditionId + ": " + json, e);
            return List.of();
        }
    }

    private static Long toLong(Object value) {
        return value instanceof Number number ? number.longValue() : null;
    }

    private static String asString(Object value) {
        return value == null ? null : value.toString();
    }
}
