package io.github.cyfko.taskfilter.spring.event;

import org.springframework.context.ApplicationEvent;

import java.util.List;

/**
 * Published after persisted filter definitions were created, updated or deleted.
 * <p>
 * The affected ids are informational: cache keys cover combinations of ids, so every
 * change invalidates the whole filter cache.
 * </p>
 *
 * <pre>{@code
 * filterRepository.save(definition);
 * publisher.publishEvent(new FilterDefinitionsChangedEvent(this, List.of(definition.getId())));
 * }</pre>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public class FilterDefinitionsChangedEvent extends ApplicationEvent {

    private final List<Long> definitionIds;

    public FilterDefinitionsChangedEvent(Object source, List<Long> definitionIds) {
        super(source);
        this.definitionIds = definitionIds == null ? List.of() : List.copyOf(definitionIds);
    }

    public List<Long> getDefinitionIds() {
        return definitionIds;
    }
}
