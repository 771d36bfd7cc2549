package io.github.cyfko.taskfilter.core.compiler;

import io.github.cyfko.taskfilter.core.api.CombiningOperator;
import io.github.cyfko.taskfilter.core.api.PlaceholderStyle;
import io.github.cyfko.taskfilter.core.cache.FilterCache;
import io.github.cyfko.taskfilter.core.config.CachePolicy;
import io.github.cyfko.taskfilter.core.config.CompilerConfig;
import io.github.cyfko.taskfilter.core.exception.FilterFetchException;
import io.github.cyfko.taskfilter.core.model.CustomFilter;
import io.github.cyfko.taskfilter.core.model.FilterCondition;
import io.github.cyfko.taskfilter.core.model.FilterRow;
import io.github.cyfko.taskfilter.core.spi.FilterDefinitionStore;
import io.github.cyfko.taskfilter.core.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@DisplayName("FilterQueryCompiler Tests")
class FilterQueryCompilerTest {

    private static final long USER_ID = 42L;

    @Mock
    private FilterDefinitionStore store;

    private MutableClock clock;
    private FilterCache cache;
    private FilterQueryCompiler compiler;

    @BeforeEach
    void setUp() {
        clock = MutableClock.atEpoch();
        cache = new FilterCache(CachePolicy.defaults(), clock);
        compiler = new FilterQueryCompiler(store, cache);
    }

    private static FilterRow row(long definitionId, String name, String logic, long conditionId,
                                 String field, String operator, List<Object> values) {
        return new FilterRow(definitionId, name, logic, conditionId, "list", field, null, null, operator, values, null);
    }

    private static FilterRow dateDiffRow(long definitionId, String name, String logic, long conditionId,
                                         String from, String to, String operator, List<Object> values) {
        return new FilterRow(definitionId, name, logic, conditionId, "date_diff", null, from, to, operator, values, "days");
    }

    private static final FilterRow HIDE_DONE = row(1L, "Hide Completed", "AND", 10L, "status", "!=", List.of("done"));
    private static final FilterRow HIGH_PRIORITY =
            row(2L, "High/Urgent Priority", "AND", 20L, "priority", "IN", List.of("high", "urgent"));

    @Nested
    @DisplayName("Empty input")
    class EmptyInput {

        @ParameterizedTest
        @ValueSource(ints = {1, 5, 99})
        @DisplayName("Should return an absent predicate without touching the store")
        void shouldReturnAbsent(int startIndex) {
            CompiledFilter compiled = compiler.compile(List.of(), List.of(), USER_ID, Map.of(), startIndex);

            assertFalse(compiled.isPresent());
            assertTrue(compiled.values().isEmpty());
            assertEquals(startIndex, compiled.nextIndex());
            verifyNoInteractions(store);
        }

        @Test
        @DisplayName("Should treat null lists as empty")
        void shouldTreatNullsAsEmpty() {
            CompiledFilter compiled = compiler.compile(null, null, USER_ID, null, 1);

            assertEquals(Optional.empty(), compiled.predicate());
            verifyNoInteractions(store);
        }
    }

    @Nested
    @DisplayName("Persisted filters")
    class PersistedFilters {

        @Test
        @DisplayName("Should AND one parenthesized group per filter")
        void shouldCombineFiltersWithAnd() {
            // Given
            when(store.fetch(anyList())).thenReturn(List.of(HIDE_DONE, HIGH_PRIORITY));

            // When
            CompiledFilter compiled = compiler.compile(List.of(1L, 2L), List.of(), USER_ID, Map.of(), 1);

            // Then
            assertEquals(Optional.of("(t.status <> $1) AND (t.priority = ANY($2))"), compiled.predicate());
            assertEquals(List.of("done", List.of("high", "urgent")), compiled.values());
            assertEquals(3, compiled.nextIndex());
        }

        @Test
        @DisplayName("Should join conditions inside a filter with its own operator")
        void shouldUseFilterOperatorWithinGroup() {
            when(store.fetch(anyList())).thenReturn(List.of(
                    row(6L, "Active in Past 7 Days", "OR", 60L, "status", "IN", List.of(List.of("in_progress", "paused"))),
                    dateDiffRow(6L, "Active in Past 7 Days", "OR", 61L, "completion_date", "today", "<=", List.of(7))));

            CompiledFilter compiled = compiler.compile(List.of(6L), List.of(), USER_ID, Map.of(), 1);

            assertEquals(Optional.of("(t.status = ANY($1) OR (CURRENT_DATE - CAST(t.completion_date AS DATE)) <= $2)"),
                    compiled.predicate());
            assertEquals(List.of(List.of("in_progress", "paused"), 7), compiled.values());
        }

        @Test
        @DisplayName("Should number placeholders without gaps from the start index")
        void shouldNumberFromStartIndex() {
            when(store.fetch(anyList())).thenReturn(List.of(
                    HIDE_DONE,
                    row(1L, "Hide Completed", "AND", 11L, "unknown_column", "=", List.of("x")),
                    HIGH_PRIORITY));

            CompiledFilter compiled = compiler.compile(List.of(1L, 2L), List.of(), USER_ID, Map.of(), 5);

            assertEquals(Optional.of("(t.status <> $5) AND (t.priority = ANY($6))"), compiled.predicate());
            assertEquals(compiled.values().size(), compiled.nextIndex() - 5);
        }

        @Test
        @DisplayName("Should drop a filter whose conditions all fail to compile")
        void shouldDropEmptyGroups() {
            when(store.fetch(anyList())).thenReturn(List.of(
                    row(3L, "Broken", "AND", 30L, "unknown_column", "=", List.of("x")),
                    FilterRow.withoutCondition(4L, "Empty", "AND"),
                    HIDE_DONE));

            CompiledFilter compiled = compiler.compile(List.of(3L, 4L, 1L), List.of(), USER_ID, Map.of(), 1);

            assertEquals(Optional.of("(t.status <> $1)"), compiled.predicate());
            assertEquals(List.of("done"), compiled.values());
        }

        @Test
        @DisplayName("Should return absent when nothing compiles")
        void shouldReturnAbsentWhenNothingCompiles() {
            when(store.fetch(anyList())).thenReturn(List.of(FilterRow.withoutCondition(4L, "Empty", "AND")));

            CompiledFilter compiled = compiler.compile(List.of(4L), List.of(), USER_ID, Map.of(), 3);

            assertFalse(compiled.isPresent());
            assertEquals(3, compiled.nextIndex());
        }

        @Test
        @DisplayName("Should contribute nothing for ids the store does not know")
        void shouldIgnoreMissingIds() {
            when(store.fetch(anyList())).thenReturn(List.of(HIDE_DONE));

            CompiledFilter compiled = compiler.compile(List.of(1L, 404L), List.of(), USER_ID, Map.of(), 1);

            assertEquals(Optional.of("(t.status <> $1)"), compiled.predicate());
        }

        @Test
        @DisplayName("Should apply a threshold override to the named filter only")
        void shouldApplyThresholdOverride() {
            when(store.fetch(anyList())).thenReturn(List.of(
                    row(7L, "Unchanged in Past 14 Days", "AND", 70L, "status", "!=", List.of("done")),
                    dateDiffRow(7L, "Unchanged in Past 14 Days", "AND", 71L, "last_modified", "today", ">", List.of(14)),
                    dateDiffRow(3L, "Due in 7 Days", "AND", 31L, "today", "due_date", "<=", List.of(7))));

            CompiledFilter compiled = compiler.compile(List.of(7L, 3L), List.of(), USER_ID,
                    Map.of("unchanged_in_past_14_days", 3), 1);

            assertEquals(Optional.of("(t.status <> $1 AND (CURRENT_DATE - CAST(t.last_modified AS DATE)) > $2)"
                    + " AND ((CAST(t.due_date AS DATE) - CURRENT_DATE) <= $3)"), compiled.predicate());
            assertEquals(List.of("done", 3, 7), compiled.values());
        }

        @Test
        @DisplayName("Should resolve current_user_id to the caller")
        void shouldResolveCurrentUser() {
            when(store.fetch(anyList())).thenReturn(List.of(
                    row(2L, "Assigned to Me", "AND", 20L, "assignee", "=", List.of("current_user_id"))));

            CompiledFilter compiled = compiler.compile(List.of(2L), List.of(), USER_ID, Map.of(), 1);

            assertEquals(Optional.of(
                    "(EXISTS (SELECT 1 FROM task_assignees ta WHERE ta.task_id = t.id AND ta.user_id = $1))"),
                    compiled.predicate());
            assertEquals(List.of(USER_ID), compiled.values());
        }
    }

    @Nested
    @DisplayName("Caching")
    class Caching {

        @Test
        @DisplayName("Should fetch once per id set within the TTL")
        void shouldFetchOnceWithinTtl() {
            when(store.fetch(anyList())).thenReturn(List.of(HIDE_DONE, HIGH_PRIORITY));

            CompiledFilter first = compiler.compile(List.of(1L, 2L), List.of(), USER_ID, Map.of(), 1);
            clock.advance(Duration.ofMinutes(4));
            CompiledFilter second = compiler.compile(List.of(2L, 1L, 2L), List.of(), USER_ID, Map.of(), 1);

            verify(store, times(1)).fetch(anyList());
            assertEquals(first, second);
        }

        @Test
        @DisplayName("Should refetch after the TTL elapses")
        void shouldRefetchAfterTtl() {
            when(store.fetch(anyList())).thenReturn(List.of(HIDE_DONE));

            compiler.compile(List.of(1L), List.of(), USER_ID, Map.of(), 1);
            clock.advance(Duration.ofMinutes(5));
            compiler.compile(List.of(1L), List.of(), USER_ID, Map.of(), 1);

            verify(store, times(2)).fetch(anyList());
        }

        @Test
        @DisplayName("Should refetch after invalidateAll")
        void shouldRefetchAfterInvalidation() {
            when(store.fetch(anyList())).thenReturn(List.of(HIDE_DONE));

            compiler.compile(List.of(1L), List.of(), USER_ID, Map.of(), 1);
            cache.invalidateAll();
            compiler.compile(List.of(1L), List.of(), USER_ID, Map.of(), 1);

            verify(store, times(2)).fetch(anyList());
        }

        @Test
        @DisplayName("Should reuse cached rows with a different start index")
        void shouldRenumberCachedRows() {
            when(store.fetch(anyList())).thenReturn(List.of(HIDE_DONE));

            compiler.compile(List.of(1L), List.of(), USER_ID, Map.of(), 1);
            CompiledFilter shifted = compiler.compile(List.of(1L), List.of(), USER_ID, Map.of(), 8);

            assertEquals(Optional.of("(t.status <> $8)"), shifted.predicate());
            verify(store, times(1)).fetch(anyList());
        }

        @Test
        @DisplayName("Should fetch every time when caching is disabled")
        void shouldFetchEveryTimeWhenDisabled() {
            FilterQueryCompiler uncached = new FilterQueryCompiler(store, new FilterCache(CachePolicy.none(), clock));
            when(store.fetch(anyList())).thenReturn(List.of(HIDE_DONE));

            uncached.compile(List.of(1L), List.of(), USER_ID, Map.of(), 1);
            uncached.compile(List.of(1L), List.of(), USER_ID, Map.of(), 1);

            verify(store, times(2)).fetch(anyList());
        }
    }

    @Nested
    @DisplayName("Store failures")
    class StoreFailures {

        @Test
        @DisplayName("Should wrap store errors and cache nothing")
        void shouldWrapStoreErrors() {
            IllegalStateException cause = new IllegalStateException("connection refused");
            when(store.fetch(anyList())).thenThrow(cause);

            FilterFetchException thrown = assertThrows(FilterFetchException.class,
                    () -> compiler.compile(List.of(1L), List.of(), USER_ID, Map.of(), 1));

            assertSame(cause, thrown.getCause());
            assertEquals(0, cache.size());
        }

        @Test
        @DisplayName("Should reject a null store result")
        void shouldRejectNullResult() {
            when(store.fetch(anyList())).thenReturn(null);

            assertThrows(FilterFetchException.class,
                    () -> compiler.compile(List.of(1L), List.of(), USER_ID, Map.of(), 1));
            assertEquals(0, cache.size());
        }
    }

    @Nested
    @DisplayName("Custom filters")
    class CustomFilters {

        @Test
        @DisplayName("Should compile custom filters without fetching or caching")
        void shouldCompileWithoutStore() {
            CustomFilter custom = CustomFilter.of(CombiningOperator.OR,
                    FilterCondition.list("status", "=", "paused"),
                    FilterCondition.list("priority", "=", "urgent"));

            CompiledFilter compiled = compiler.compile(List.of(), List.of(custom), USER_ID, Map.of(), 1);

            assertEquals(Optional.of("(t.status = $1 OR t.priority = $2)"), compiled.predicate());
            verifyNoInteractions(store);
            assertEquals(0, cache.size());
        }

        @Test
        @DisplayName("Should compile an includeNull membership from a custom filter")
        void shouldCompileIncludeNull() {
            CustomFilter custom = CustomFilter.of(CombiningOperator.AND,
                    FilterCondition.list("category", "in", List.of(3, 4)).withIncludeNull(true),
                    FilterCondition.list("status", "!=", "done"));

            CompiledFilter compiled = compiler.compile(List.of(), List.of(custom), USER_ID, Map.of(), 1);

            assertEquals(Optional.of("((t.category_id = ANY($1) OR t.category_id IS NULL) AND t.status <> $2)"),
                    compiled.predicate());
            assertEquals(List.of(List.of(3, 4), "done"), compiled.values());
            assertEquals(3, compiled.nextIndex());
        }

        @Test
        @DisplayName("Should keep a client le comparator instead of dropping it")
        void shouldCompileClientComparator() {
            CustomFilter custom = CustomFilter.of(CombiningOperator.AND,
                    FilterCondition.dateDiff("today", "due_date", "le", 7));

            CompiledFilter compiled = compiler.compile(List.of(), List.of(custom), USER_ID, Map.of(), 1);

            assertEquals(Optional.of("((CAST(t.due_date AS DATE) - CURRENT_DATE) <= $1)"), compiled.predicate());
            assertEquals(List.of(7), compiled.values());
        }

        @Test
        @DisplayName("Should append custom filters after persisted ones")
        void shouldAppendAfterPersisted() {
            when(store.fetch(anyList())).thenReturn(List.of(HIDE_DONE));
            FilterCompileRequest request = FilterCompileRequest.builder()
                    .filterIds(List.of(1L))
                    .customFilter(CustomFilter.of(CombiningOperator.AND, FilterCondition.list("due_date", "IS_NULL")))
                    .userId(USER_ID)
                    .startIndex(2)
                    .build();

            CompiledFilter compiled = compiler.compile(request);

            assertEquals(Optional.of("(t.status <> $2) AND (t.due_date IS NULL)"), compiled.predicate());
            assertEquals(List.of("done"), compiled.values());
            assertEquals(3, compiled.nextIndex());
        }
    }

    @Test
    @DisplayName("Should render JPA positional placeholders when configured")
    void shouldRenderJpaPlaceholders() {
        FilterQueryCompiler jpa = new FilterQueryCompiler(store, cache, new ConditionCompiler(),
                CompilerConfig.of(PlaceholderStyle.JPA_POSITIONAL));
        when(store.fetch(anyList())).thenReturn(List.of(HIDE_DONE, HIGH_PRIORITY));

        CompiledFilter compiled = jpa.compile(List.of(1L, 2L), List.of(), USER_ID, Map.of(), 1);

        assertEquals(Optional.of("(t.status <> ?1) AND (t.priority IN (?2))"), compiled.predicate());
    }
}
