package io.github.cyfko.taskfilter.spring.service;

import io.github.cyfko.taskfilter.core.cache.FilterCache;
import io.github.cyfko.taskfilter.core.compiler.CompiledFilter;
import io.github.cyfko.taskfilter.core.compiler.FilterCompileRequest;
import io.github.cyfko.taskfilter.core.compiler.FilterQueryCompiler;
import io.github.cyfko.taskfilter.core.config.CachePolicy;
import io.github.cyfko.taskfilter.core.model.FilterRow;
import io.github.cyfko.taskfilter.spring.service.impl.TaskFilterServiceImpl;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@DisplayName("TaskFilterService Tests")
class TaskFilterServiceTest {

    @Mock
    private FilterQueryCompiler compiler;

    @Test
    @DisplayName("Should delegate compilation to the compiler")
    void shouldDelegateCompile() {
        FilterCompileRequest request = FilterCompileRequest.builder().filterIds(List.of(1L)).build();
        CompiledFilter expected = new CompiledFilter(Optional.of("(t.status <> $1)"), List.of("done"), 2);
        when(compiler.compile(request)).thenReturn(expected);

        TaskFilterService service = new TaskFilterServiceImpl(compiler, new FilterCache(CachePolicy.defaults()));

        assertSame(expected, service.compile(request));
    }

    @Test
    @DisplayName("Should clear the cache on invalidateDefinitions")
    void shouldInvalidate() {
        FilterCache cache = new FilterCache(CachePolicy.defaults());
        cache.put(List.of(1L), List.of(FilterRow.withoutCondition(1L, "A", "AND")));

        new TaskFilterServiceImpl(compiler, cache).invalidateDefinitions();

        assertEquals(0, cache.size());
        verifyNoInteractions(compiler);
    }

    @Test
    @DisplayName("Should reject missing collaborators")
    void shouldRejectNullCollaborators() {
        FilterCache cache = new FilterCache(CachePolicy.defaults());

        NullPointerException noCompiler = assertThrows(NullPointerException.class,
                () -> new TaskFilterServiceImpl(null, cache));
        NullPointerException noCache = assertThrows(NullPointerException.class,
                () -> new TaskFilterServiceImpl(compiler, null));

        assertEquals("compiler cannot be null", noCompiler.getMessage());
        assertEquals("cache cannot be null", noCache.getMessage());
    }
}
