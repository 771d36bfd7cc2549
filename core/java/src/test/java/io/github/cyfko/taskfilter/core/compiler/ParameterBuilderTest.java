package io.github.cyfko.taskfilter.core.compiler;

import io.github.cyfko.taskfilter.core.api.PlaceholderStyle;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("ParameterBuilder Tests")
class ParameterBuilderTest {

    @Test
    @DisplayName("Should issue increasing placeholders from the start index")
    void shouldIssueIncreasingPlaceholders() {
        ParameterBuilder params = new ParameterBuilder(5, PlaceholderStyle.DOLLAR);

        assertEquals("$5", params.add("done"));
        assertEquals("$6", params.add(7));
        assertEquals(7, params.nextIndex());
        assertEquals(List.of("done", 7), params.values());
    }

    @Test
    @DisplayName("Should bind a whole list as one parameter")
    void shouldBindListAsSingleParameter() {
        ParameterBuilder params = new ParameterBuilder(1, PlaceholderStyle.DOLLAR);
        List<String> priorities = new ArrayList<>(List.of("high", "urgent"));

        String token = params.addArray(priorities);
        priorities.add("low");

        assertEquals("$1", token);
        assertEquals(1, params.values().size());
        assertEquals(List.of("high", "urgent"), params.values().get(0), "Bound list should be a copy");
        assertEquals("$2", params.add("x"));
    }

    @Test
    @DisplayName("Should render JPA positional placeholders")
    void shouldRenderJpaPlaceholders() {
        ParameterBuilder params = new ParameterBuilder(3, PlaceholderStyle.JPA_POSITIONAL);

        assertEquals("?3", params.add(1L));
        assertEquals("?4", params.addArray(List.of(1L, 2L)));
    }

    @Test
    @DisplayName("Should expose read-only values")
    void shouldExposeReadOnlyValues() {
        ParameterBuilder params = new ParameterBuilder(1, PlaceholderStyle.DOLLAR);
        params.add("a");

        assertThrows(UnsupportedOperationException.class, () -> params.values().add("b"));
    }

    @Test
    @DisplayName("Should reject invalid construction and null values")
    void shouldRejectInvalidInput() {
        assertThrows(IllegalArgumentException.class, () -> new ParameterBuilder(0, PlaceholderStyle.DOLLAR));
        assertThrows(NullPointerException.class, () -> new ParameterBuilder(1, null));
        ParameterBuilder params = new ParameterBuilder(1, PlaceholderStyle.DOLLAR);
        assertThrows(NullPointerException.class, () -> params.add(null));
        assertEquals(1, params.nextIndex(), "A rejected value must not consume an index");
    }
}
