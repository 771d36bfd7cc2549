package io.github.cyfko.taskfilter.core.api;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("ConditionOperator Tests")
class ConditionOperatorTest {

    @ParameterizedTest
    @CsvSource({
            "=, EQ", "!=, NE", "<, LT", "<=, LTE", ">, GT", ">=, GTE",
            "IN, IN", "in, IN", "NOT IN, NOT_IN", "not_in, NOT_IN",
            "IS_NULL, IS_NULL", "is_not_null, NOT_NULL", "IS NOT NULL, NOT_NULL",
            "BETWEEN, BETWEEN", "equals, EQ", "not_equals, NE",
            "greater_than, GT", "less_than, LT"
    })
    @DisplayName("Should parse symbols, codes and client names")
    void shouldParseOperators(String raw, ConditionOperator expected) {
        assertEquals(expected, ConditionOperator.fromString(raw));
    }

    @ParameterizedTest
    @CsvSource({"lt, LT", "le, LTE", "eq, EQ", "ge, GTE", "gt, GT", "ne, NE", "LE, LTE", "' ge ', GTE"})
    @DisplayName("Should parse the two-letter date difference comparators")
    void shouldParseComparators(String raw, ConditionOperator expected) {
        assertEquals(expected, ConditionOperator.fromString(raw));
    }

    @Test
    @DisplayName("Should fall back to UNSUPPORTED")
    void shouldFallBackToUnsupported() {
        assertEquals(ConditionOperator.UNSUPPORTED, ConditionOperator.fromString("LIKE"));
        assertEquals(ConditionOperator.UNSUPPORTED, ConditionOperator.fromString(null));
        assertThrows(UnsupportedOperationException.class, ConditionOperator.UNSUPPORTED::getSymbol);
    }

    @Test
    @DisplayName("Should classify operator shapes")
    void shouldClassifyShapes() {
        assertTrue(ConditionOperator.LTE.isScalarComparison());
        assertEquals("<>", ConditionOperator.NE.sqlComparison());
        assertTrue(ConditionOperator.IN.isSetMembership());
        assertTrue(ConditionOperator.NOT_NULL.isNullCheck());
        assertFalse(ConditionOperator.BETWEEN.isScalarComparison());
        assertThrows(UnsupportedOperationException.class, ConditionOperator.IN::sqlComparison);
    }

    @Test
    @DisplayName("Should parse combining operators conservatively")
    void shouldParseCombiningOperators() {
        assertEquals(CombiningOperator.OR, CombiningOperator.fromString("or"));
        assertEquals(CombiningOperator.AND, CombiningOperator.fromString("AND"));
        assertEquals(CombiningOperator.AND, CombiningOperator.fromString("XOR"));
        assertEquals(CombiningOperator.AND, CombiningOperator.fromString(null));
    }
}
