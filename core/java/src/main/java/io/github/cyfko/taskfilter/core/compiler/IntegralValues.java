package io.github.cyfko.taskfilter.core.compiler;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.Optional;

/**
 * Exact conversion of thresholds to {@code int}.
 * <p>
 * A value is accepted only when it is a whole number inside the {@code int} range;
 * anything that would be truncated or wrapped is rejected.
 * </p>
 */
final class IntegralValues {

    private IntegralValues() {
    }

    /**
     * @param raw an integral number, a whole floating point number or its decimal text
     * @return the exact {@code int} value, or empty if {@code raw} has none
     */
    static Optional<Integer> toInt(Object raw) {
        try {
            if (raw instanceof Integer || raw instanceof Short || raw instanceof Byte) {
                return Optional.of(((Number) raw).intValue());
            }
            if (raw instanceof Long value) {
                return Optional.of(Math.toIntExact(value));
            }
            if (raw instanceof BigInteger value) {
                return Optional.of(value.intValueExact());
            }
            if (raw instanceof BigDecimal value) {
                return Optional.of(value.intValueExact());
            }
            if (raw instanceof Double || raw instanceof Float) {
                double value = ((Number) raw).doubleValue();
                if (value != Math.rint(value) || value < Integer.MIN_VALUE || value > Integer.MAX_VALUE) {
                    return Optional.empty();
                }
                return Optional.of((int) value);
            }
            if (raw instanceof String text) {
                return Optional.of(Integer.parseInt(text.trim()));
            }
        } catch (ArithmeticException | NumberFormatException e) {
            return Optional.empty();
        }
        return Optional.empty();
    }

    /** @return {@code value * factor}, or empty on overflow */
    static Optional<Integer> scale(int value, int factor) {
        try {
            return Optional.of(Math.multiplyExact(value, factor));
        } catch (ArithmeticException e) {
            return Optional.empty();
        }
    }
}
