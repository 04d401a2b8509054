package com.scaffold.generator.condition;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.Collection;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Loose comparisons between resolved variable values and condition operands.
 * Numbers compare by value regardless of their boxed type; anything that
 * cannot be compared is reported as such instead of throwing.
 */
public final class ValueComparator {

    private ValueComparator() {
        // Utility class
    }

    public static boolean isTruthy(Object value) {
        if (value == null) {
            return false;
        }
        if (value instanceof Boolean b) {
            return b;
        }
        if (value instanceof Number n) {
            return n.doubleValue() != 0.0;
        }
        if (value instanceof CharSequence s) {
            return s.length() > 0;
        }
        if (value instanceof Collection<?> c) {
            return !c.isEmpty();
        }
        if (value instanceof Map<?, ?> m) {
            return !m.isEmpty();
        }
        return true;
    }

    public static boolean isEmpty(Object value) {
        return !isTruthy(value);
    }

    public static boolean looselyEquals(Object a, Object b) {
        if (a instanceof Number x && b instanceof Number y) {
            return compareNumbers(x, y) == 0;
        }
        if (a instanceof Collection<?> x && b instanceof Collection<?> y) {
            if (x.size() != y.size()) {
                return false;
            }
            var left = x.iterator();
            var right = y.iterator();
            while (left.hasNext()) {
                if (!looselyEquals(left.next(), right.next())) {
                    return false;
                }
            }
            return true;
        }
        return Objects.equals(a, b);
    }

    /**
     * Orders two numbers or two strings.
     *
     * @return empty when the values are not mutually comparable
     */
    public static Optional<Integer> compare(Object a, Object b) {
        if (a instanceof Number x && b instanceof Number y) {
            return Optional.of(compareNumbers(x, y));
        }
        if (a instanceof String x && b instanceof String y) {
            return Optional.of(x.compareTo(y));
        }
        return Optional.empty();
    }

    /**
     * Membership: element of a collection, key of a map or substring of a string.
     */
    public static boolean contains(Object container, Object item) {
        if (container instanceof Collection<?> c) {
            return c.stream().anyMatch(element -> looselyEquals(element, item));
        }
        if (container instanceof Map<?, ?> m) {
            return m.containsKey(item);
        }
        if (container instanceof String s && item != null) {
            return s.contains(String.valueOf(item));
        }
        return false;
    }

    private static int compareNumbers(Number x, Number y) {
        if (!isFinite(x) || !isFinite(y)) {
            return Double.compare(x.doubleValue(), y.doubleValue());
        }
        return toDecimal(x).compareTo(toDecimal(y));
    }

    private static boolean isFinite(Number n) {
        return !(n instanceof Double || n instanceof Float) || Double.isFinite(n.doubleValue());
    }

    private static BigDecimal toDecimal(Number n) {
        if (n instanceof BigDecimal d) {
            return d;
        }
        if (n instanceof BigInteger i) {
            return new BigDecimal(i);
        }
        if (n instanceof Double || n instanceof Float) {
            return BigDecimal.valueOf(n.doubleValue());
        }
        return BigDecimal.valueOf(n.longValue());
    }
}
