package com.jqdsl.tree;

import java.math.BigDecimal;
import java.util.Comparator;

/**
 * Ordering, equality and rendering of the scalar values held by tree nodes.
 *
 * <p>Scalars are {@code null}, {@link Boolean}, {@link Number} or {@link String}. Numbers compare
 * numerically regardless of their boxed type. {@link #compare} throws {@link ClassCastException}
 * for values of different kinds; {@link #ORDER} is the total order used for sorting mixed result
 * sets: null, then booleans, then numbers, then strings.
 */
public final class Scalars {
    public static final Comparator<Object> ORDER = Scalars::compareAcrossKinds;

    private Scalars() {
    }

    public static boolean isScalar(Object value) {
        return value == null || value instanceof String || value instanceof Number || value instanceof Boolean;
    }

    public static boolean equal(Object left, Object right) {
        if (left instanceof Number l && right instanceof Number r) {
            return compareNumbers(l, r) == 0;
        }
        return left == null ? right == null : left.equals(right);
    }

    // Hash key that agrees with equal(): 1 and 1.0 collapse to the same key.
    public static Object key(Object value) {
        if (value instanceof Boolean || !(value instanceof Number)) {
            return value;
        }
        Number n = (Number) value;
        if (isFloating(n) && (Double.isNaN(n.doubleValue()) || Double.isInfinite(n.doubleValue()))) {
            return n.doubleValue();
        }
        BigDecimal decimal = isIntegral(n) ? BigDecimal.valueOf(n.longValue())
                : isFloating(n) ? BigDecimal.valueOf(n.doubleValue()) : new BigDecimal(n.toString());
        return decimal.stripTrailingZeros();
    }

    /**
     * Compares two scalars of the same kind.
     *
     * @throws ClassCastException when the kinds differ or either value is not comparable
     */
    public static int compare(Object left, Object right) {
        if (left instanceof Number l && right instanceof Number r) {
            return compareNumbers(l, r);
        }
        if (left instanceof String l && right instanceof String r) {
            return l.compareTo(r);
        }
        if (left instanceof Boolean l && right instanceof Boolean r) {
            return l.compareTo(r);
        }
        throw new ClassCastException("Cannot compare " + describe(left) + " with " + describe(right));
    }

    public static String render(Object value) {
        if (value instanceof String s) {
            return "\"" + escape(s) + "\"";
        }
        return String.valueOf(value);
    }

    private static int compareAcrossKinds(Object left, Object right) {
        int byKind = Integer.compare(rank(left), rank(right));
        if (byKind != 0) {
            return byKind;
        }
        if (left == null) {
            return 0;
        }
        if (rank(left) == 4) {
            return String.valueOf(left).compareTo(String.valueOf(right));
        }
        return compare(left, right);
    }

    private static int rank(Object value) {
        if (value == null) {
            return 0;
        }
        if (value instanceof Boolean) {
            return 1;
        }
        if (value instanceof Number) {
            return 2;
        }
        if (value instanceof String) {
            return 3;
        }
        return 4;
    }

    private static int compareNumbers(Number left, Number right) {
        if (isIntegral(left) && isIntegral(right)) {
            return Long.compare(left.longValue(), right.longValue());
        }
        if (isFloating(left) || isFloating(right)) {
            return Double.compare(left.doubleValue(), right.doubleValue());
        }
        return new BigDecimal(left.toString()).compareTo(new BigDecimal(right.toString()));
    }

    private static boolean isIntegral(Number n) {
        return n instanceof Long || n instanceof Integer || n instanceof Short || n instanceof Byte;
    }

    private static boolean isFloating(Number n) {
        return n instanceof Double || n instanceof Float;
    }

    private static String describe(Object value) {
        return value == null ? "null" : value.getClass().getSimpleName();
    }

    private static String escape(String s) {
        StringBuilder result = new StringBuilder(s.length() + 8);
        for (int i = 0; i < s.length(); i++) {
            char c = s.charAt(i);
            switch (c) {
                case '\\' -> result.append("\\\\");
                case '"' -> result.append("\\\"");
                case '\n' -> result.append("\\n");
                case '\r' -> result.append("\\r");
                case '\t' -> result.append("\\t");
                default -> result.append(c);
            }
        }
        return result.toString();
    }
}
