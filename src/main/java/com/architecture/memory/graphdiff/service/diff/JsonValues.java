package com.architecture.memory.graphdiff.service.diff;

import java.lang.reflect.Array;
import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Helpers for JSON-shaped values (maps, lists, strings, numbers, booleans, null)
 * as found in node and edge payloads.
 */
public final class JsonValues {

    public enum Shape {
        NULL,
        OBJECT,
        ARRAY,
        STRING,
        NUMBER,
        BOOLEAN,
        OTHER
    }

    private JsonValues() {
    }

    public static Shape shapeOf(Object value) {
        if (value == null) return Shape.NULL;
        if (value instanceof Map) return Shape.OBJECT;
        if (value instanceof Collection || value.getClass().isArray()) return Shape.ARRAY;
        if (value instanceof CharSequence || value instanceof Character) return Shape.STRING;
        if (value instanceof Number) return Shape.NUMBER;
        if (value instanceof Boolean) return Shape.BOOLEAN;
        return Shape.OTHER;
    }

    /**
     * Coarse type name with JavaScript {@code typeof} semantics: null, maps and lists are all "object".
     */
    public static String typeOf(Object value) {
        return switch (shapeOf(value)) {
            case NULL, OBJECT, ARRAY -> "object";
            case STRING -> "string";
            case NUMBER -> "number";
            case BOOLEAN -> "boolean";
            case OTHER -> value.getClass().getSimpleName();
        };
    }

    @SuppressWarnings("unchecked")
    public static Map<String, Object> asMap(Object value) {
        return (Map<String, Object>) value;
    }

    public static List<Object> asList(Object value) {
        if (value instanceof List<?> list) {
            return new ArrayList<>(list);
        }
        if (value instanceof Collection<?> collection) {
            return new ArrayList<>(collection);
        }
        int length = Array.getLength(value);
        List<Object> result = new ArrayList<>(length);
        for (int i = 0; i < length; i++) {
            result.add(Array.get(value, i));
        }
        return result;
    }

    public static boolean scalarEquals(Object a, Object b) {
        if (a instanceof Number na && b instanceof Number nb) {
            return numbersEqual(na, nb);
        }
        if (a instanceof CharSequence && b instanceof CharSequence) {
            return a.toString().equals(b.toString());
        }
        return Objects.equals(a, b);
    }

    /**
     * Structural equality; numbers compare by value so {@code 1}, {@code 1L} and {@code 1.0} are equal.
     */
    public static boolean deepEquals(Object a, Object b) {
        Shape shape = shapeOf(a);
        if (shape != shapeOf(b)) {
            return false;
        }
        switch (shape) {
            case NULL:
                return true;
            case OBJECT: {
                Map<String, Object> left = asMap(a);
                Map<String, Object> right = asMap(b);
                if (!left.keySet().equals(right.keySet())) {
                    return false;
                }
                for (Map.Entry<String, Object> entry : left.entrySet()) {
                    if (!deepEquals(entry.getValue(), right.get(entry.getKey()))) {
                        return false;
                    }
                }
                return true;
            }
            case ARRAY: {
                List<Object> left = asList(a);
                List<Object> right = asList(b);
                if (left.size() != right.size()) {
                    return false;
                }
                for (int i = 0; i < left.size(); i++) {
                    if (!deepEquals(left.get(i), right.get(i))) {
                        return false;
                    }
                }
                return true;
            }
            default:
                return scalarEquals(a, b);
        }
    }

    /**
     * Mutable deep copy: maps become {@link LinkedHashMap}s, lists and arrays become {@link ArrayList}s.
     */
    public static Object deepCopy(Object value) {
        switch (shapeOf(value)) {
            case OBJECT: {
                Map<String, Object> copy = new LinkedHashMap<>();
                asMap(value).forEach((key, child) -> copy.put(key, deepCopy(child)));
                return copy;
            }
            case ARRAY: {
                List<Object> copy = new ArrayList<>();
                for (Object child : asList(value)) {
                    copy.add(deepCopy(child));
                }
                return copy;
            }
            default:
                return value;
        }
    }

    public static Map<String, Object> deepCopyMap(Map<String, Object> value) {
        if (value == null) {
            return new LinkedHashMap<>();
        }
        return asMap(deepCopy(value));
    }

    private static boolean numbersEqual(Number a, Number b) {
        if (isNonFinite(a) || isNonFinite(b)) {
            return Double.compare(a.doubleValue(), b.doubleValue()) == 0;
        }
        try {
            return new BigDecimal(a.toString()).compareTo(new BigDecimal(b.toString())) == 0;
        } catch (NumberFormatException e) {
            return a.equals(b);
        }
    }

    private static boolean isNonFinite(Number n) {
        return (n instanceof Double d && (d.isNaN() || d.isInfinite()))
                || (n instanceof Float f && (f.isNaN() || f.isInfinite()));
    }
}
