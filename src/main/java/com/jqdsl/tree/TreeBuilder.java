package com.jqdsl.tree;

import com.jqdsl.json.JsonNode;
import org.eclipse.collections.api.list.ImmutableList;
import org.eclipse.collections.api.list.MutableList;
import org.eclipse.collections.impl.factory.Lists;

import java.util.List;
import java.util.Map;

/**
 * Converts generic data (mappings, sequences and scalars) into a tree.
 *
 * <p>Accepts both {@link JsonNode} values and plain {@link Map}/{@link List}/scalar values. A key whose
 * value is a sequence of scalars becomes one {@link Leaf} holding the whole sequence; a key whose value
 * is a sequence of mappings or sequences becomes one {@link Branch} per element, each named by the key.
 * The first element decides which. Sequences never get a node of their own.
 */
public final class TreeBuilder {
    public static final String ROOT_NAME = "conf";

    private TreeBuilder() {
    }

    public static Branch build(Object value) {
        return build(value, ROOT_NAME, null);
    }

    public static Branch build(Object value, String rootName, String source) {
        if (!isMapping(value) && !isSequence(value)) {
            throw new UnsupportedShapeException("Expected a mapping or a sequence but got " + describe(value));
        }
        return new Branch(rootName, Lists.immutable.empty(), convert(value), true, source);
    }

    private static ImmutableList<Tree> convert(Object data) {
        MutableList<Tree> results = Lists.mutable.empty();
        if (isMapping(data)) {
            for (Map.Entry<?, ?> entry : entries(data)) {
                convertEntry(String.valueOf(entry.getKey()), entry.getValue(), results);
            }
        } else if (isSequence(data)) {
            for (Object element : elements(data)) {
                results.addAll(convert(element).castToList());
            }
        } else {
            throw new UnsupportedShapeException("Unrecognized data type: " + describe(data));
        }
        return results.toImmutable();
    }

    private static void convertEntry(String key, Object value, MutableList<Tree> results) {
        if (isMapping(value)) {
            results.add(Branch.of(key, convert(value)));
        } else if (isSequence(value)) {
            List<?> items = elements(value);
            if (items.isEmpty()) {
                return;
            }
            Object first = items.get(0);
            if (isMapping(first) || isSequence(first)) {
                for (Object item : items) {
                    results.add(Branch.of(key, convert(item)));
                }
            } else {
                MutableList<Object> scalars = Lists.mutable.withInitialCapacity(items.size());
                for (Object item : items) {
                    scalars.add(scalar(item));
                }
                results.add(new Leaf(key, scalars.toImmutable()));
            }
        } else {
            results.add(new Leaf(key, Lists.immutable.with(scalar(value))));
        }
    }

    private static boolean isMapping(Object value) {
        return value instanceof JsonNode.JsonObject || value instanceof Map;
    }

    private static boolean isSequence(Object value) {
        return value instanceof JsonNode.JsonArray || value instanceof List;
    }

    private static Iterable<? extends Map.Entry<?, ?>> entries(Object mapping) {
        if (mapping instanceof JsonNode.JsonObject object) {
            return object.fields().entrySet();
        }
        return ((Map<?, ?>) mapping).entrySet();
    }

    private static List<?> elements(Object sequence) {
        if (sequence instanceof JsonNode.JsonArray array) {
            return array.elements();
        }
        return (List<?>) sequence;
    }

    private static Object scalar(Object value) {
        if (value instanceof JsonNode.JsonScalar s) {
            return s.scalar();
        }
        if (Scalars.isScalar(value)) {
            return value;
        }
        throw new UnsupportedShapeException("Unrecognized data type: " + describe(value));
    }

    private static String describe(Object value) {
        return value == null ? "null" : value.getClass().getName();
    }
}
