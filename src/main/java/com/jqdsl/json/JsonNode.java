package com.jqdsl.json;

import org.eclipse.collections.api.list.MutableList;
import org.eclipse.collections.api.map.MutableMap;
import org.eclipse.collections.impl.factory.Lists;
import org.eclipse.collections.impl.map.mutable.MapAdapter;

import java.util.LinkedHashMap;

/**
 * Generic parsed document value: mappings, sequences and scalars.
 */
public sealed interface JsonNode {
    record JsonObject(MutableMap<String, JsonNode> fields) implements JsonNode {
        // Document key order is significant for the trees built from it
        public static JsonObject empty() {
            return new JsonObject(MapAdapter.adapt(new LinkedHashMap<>()));
        }
    }

    record JsonArray(MutableList<JsonNode> elements) implements JsonNode {
        public static JsonArray empty() {
            return new JsonArray(Lists.mutable.empty());
        }
    }

    sealed interface JsonScalar extends JsonNode {
        Object scalar();
    }

    record JsonString(String value) implements JsonScalar {
        @Override
        public Object scalar() {
            return value;
        }
    }

    sealed interface JsonNumber extends JsonScalar {
        Number numberValue();

        @Override
        default Object scalar() {
            return numberValue();
        }

        record JsonLong(long value) implements JsonNumber {
            @Override
            public Number numberValue() {
                return value;
            }
        }

        record JsonDouble(double value) implements JsonNumber {
            @Override
            public Number numberValue() {
                return value;
            }
        }

        static JsonNumber of(long value) {
            return new JsonLong(value);
        }

        static JsonNumber of(double value) {
            return new JsonDouble(value);
        }
    }

    record JsonBoolean(boolean value) implements JsonScalar {
        @Override
        public Object scalar() {
            return value;
        }
    }

    record JsonNull() implements JsonScalar {
        @Override
        public Object scalar() {
            return null;
        }
    }
}
