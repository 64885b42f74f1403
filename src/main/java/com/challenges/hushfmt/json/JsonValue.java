package com.challenges.hushfmt.json;

import org.eclipse.collections.api.list.MutableList;
import org.eclipse.collections.api.map.MutableMap;

/**
 * Generic JSON value as read from a tree dump. Integers and fractional numbers stay apart so handles and
 * positions never go through a double.
 */
public sealed interface JsonValue {
    String typeName();

    record JsonObject(MutableMap<String, JsonValue> fields) implements JsonValue {
        // an explicit null counts as absent
        public JsonValue get(String name) {
            JsonValue value = fields.get(name);
            return value instanceof JsonNull ? null : value;
        }

        @Override
        public String typeName() {
            return "object";
        }
    }

    record JsonArray(MutableList<JsonValue> elements) implements JsonValue {
        @Override
        public String typeName() {
            return "array";
        }
    }

    record JsonString(String value) implements JsonValue {
        @Override
        public String typeName() {
            return "string";
        }
    }

    record JsonLong(long value) implements JsonValue {
        @Override
        public String typeName() {
            return "integer";
        }
    }

    record JsonDouble(double value) implements JsonValue {
        @Override
        public String typeName() {
            return "number";
        }
    }

    record JsonBoolean(boolean value) implements JsonValue {
        public static final JsonBoolean TRUE = new JsonBoolean(true);
        public static final JsonBoolean FALSE = new JsonBoolean(false);

        @Override
        public String typeName() {
            return "boolean";
        }
    }

    record JsonNull() implements JsonValue {
        public static final JsonNull INSTANCE = new JsonNull();

        @Override
        public String typeName() {
            return "null";
        }
    }
}
