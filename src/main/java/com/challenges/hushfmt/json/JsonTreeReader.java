package com.challenges.hushfmt.json;

import com.fasterxml.jackson.core.JsonFactory;
import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonToken;
import org.eclipse.collections.api.list.MutableList;
import org.eclipse.collections.api.map.MutableMap;
import org.eclipse.collections.impl.factory.Lists;
import org.eclipse.collections.impl.factory.Maps;

import java.io.IOException;
import java.io.InputStream;

/**
 * Streams a JSON document into a {@link JsonValue} tree.
 */
public class JsonTreeReader {
    private final JsonFactory factory = new JsonFactory();

    public JsonValue read(InputStream input) throws IOException {
        try (JsonParser parser = factory.createParser(input)) {
            return readDocument(parser);
        }
    }

    public JsonValue read(String json) throws IOException {
        try (JsonParser parser = factory.createParser(json)) {
            return readDocument(parser);
        }
    }

    private JsonValue readDocument(JsonParser parser) throws IOException {
        JsonToken token = parser.nextToken();
        if (token == null) {
            throw new IOException("Empty JSON input");
        }
        JsonValue value = readValue(parser, token);
        if (parser.nextToken() != null) {
            throw new IOException("Trailing content after JSON document at " + parser.getCurrentLocation());
        }
        return value;
    }

    private JsonValue readValue(JsonParser parser, JsonToken token) throws IOException {
        return switch (token) {
            case START_OBJECT -> readObject(parser);
            case START_ARRAY -> readArray(parser);
            case VALUE_STRING -> new JsonValue.JsonString(parser.getText());
            case VALUE_NUMBER_INT -> new JsonValue.JsonLong(parser.getLongValue());
            case VALUE_NUMBER_FLOAT -> new JsonValue.JsonDouble(parser.getDoubleValue());
            case VALUE_TRUE -> JsonValue.JsonBoolean.TRUE;
            case VALUE_FALSE -> JsonValue.JsonBoolean.FALSE;
            case VALUE_NULL -> JsonValue.JsonNull.INSTANCE;
            default -> throw new IOException("Unexpected JSON token: " + token);
        };
    }

    private JsonValue.JsonObject readObject(JsonParser parser) throws IOException {
        MutableMap<String, JsonValue> fields = Maps.mutable.empty();

        while (parser.nextToken() != JsonToken.END_OBJECT) {
            String fieldName = parser.getCurrentName();
            fields.put(fieldName, readValue(parser, parser.nextToken()));
        }

        return new JsonValue.JsonObject(fields);
    }

    private JsonValue.JsonArray readArray(JsonParser parser) throws IOException {
        MutableList<JsonValue> elements = Lists.mutable.empty();

        JsonToken token;
        while ((token = parser.nextToken()) != JsonToken.END_ARRAY) {
            elements.add(readValue(parser, token));
        }

        return new JsonValue.JsonArray(elements);
    }
}
