package com.jqdsl.json;

import com.fasterxml.jackson.core.JsonFactory;
import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonToken;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.util.Locale;

/**
 * Parses JSON or YAML text into {@link JsonNode} values using Jackson's streaming API.
 * Only the first document of a multi-document YAML stream is read.
 */
public class DocumentParser {
    public enum Format {
        JSON,
        YAML;

        // YAML reads JSON too, so only files named .json take the stricter JSON parser.
        public static Format forPath(String path) {
            return path.toLowerCase(Locale.ROOT).endsWith(".json") ? JSON : YAML;
        }
    }

    private final JsonFactory jsonFactory = new JsonFactory();
    private final YAMLFactory yamlFactory = new YAMLFactory();

    public JsonNode parse(InputStream input) throws IOException {
        return parse(input, Format.JSON);
    }

    public JsonNode parse(byte[] bytes, Format format) throws IOException {
        return parse(new ByteArrayInputStream(bytes), format);
    }

    public JsonNode parse(InputStream input, Format format) throws IOException {
        JsonFactory factory = format == Format.YAML ? yamlFactory : jsonFactory;
        try (JsonParser parser = factory.createParser(input)) {
            JsonToken token = parser.nextToken();
            if (token == null) {
                throw new IOException("Empty document");
            }
            return parseValue(parser, token);
        }
    }

    private JsonNode parseValue(JsonParser parser, JsonToken token) throws IOException {
        return switch (token) {
            case START_OBJECT -> parseObject(parser);
            case START_ARRAY -> parseArray(parser);
            case VALUE_STRING -> new JsonNode.JsonString(parser.getText());
            case VALUE_NUMBER_INT -> JsonNode.JsonNumber.of(parser.getLongValue());
            case VALUE_NUMBER_FLOAT -> JsonNode.JsonNumber.of(parser.getDoubleValue());
            case VALUE_TRUE -> new JsonNode.JsonBoolean(true);
            case VALUE_FALSE -> new JsonNode.JsonBoolean(false);
            case VALUE_NULL -> new JsonNode.JsonNull();
            default -> throw new IOException("Unexpected token: " + token);
        };
    }

    private JsonNode.JsonObject parseObject(JsonParser parser) throws IOException {
        JsonNode.JsonObject object = JsonNode.JsonObject.empty();

        JsonToken token;
        while ((token = parser.nextToken()) != JsonToken.END_OBJECT) {
            if (token == null) {
                throw new IOException("Unterminated object");
            }
            String fieldName = parser.currentName();
            JsonNode value = parseValue(parser, parser.nextToken());
            object.fields().put(fieldName, value);
        }

        return object;
    }

    private JsonNode.JsonArray parseArray(JsonParser parser) throws IOException {
        JsonNode.JsonArray array = JsonNode.JsonArray.empty();

        JsonToken token;
        while ((token = parser.nextToken()) != JsonToken.END_ARRAY) {
            if (token == null) {
                throw new IOException("Unterminated array");
            }
            array.elements().add(parseValue(parser, token));
        }

        return array;
    }
}
