package io.corekit.json;

import java.io.IOException;
import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.JsonMappingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.SerializerProvider;
import com.fasterxml.jackson.databind.deser.std.StdDeserializer;
import com.fasterxml.jackson.databind.module.SimpleModule;
import com.fasterxml.jackson.databind.ser.std.StdSerializer;

/**
 * Jackson module writing and reading {@link JsonValue} trees.
 */
public class JsonValueModule extends SimpleModule {

    public JsonValueModule() {
        super("corekit-json-value");
        addSerializer(JsonValue.class, new JsonValueSerializer());
        addDeserializer(JsonValue.class, new JsonValueDeserializer());
    }

    /**
     * Converts a parsed Jackson tree into a {@link JsonValue}.
     *
     * @param node the tree
     * @return the equivalent value
     */
    public static JsonValue fromNode(JsonNode node) {
        if (node.isObject()) {
            Map<String, JsonValue> members = new LinkedHashMap<>();
            Iterator<Map.Entry<String, JsonNode>> fields = node.fields();
            while (fields.hasNext()) {
                Map.Entry<String, JsonNode> field = fields.next();
                members.put(field.getKey(), fromNode(field.getValue()));
            }
            return new JsonValue.JsonObject(members);
        }
        if (node.isArray()) {
            List<JsonValue> values = new ArrayList<>(node.size());
            for (JsonNode element : node) {
                values.add(fromNode(element));
            }
            return new JsonValue.JsonArray(values);
        }
        if (node.isTextual()) {
            return new JsonValue.JsonString(node.textValue());
        }
        if (node.isBoolean()) {
            return JsonValue.bool(node.booleanValue());
        }
        if (node.isNumber()) {
            return new JsonValue.JsonNumber(node.numberValue());
        }
        return JsonValue.JsonNull.INSTANCE;
    }

    static class JsonValueSerializer extends StdSerializer<JsonValue> {

        JsonValueSerializer() {
            super(JsonValue.class);
        }

        @Override
        public void serialize(JsonValue value, JsonGenerator gen, SerializerProvider provider) throws IOException {
            switch (value.kind()) {
                case STRING -> gen.writeString(((JsonValue.JsonString) value).value());
                case NUMBER -> writeNumber((JsonValue.JsonNumber) value, gen, provider);
                case BOOLEAN -> gen.writeBoolean(((JsonValue.JsonBool) value).value());
                case ARRAY -> {
                    List<JsonValue> values = ((JsonValue.JsonArray) value).values();
                    gen.writeStartArray(value, values.size());
                    for (JsonValue element : values) {
                        serialize(element, gen, provider);
                    }
                    gen.writeEndArray();
                }
                case OBJECT -> {
                    gen.writeStartObject(value);
                    for (Map.Entry<String, JsonValue> member : ((JsonValue.JsonObject) value).members().entrySet()) {
                        gen.writeFieldName(member.getKey());
                        serialize(member.getValue(), gen, provider);
                    }
                    gen.writeEndObject();
                }
                case NULL -> gen.writeNull();
            }
        }

        private static void writeNumber(JsonValue.JsonNumber number, JsonGenerator gen,
                                        SerializerProvider provider) throws IOException {
            if (!number.isFinite()) {
                throw JsonMappingException.from(provider,
                        "Number " + number.value() + " has no JSON representation");
            }
            Number n = number.value();
            if (n instanceof BigDecimal) {
                gen.writeNumber((BigDecimal) n);
            } else if (n instanceof BigInteger) {
                gen.writeNumber((BigInteger) n);
            } else if (n instanceof Float) {
                gen.writeNumber(n.floatValue());
            } else if (n instanceof Double) {
                gen.writeNumber(n.doubleValue());
            } else {
                gen.writeNumber(n.longValue());
            }
        }
    }

    static class JsonValueDeserializer extends StdDeserializer<JsonValue> {

        JsonValueDeserializer() {
            super(JsonValue.class);
        }

        @Override
        public JsonValue deserialize(JsonParser p, DeserializationContext ctxt) throws IOException {
            JsonNode node = p.readValueAsTree();
            return fromNode(node);
        }

        @Override
        public JsonValue getNullValue(DeserializationContext ctxt) {
            return JsonValue.JsonNull.INSTANCE;
        }
    }
}
