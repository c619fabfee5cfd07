package io.corekit.json;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

import org.jspecify.annotations.Nullable;

/**
 * A JSON value: string, number, boolean, array, object or null.
 * <p>
 * Request bodies are built from these variants instead of arbitrary objects so that the
 * serialization rules are explicit:
 * <ul>
 *   <li>objects keep the insertion order of their members</li>
 *   <li>numbers are written in their natural numeric form; {@code NaN} and infinities are
 *       not representable in JSON and fail serialization</li>
 *   <li>{@code null} is a value of its own ({@link JsonNull}), never a missing member</li>
 * </ul>
 *
 * <h2>Usage Example</h2>
 * <pre>{@code
 * JsonValue.JsonObject body = JsonValue.object()
 *     .put("name", "Widget")
 *     .put("price", 9.99)
 *     .build();
 * }</pre>
 *
 * @see JsonValueModule
 */
public sealed interface JsonValue
        permits JsonValue.JsonString, JsonValue.JsonNumber, JsonValue.JsonBool,
                JsonValue.JsonArray, JsonValue.JsonObject, JsonValue.JsonNull {

    /**
     * The variant of a {@link JsonValue}.
     */
    enum Kind {
        STRING,
        NUMBER,
        BOOLEAN,
        ARRAY,
        OBJECT,
        NULL
    }

    /**
     * Returns the variant of this value.
     *
     * @return the kind
     */
    Kind kind();

    record JsonString(String value) implements JsonValue {
        public JsonString {
            Objects.requireNonNull(value, "value");
        }

        @Override
        public Kind kind() {
            return Kind.STRING;
        }
    }

    /**
     * A JSON number. {@code Byte}, {@code Short}, {@code Integer}, {@code Long}, {@code BigInteger},
     * {@code BigDecimal}, {@code Float} and {@code Double} are kept as given; any other
     * {@link Number} is converted to a {@link BigDecimal} through its decimal string form.
     */
    record JsonNumber(Number value) implements JsonValue {
        public JsonNumber {
            Objects.requireNonNull(value, "value");
            value = normalize(value);
        }

        private static Number normalize(Number value) {
            if (value instanceof Byte || value instanceof Short || value instanceof Integer
                    || value instanceof Long || value instanceof BigInteger || value instanceof BigDecimal
                    || value instanceof Float || value instanceof Double) {
                return value;
            }
            try {
                return new BigDecimal(value.toString());
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("No JSON representation for " + value.getClass().getName()
                        + " value " + value, e);
            }
        }

        /**
         * Whether this number can be written as a JSON number.
         *
         * @return {@code false} for {@code NaN} and infinite floating point values
         */
        public boolean isFinite() {
            if (value instanceof Double || value instanceof Float) {
                return Double.isFinite(value.doubleValue());
            }
            return true;
        }

        @Override
        public Kind kind() {
            return Kind.NUMBER;
        }
    }

    record JsonBool(boolean value) implements JsonValue {
        public static final JsonBool TRUE = new JsonBool(true);
        public static final JsonBool FALSE = new JsonBool(false);

        @Override
        public Kind kind() {
            return Kind.BOOLEAN;
        }
    }

    record JsonArray(List<JsonValue> values) implements JsonValue {
        public JsonArray {
            values = List.copyOf(values);
        }

        @Override
        public Kind kind() {
            return Kind.ARRAY;
        }
    }

    record JsonObject(Map<String, JsonValue> members) implements JsonValue {
        public JsonObject {
            Map<String, JsonValue> copy = new LinkedHashMap<>();
            for (Map.Entry<String, JsonValue> entry : members.entrySet()) {
                copy.put(Objects.requireNonNull(entry.getKey(), "member name"),
                        Objects.requireNonNull(entry.getValue(), "member value"));
            }
            members = Collections.unmodifiableMap(copy);
        }

        public @Nullable JsonValue get(String name) {
            return members.get(name);
        }

        public boolean isEmpty() {
            return members.isEmpty();
        }

        @Override
        public Kind kind() {
            return Kind.OBJECT;
        }
    }

    record JsonNull() implements JsonValue {
        public static final JsonNull INSTANCE = new JsonNull();

        @Override
        public Kind kind() {
            return Kind.NULL;
        }
    }

    static JsonString string(String value) {
        return new JsonString(value);
    }

    static JsonNumber number(Number value) {
        return new JsonNumber(value);
    }

    static JsonBool bool(boolean value) {
        return value ? JsonBool.TRUE : JsonBool.FALSE;
    }

    static JsonArray array(JsonValue... values) {
        return new JsonArray(Arrays.asList(values));
    }

    static JsonNull nullValue() {
        return JsonNull.INSTANCE;
    }

    static ObjectBuilder object() {
        return new ObjectBuilder();
    }

    /**
     * Converts a plain Java value into a {@link JsonValue}.
     * <p>
     * Supported inputs are {@code null}, {@link JsonValue}, {@link CharSequence}, {@link Character},
     * {@link Number}, {@link Boolean}, {@link Map} with string keys, {@link Collection} and arrays
     * of these.
     *
     * @param value the value to convert
     * @return the converted value
     * @throws IllegalArgumentException if the value, or a nested value, has no JSON representation
     */
    static JsonValue of(@Nullable Object value) {
        if (value == null) {
            return JsonNull.INSTANCE;
        }
        if (value instanceof JsonValue jsonValue) {
            return jsonValue;
        }
        if (value instanceof CharSequence || value instanceof Character) {
            return new JsonString(value.toString());
        }
        if (value instanceof Boolean b) {
            return bool(b);
        }
        if (value instanceof Number n) {
            return new JsonNumber(n);
        }
        if (value instanceof Map<?, ?> map) {
            Map<String, JsonValue> members = new LinkedHashMap<>();
            for (Map.Entry<?, ?> entry : map.entrySet()) {
                if (!(entry.getKey() instanceof String)) {
                    throw new IllegalArgumentException("JSON object keys must be strings, got: " + entry.getKey());
                }
                members.put((String) entry.getKey(), of(entry.getValue()));
            }
            return new JsonObject(members);
        }
        if (value instanceof Collection<?> collection) {
            List<JsonValue> values = new ArrayList<>(collection.size());
            for (Object element : collection) {
                values.add(of(element));
            }
            return new JsonArray(values);
        }
        if (value instanceof Object[] array) {
            return of(Arrays.asList(array));
        }
        throw new IllegalArgumentException("No JSON representation for " + value.getClass().getName());
    }

    /**
     * Converts a plain Java map into a {@link JsonObject}.
     *
     * @param members the object members
     * @return the converted object
     * @throws IllegalArgumentException if a member value has no JSON representation
     */
    static JsonObject of(Map<String, ?> members) {
        return (JsonObject) of((Object) members);
    }

    /**
     * Builder for {@link JsonObject} preserving insertion order.
     */
    final class ObjectBuilder {
        private final Map<String, JsonValue> members = new LinkedHashMap<>();

        private ObjectBuilder() {
        }

        public ObjectBuilder put(String name, @Nullable Object value) {
            members.put(name, JsonValue.of(value));
            return this;
        }

        public JsonObject build() {
            return new JsonObject(members);
        }
    }
}
