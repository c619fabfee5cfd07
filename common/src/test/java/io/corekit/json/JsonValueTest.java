package io.corekit.json;

import static io.corekit.util.Utils.OBJECT_MAPPER;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.math.BigDecimal;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.DoubleAdder;

import com.fasterxml.jackson.databind.JsonMappingException;
import org.junit.jupiter.api.Test;

public class JsonValueTest {

    @Test
    public void testObjectKeepsInsertionOrder() throws Exception {
        JsonValue.JsonObject body = JsonValue.object()
                .put("zeta", 1)
                .put("alpha", "a")
                .put("mid", true)
                .build();

        assertEquals("{\"zeta\":1,\"alpha\":\"a\",\"mid\":true}", OBJECT_MAPPER.writeValueAsString(body));
    }

    @Test
    public void testNestedValuesAndNull() throws Exception {
        Map<String, Object> raw = new LinkedHashMap<>();
        raw.put("tags", List.of("a", "b"));
        raw.put("owner", null);
        raw.put("dims", Map.of("w", 2));

        JsonValue.JsonObject body = JsonValue.of(raw);

        assertSame(JsonValue.JsonNull.INSTANCE, body.get("owner"));
        assertInstanceOf(JsonValue.JsonArray.class, body.get("tags"));
        assertEquals("{\"tags\":[\"a\",\"b\"],\"owner\":null,\"dims\":{\"w\":2}}",
                OBJECT_MAPPER.writeValueAsString(body));
    }

    @Test
    public void testNumbersKeepTheirForm() throws Exception {
        JsonValue value = JsonValue.array(
                JsonValue.number(9.99),
                JsonValue.number(42L),
                JsonValue.number(new BigDecimal("1.10")));

        assertEquals("[9.99,42,1.10]", OBJECT_MAPPER.writeValueAsString(value));
    }

    @Test
    public void testOtherNumberTypesKeepTheirFraction() throws Exception {
        DoubleAdder total = new DoubleAdder();
        total.add(1.5);
        AtomicLong count = new AtomicLong(12);

        JsonValue.JsonObject body = JsonValue.object().put("total", total).put("count", count).build();

        assertEquals("{\"total\":1.5,\"count\":12}", OBJECT_MAPPER.writeValueAsString(body));
        assertInstanceOf(BigDecimal.class, ((JsonValue.JsonNumber) body.get("total")).value());
    }

    @Test
    public void testOtherNumberTypeWithoutDecimalFormIsRejected() {
        DoubleAdder broken = new DoubleAdder();
        broken.add(Double.POSITIVE_INFINITY);

        assertThrows(IllegalArgumentException.class, () -> JsonValue.number(broken));
    }

    @Test
    public void testNonFiniteNumberFailsSerialization() {
        JsonValue.JsonObject body = JsonValue.object().put("ratio", Double.NaN).build();

        assertThrows(JsonMappingException.class, () -> OBJECT_MAPPER.writeValueAsString(body));
    }

    @Test
    public void testUnsupportedTypeIsRejected() {
        assertThrows(IllegalArgumentException.class, () -> JsonValue.of(new Object()));
        assertThrows(IllegalArgumentException.class, () -> JsonValue.of(Map.of(1, "one")));
    }

    @Test
    public void testArraysAreConverted() {
        JsonValue value = JsonValue.of(new Object[] {"x", 1});

        assertEquals(JsonValue.array(JsonValue.string("x"), JsonValue.number(1)), value);
    }

    @Test
    public void testReadTree() throws Exception {
        JsonValue value = OBJECT_MAPPER.readValue("{\"name\":\"Pen\",\"tags\":[1,null,false]}", JsonValue.class);

        JsonValue.JsonObject object = assertInstanceOf(JsonValue.JsonObject.class, value);
        assertEquals(JsonValue.string("Pen"), object.get("name"));
        assertEquals(new JsonValue.JsonArray(Arrays.asList(
                        JsonValue.number(1), JsonValue.nullValue(), JsonValue.bool(false))),
                object.get("tags"));
    }
}
