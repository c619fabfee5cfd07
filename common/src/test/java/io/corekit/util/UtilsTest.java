package io.corekit.util;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.Instant;

import org.junit.jupiter.api.Test;

public class UtilsTest {

    record Order(String orderId, Instant createdAt) {
    }

    @Test
    public void testSnakeCaseMapperBindsCamelCaseProperties() throws Exception {
        Order order = Utils.SNAKE_CASE_MAPPER.readValue(
                "{\"order_id\":\"o-1\",\"created_at\":\"2025-04-02T10:15:30Z\",\"ignored\":1}", Order.class);

        assertEquals("o-1", order.orderId());
        assertEquals(Instant.parse("2025-04-02T10:15:30Z"), order.createdAt());
    }

    @Test
    public void testPrettyPrint() {
        String pretty = Utils.prettyPrint("{\"a\":1}");
        assertTrue(pretty.contains("\n"));

        assertEquals("not json", Utils.prettyPrint("not json"));
    }

    @Test
    public void testCheckNotNullParam() {
        assertEquals("value", Assert.checkNotNullParam("p", "value"));
        IllegalArgumentException e = assertThrows(IllegalArgumentException.class,
                () -> Assert.checkNotNullParam("url", null));
        assertTrue(e.getMessage().contains("url"));
    }
}
