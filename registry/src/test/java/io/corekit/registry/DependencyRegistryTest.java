package io.corekit.registry;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.function.Supplier;

import org.junit.jupiter.api.Test;

public class DependencyRegistryTest {

    interface Greeter {
        String greet();
    }

    private final DependencyRegistry registry = new DependencyRegistry();

    @Test
    public void testResolveByType() throws Exception {
        Greeter greeter = () -> "hello";
        registry.register(Greeter.class, greeter);

        assertSame(greeter, registry.resolve(Greeter.class));
        assertTrue(registry.contains(Greeter.class));
    }

    @Test
    public void testResolveByKeyIsIndependentOfType() throws Exception {
        Greeter english = () -> "hello";
        Greeter french = () -> "bonjour";
        registry.register(Greeter.class, english);
        registry.register("french", french);

        assertSame(french, registry.resolve("french", Greeter.class));
        assertSame(english, registry.resolve(Greeter.class));
    }

    @Test
    public void testMissingDependencyIsReportedNotFatal() {
        DependencyNotFoundException e = assertThrows(DependencyNotFoundException.class,
                () -> registry.resolve(Greeter.class));
        assertEquals(Greeter.class, e.getKey());

        assertFalse(registry.find("missing", Greeter.class).isPresent());
    }

    @Test
    public void testWrongTypeIsReportedAsNotFound() {
        registry.register("greeter", "not a greeter");

        DependencyNotFoundException e = assertThrows(DependencyNotFoundException.class,
                () -> registry.resolve("greeter", Greeter.class));
        assertEquals("greeter", e.getKey());
        assertTrue(e.getMessage().contains(String.class.getName()));
    }

    @Test
    public void testRegisterReplacesAndUnregisterRemoves() throws Exception {
        Supplier<String> first = () -> "1";
        Supplier<String> second = () -> "2";
        registry.register("supplier", first);
        registry.register("supplier", second);

        assertSame(second, registry.resolve("supplier", Supplier.class));
        assertTrue(registry.unregister("supplier"));
        assertFalse(registry.contains("supplier"));
        assertFalse(registry.unregister("supplier"));
    }

    @Test
    public void testNullParametersAreRejected() {
        assertThrows(IllegalArgumentException.class, () -> registry.register((String) null, "x"));
        assertThrows(IllegalArgumentException.class, () -> registry.register(Greeter.class, null));
    }
}
