package configstore.domain.trace;

import configstore.domain.exceptionhandling.LoggingExceptionHandler;
import configstore.domain.exceptions.ConfigNotFound;
import configstore.domain.exceptions.ConfigStoreFailure;
import configstore.domain.marshal.Marshallers;
import configstore.domain.store.Key;
import configstore.domain.store.Loader;
import configstore.domain.store.Opener;
import configstore.domain.store.SimpleStore;
import configstore.domain.store.Store;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.logging.Handler;
import java.util.logging.Level;
import java.util.logging.LogRecord;
import java.util.logging.Logger;

public class StoreTracerTest {
    private final List<String> messages = new ArrayList<>();
    private final Logger logger = Logger.getAnonymousLogger();

    @BeforeEach
    void captureLogs() {
        logger.setUseParentHandlers(false);
        logger.setLevel(Level.ALL);
        logger.addHandler(new Handler() {
            @Override
            public void publish(final LogRecord record) {
                messages.add(record.getMessage());
            }

            @Override
            public void flush() {
            }

            @Override
            public void close() {
            }
        });
    }

    @Test
    public void testDisabledReturnsTheStore() {
        final Store store = store();
        Assertions.assertSame(store, tracer(TraceSettings.disabled()).wrapStore("myapp", store));
    }

    @Test
    public void testTracedStoreIsTransparent() {
        final Store traced = tracer(new TraceSettings(true, false, List.of(), List.of())).wrapStore("myapp/prefs", store());
        Assertions.assertTrue(traced instanceof TracedStore);

        traced.marshal(new Key("k"), Map.of("secret", "hunter2"));
        Assertions.assertEquals("hunter2", traced.unmarshal(new Key("k"), Map.class).value().get("secret"));
        Assertions.assertEquals(List.of(new Key("k")), traced.list());
        traced.delete(new Key("k"));

        Assertions.assertTrue(messages.contains("config store myapp/prefs: Marshal(k)"));
        Assertions.assertTrue(messages.contains("config store myapp/prefs: Unmarshal(k)"));
        Assertions.assertTrue(messages.contains("config store myapp/prefs: List()"));
        Assertions.assertTrue(messages.contains("config store myapp/prefs: Delete(k)"));
        Assertions.assertTrue(messages.stream().anyMatch(message -> message.startsWith("config store myapp/prefs: Delete(k) ok after ")));
        Assertions.assertTrue(messages.stream().noneMatch(message -> message.contains("hunter2")));
    }

    @Test
    public void testFailuresAreRethrownUnchanged() {
        final Store traced = tracer(new TraceSettings(true, false, List.of(), List.of())).wrapStore("myapp", store());

        final ConfigNotFound failure = Assertions.assertThrows(ConfigNotFound.class, () -> traced.unmarshal(new Key("missing"), Map.class));
        Assertions.assertTrue(messages.stream().anyMatch(message ->
                message.startsWith("config store myapp: Unmarshal(missing) error after ") && message.endsWith(failure.getMessage())));
    }

    @Test
    public void testFailuresAreTheSameInstance() {
        final ConfigStoreFailure failure = new ConfigStoreFailure("disk on fire");
        final Store failing = new SimpleStore(new MemoryLoader() {
            @Override
            public byte[] read(final String name) {
                throw failure;
            }

            @Override
            public void delete(final String name) {
                throw failure;
            }
        }, Marshallers.JSON);
        final Store traced = tracer(new TraceSettings(true, false, List.of(), List.of())).wrapStore("myapp", failing);

        Assertions.assertSame(failure, Assertions.assertThrows(ConfigStoreFailure.class, () -> traced.unmarshal(new Key("k"), Map.class)));
        Assertions.assertSame(failure, Assertions.assertThrows(ConfigStoreFailure.class, () -> traced.delete(new Key("k"))));
        Assertions.assertSame(
                Assertions.assertThrows(ConfigStoreFailure.class, () -> failing.unmarshal(new Key("k"), Map.class)),
                Assertions.assertThrows(ConfigStoreFailure.class, () -> traced.unmarshal(new Key("k"), Map.class)));
    }

    @Test
    public void testResponsesAreLoggedWhenAsked() {
        final Store traced = tracer(new TraceSettings(false, true, List.of(), List.of())).wrapStore("myapp", store());

        traced.marshal(new Key("k"), Map.of("colour", "blue"));
        traced.unmarshal(new Key("k"), Map.class);

        Assertions.assertEquals("config store myapp: Marshal(k)", messages.get(0));
        Assertions.assertEquals("config store myapp: Marshal(k) value={colour=blue}", messages.get(1));
        Assertions.assertTrue(messages.get(2).startsWith("config store myapp: Marshal(k) ok after "));
        Assertions.assertTrue(messages.stream().anyMatch(message -> message.contains("-> k = {colour=blue}")));
    }

    @Test
    public void testIncludeAndExclude() {
        final TraceSettings settings = new TraceSettings(true, false, List.of("myapp"), List.of("myapp/secrets"));

        Assertions.assertTrue(settings.enabledFor("myapp/prefs"));
        Assertions.assertFalse(settings.enabledFor("myapp/secrets/keys"));
        Assertions.assertFalse(settings.enabledFor("otherapp"));
        Assertions.assertTrue(new TraceSettings(true, false, List.of(), List.of()).enabledFor("anything"));
        Assertions.assertFalse(new TraceSettings(false, false, List.of("myapp"), List.of()).enabledFor("myapp"));
    }

    @Test
    public void testWrapOpener() {
        final Store store = store();
        final Opener opener = (app, namespace) -> store;
        final StoreTracer tracer = tracer(new TraceSettings(true, false, List.of("myapp/prefs"), List.of()));

        final Store traced = tracer.wrapOpener(opener).open("myapp", "prefs");
        traced.list();

        Assertions.assertTrue(messages.contains("config store myapp/prefs: List()"));
        Assertions.assertSame(store, tracer.wrapOpener(opener).open("myapp", "other"));
    }

    private StoreTracer tracer(final TraceSettings settings) {
        return new StoreTracer(settings, logger, new LoggingExceptionHandler(false));
    }

    private static Store store() {
        return new SimpleStore(new MemoryLoader(), Marshallers.JSON);
    }

    private static class MemoryLoader implements Loader {
        private final Map<String, byte[]> entries = new TreeMap<>();

        @Override
        public List<String> list() {
            return List.copyOf(entries.keySet());
        }

        @Override
        public byte[] read(final String name) {
            if (!entries.containsKey(name)) {
                throw new ConfigNotFound(name + " not found");
            }
            return entries.get(name);
        }

        @Override
        public void write(final String name, final byte[] data) {
            entries.put(name, data);
        }

        @Override
        public void delete(final String name) {
            if (entries.remove(name) == null) {
                throw new ConfigNotFound(name + " not found");
            }
        }

        @Override
        public String describe() {
            return "memory";
        }
    }
}
