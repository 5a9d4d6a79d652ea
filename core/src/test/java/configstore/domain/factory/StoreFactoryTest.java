package configstore.domain.factory;

import configstore.domain.exceptions.ConfigUsageError;
import configstore.domain.marshal.Marshallers;
import configstore.domain.store.FormatKey;
import configstore.domain.store.Key;
import configstore.domain.store.MultiFormat;
import configstore.domain.store.Opener;
import configstore.domain.store.SimpleStore;
import configstore.domain.store.Store;
import configstore.infrastructure.embedded.EmbeddedSettings;
import configstore.infrastructure.sqlite.SqliteSettings;
import io.vavr.control.Try;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

public class StoreFactoryTest {
    @TempDir
    Path root;

    @Test
    public void testDirectoryStore() {
        try (StoreFactory factory = new StoreFactory(FactorySettings.defaults(root)
                .withDirectory(new DirectorySettings(root.resolve("custom").toString(), DirectoryMode.SIMPLE, null)))) {
            final Opener opener = factory.opener();
            final Store store = opener.open("myapp", "testns");
            Assertions.assertTrue(store instanceof SimpleStore);

            store.marshal(new Key("test-key"), Map.of("value", "test-value"));

            Assertions.assertTrue(Files.isRegularFile(root.resolve("custom").resolve("myapp").resolve("testns").resolve("test-key.toml")));
            Assertions.assertEquals("test-value", store.unmarshal(new Key("test-key"), Map.class).value().get("value"));
        }
    }

    @Test
    public void testDirectoryDefaultsToTheConfigRoot() {
        try (StoreFactory factory = new StoreFactory(FactorySettings.defaults(root))) {
            factory.open("myapp").marshal(new Key("k"), Map.of("a", "b"));
            Assertions.assertTrue(Files.isRegularFile(root.resolve("myapp").resolve("k.toml")));
        }
    }

    @Test
    public void testDirectoryFormat() {
        try (StoreFactory factory = new StoreFactory(FactorySettings.defaults(root)
                .withDirectory(DirectorySettings.parse(null, "simple", "yaml")))) {
            factory.open("myapp").marshal(new Key("k"), Map.of("a", "b"));
            Assertions.assertTrue(Files.isRegularFile(root.resolve("myapp").resolve("k.yaml")));
        }
    }

    @Test
    public void testDirectoryMultiModePrefersTheConfiguredFormat() {
        try (StoreFactory factory = new StoreFactory(FactorySettings.defaults(root)
                .withDirectory(DirectorySettings.parse(null, "multi", "json")))) {
            final Store store = factory.open("myapp");
            Assertions.assertTrue(store instanceof MultiFormat);
            Assertions.assertEquals(Marshallers.JSON, ((MultiFormat) store).getMarshallers().get(0));

            store.marshal(new Key("k"), Map.of("a", "b"));
            Assertions.assertEquals(List.of(new FormatKey("k", Marshallers.JSON)), store.list());
        }
    }

    @Test
    public void testUnknownValuesFailFast() {
        Assertions.assertThrows(ConfigUsageError.class, () -> StoreBackend.fromSelector("floppy"));
        Assertions.assertThrows(ConfigUsageError.class, () -> DirectorySettings.parse(null, "sideways", null));
        Assertions.assertThrows(ConfigUsageError.class, () -> DirectorySettings.parse(null, "simple", "gob"));

        final ConfigUsageError error = Assertions.assertThrows(ConfigUsageError.class, () -> StoreBackend.fromSelector("floppy"));
        Assertions.assertEquals("unknown config store type: floppy", error.getMessage());
    }

    @Test
    public void testSelectors() {
        Assertions.assertEquals(StoreBackend.SQLITE_MULTI, StoreBackend.fromSelector("sqlite-multi"));
        Assertions.assertEquals(StoreBackend.DIRECTORY, StoreBackend.fromSelector(" Directory "));
        Assertions.assertEquals(DirectoryMode.MULTI, DirectoryMode.fromName("MULTI"));
    }

    @Test
    public void testSqliteSharesOneDatabase() {
        final Path database = root.resolve("shared.db");
        try (StoreFactory factory = new StoreFactory(FactorySettings.defaults(root)
                .withBackend(StoreBackend.SQLITE)
                .withSqlite(SqliteSettings.defaults().withPath(database.toString())))) {
            final Store first = factory.open("myapp", "testns");
            final Store second = factory.open("myapp", "other");

            first.marshal(new Key("config"), Map.of("value", "hello"));
            Assertions.assertEquals("hello", factory.open("myapp", "testns").unmarshal(new Key("config"), Map.class).value().get("value"));
            Assertions.assertTrue(second.list().isEmpty());
            Assertions.assertTrue(Files.exists(database));
        }
    }

    @Test
    public void testSqliteDefaultPath() {
        try (StoreFactory factory = new StoreFactory(FactorySettings.defaults(root).withBackend(StoreBackend.SQLITE))) {
            factory.open("myapp", "testns").marshal(new Key("config"), Map.of("value", "hello"));
            Assertions.assertTrue(Files.exists(root.resolve("myapp").resolve("testns").resolve(SqliteSettings.DEFAULT_FILE_NAME)));
        }
    }

    @Test
    public void testSqliteMulti() {
        try (StoreFactory factory = new StoreFactory(FactorySettings.defaults(root).withBackend(StoreBackend.SQLITE_MULTI))) {
            final Store store = factory.open("myapp");
            store.marshal(new FormatKey("config", Marshallers.YAML), Map.of("value", "hello"));

            Assertions.assertTrue(store instanceof MultiFormat);
            Assertions.assertEquals(List.of(new FormatKey("config", Marshallers.YAML)), store.list());
        }
    }

    @Test
    public void testEmbedded() {
        final Path file = root.resolve("kv").resolve("config.mv.db");
        try (StoreFactory factory = new StoreFactory(FactorySettings.defaults(root)
                .withBackend(StoreBackend.EMBEDDED)
                .withEmbedded(EmbeddedSettings.defaults().withPath(file.toString())))) {
            factory.open("myapp", "a").marshal(new Key("k"), Map.of("value", "1"));
            factory.open("myapp", "b").marshal(new Key("k"), Map.of("value", "2"));

            Assertions.assertEquals("1", factory.open("myapp", "a").unmarshal(new Key("k"), Map.class).value().get("value"));
            Assertions.assertTrue(Files.exists(file));
        }
    }

    @Test
    public void testClosedFactoryRefusesToOpen() {
        final StoreFactory factory = new StoreFactory(FactorySettings.defaults(root).withBackend(StoreBackend.SQLITE));
        factory.open("myapp");
        factory.close();
        factory.close();

        Assertions.assertThrows(ConfigUsageError.class, () -> factory.open("myapp"));
    }

    @Test
    public void testCloseWhileOpeningLeavesNoDatabaseOpen() throws Exception {
        final StoreFactory factory = new StoreFactory(FactorySettings.defaults(root).withBackend(StoreBackend.SQLITE));
        final ExecutorService executor = Executors.newFixedThreadPool(4);
        try {
            final List<Future<?>> opens = new ArrayList<>();
            for (int i = 0; i < 16; i++) {
                final String namespace = "ns" + i;
                opens.add(executor.submit(() -> Try.run(() -> factory.open("myapp", namespace))
                        .recover(ConfigUsageError.class, ex -> null)
                        .get()));
            }
            factory.close();

            for (final Future<?> open : opens) {
                open.get(30, TimeUnit.SECONDS);
            }
        } finally {
            executor.shutdownNow();
        }

        Assertions.assertEquals(0, factory.openDatabases());
        Assertions.assertThrows(ConfigUsageError.class, () -> factory.open("myapp", "late"));
    }

    @Test
    public void testInvalidScope() {
        try (StoreFactory factory = new StoreFactory(FactorySettings.defaults(root))) {
            Assertions.assertThrows(ConfigUsageError.class, () -> factory.open("myapp", ".."));
        }
    }
}
