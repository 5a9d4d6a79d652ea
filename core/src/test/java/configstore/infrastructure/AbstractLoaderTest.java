package configstore.infrastructure;

import configstore.domain.exceptions.ConfigNotFound;
import configstore.domain.marshal.Marshallers;
import configstore.domain.store.Key;
import configstore.domain.store.Loader;
import configstore.domain.store.Scope;
import configstore.domain.store.SimpleStore;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Behaviour every backend shares. Subclasses supply a loader for a scope.
 */
public abstract class AbstractLoaderTest {
    protected abstract Loader open(Scope scope);

    private Loader loader() {
        return open(Scope.of("myapp", "testns"));
    }

    @Test
    public void testEmpty() {
        Assertions.assertTrue(loader().list().isEmpty());
    }

    @Test
    public void testWriteRead() {
        final Loader loader = loader();
        loader.write("first.json", bytes("{\"a\":1}"));
        loader.write("second.json", bytes("{\"b\":2}"));

        Assertions.assertArrayEquals(bytes("{\"a\":1}"), loader.read("first.json"));
        Assertions.assertEquals(Set.of("first.json", "second.json"), new HashSet<>(loader.list()));
    }

    @Test
    public void testOverwrite() {
        final Loader loader = loader();
        loader.write("k.json", bytes("old"));
        loader.write("k.json", bytes("new"));

        Assertions.assertArrayEquals(bytes("new"), loader.read("k.json"));
        Assertions.assertEquals(List.of("k.json"), loader.list());
    }

    @Test
    public void testBinaryAndEmptyPayloads() {
        final byte[] binary = new byte[256];
        for (int i = 0; i < binary.length; i++) {
            binary[i] = (byte) i;
        }

        final Loader loader = loader();
        loader.write("binary.cbor", binary);
        loader.write("empty.json", new byte[0]);

        Assertions.assertArrayEquals(binary, loader.read("binary.cbor"));
        Assertions.assertArrayEquals(new byte[0], loader.read("empty.json"));
    }

    @Test
    public void testMissing() {
        final Loader loader = loader();
        Assertions.assertThrows(ConfigNotFound.class, () -> loader.read("missing.json"));
        Assertions.assertThrows(ConfigNotFound.class, () -> loader.delete("missing.json"));
    }

    @Test
    public void testDelete() {
        final Loader loader = loader();
        loader.write("k.json", bytes("v"));
        loader.delete("k.json");

        Assertions.assertTrue(loader.list().isEmpty());
        Assertions.assertThrows(ConfigNotFound.class, () -> loader.read("k.json"));
        Assertions.assertThrows(ConfigNotFound.class, () -> loader.delete("k.json"));
    }

    @Test
    public void testScopesAreIsolated() {
        final Loader first = open(Scope.of("myapp", "testns"));
        final Loader second = open(Scope.of("myapp", "otherns"));
        final Loader nested = open(Scope.of("myapp", "testns", "nested"));

        first.write("shared.json", bytes("first"));
        second.write("shared.json", bytes("second"));

        Assertions.assertArrayEquals(bytes("first"), first.read("shared.json"));
        Assertions.assertArrayEquals(bytes("second"), second.read("shared.json"));
        Assertions.assertTrue(nested.list().isEmpty());
        Assertions.assertThrows(ConfigNotFound.class, () -> nested.read("shared.json"));

        second.delete("shared.json");
        Assertions.assertArrayEquals(bytes("first"), first.read("shared.json"));
    }

    @Test
    public void testEncodedNames() {
        final Loader loader = loader();
        loader.write("a%2Fb%25.toml", bytes("x"));
        loader.write("with space.toml", bytes("y"));

        Assertions.assertEquals(Set.of("a%2Fb%25.toml", "with space.toml"), new HashSet<>(loader.list()));
        Assertions.assertArrayEquals(bytes("x"), loader.read("a%2Fb%25.toml"));
    }

    @Test
    public void testStore() {
        final SimpleStore store = new SimpleStore(loader(), Marshallers.JSON);
        store.marshal(new Key("a/b"), Map.of("answer", 42));

        Assertions.assertEquals(List.of(new Key("a/b")), store.list());
        Assertions.assertEquals(42, store.unmarshal(new Key("a/b"), Map.class).value().get("answer"));
    }

    @Test
    public void testDescribe() {
        Assertions.assertFalse(loader().describe().isBlank());
    }

    protected static byte[] bytes(final String value) {
        return value.getBytes(StandardCharsets.UTF_8);
    }
}
