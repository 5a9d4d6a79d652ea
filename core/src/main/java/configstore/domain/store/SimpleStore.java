package configstore.domain.store;

import configstore.domain.exceptions.ConfigUsageError;
import configstore.domain.marshal.Marshaller;

import java.util.List;

import static com.google.common.base.Preconditions.checkNotNull;

/**
 * A store with a single format, fixed at construction. Entries are stored as the encoded key followed by the
 * format's extension, e.g. "a/b%" in TOML becomes "a%2Fb%25.toml".
 */
public class SimpleStore implements Store {
    private final Loader loader;
    private final Marshaller marshaller;
    private final KeyCodec keyCodec;
    private final boolean appendExtension;

    public SimpleStore(final Loader loader, final Marshaller marshaller) {
        this(loader, marshaller, KeyCodec.percent());
    }

    public SimpleStore(final Loader loader, final Marshaller marshaller, final KeyCodec keyCodec) {
        this(loader, marshaller, keyCodec, true);
    }

    private SimpleStore(final Loader loader, final Marshaller marshaller, final KeyCodec keyCodec, final boolean appendExtension) {
        this.loader = checkNotNull(loader);
        this.marshaller = checkNotNull(marshaller);
        this.keyCodec = checkNotNull(keyCodec);
        this.appendExtension = appendExtension;
    }

    /**
     * A store that uses keys as stored names without encoding them or adding an extension. Backends with a name
     * column, like SQLite, can hold any key as is.
     */
    public static SimpleStore unencoded(final Loader loader, final Marshaller marshaller) {
        return new SimpleStore(loader, marshaller, KeyCodec.verbatim(), false);
    }

    @Override
    public List<Descriptor> list() {
        return loader.list().stream()
                .<Descriptor>map(name -> new Key(keyForPath(name)))
                .toList();
    }

    @Override
    public void marshal(final Descriptor descriptor, final Object value) {
        final String name = pathForKey(keyOf(descriptor, "marshal"));
        loader.write(name, Payloads.encode(marshaller, value, name, loader));
    }

    @Override
    public <T> Loaded<T> unmarshal(final Descriptor descriptor, final Class<T> type) {
        final String key = keyOf(descriptor, "unmarshal");
        final String name = pathForKey(key);
        final byte[] data = loader.read(name);
        return new Loaded<>(new Key(key), Payloads.decode(marshaller, data, type, name, loader));
    }

    @Override
    public void delete(final Descriptor descriptor) {
        loader.delete(pathForKey(keyOf(descriptor, "delete")));
    }

    @Override
    public String toString() {
        return "SimpleStore(" + marshaller.name() + ", " + loader.describe() + ")";
    }

    String pathForKey(final String key) {
        final String encoded = keyCodec.encode(key);
        return appendExtension ? encoded + "." + marshaller.extension() : encoded;
    }

    /**
     * Names without the extension are still accepted, in case they were written by something else.
     */
    String keyForPath(final String name) {
        final String suffix = "." + marshaller.extension();
        final String stripped = appendExtension && name.endsWith(suffix)
                ? name.substring(0, name.length() - suffix.length())
                : name;
        return keyCodec.decode(stripped);
    }

    private String keyOf(final Descriptor descriptor, final String operation) {
        if (descriptor == null) {
            throw new ConfigUsageError("SimpleStore." + operation + " must be passed a non-null descriptor");
        }
        if (descriptor instanceof FormatKey formatKey && formatKey.format() != marshaller) {
            throw new ConfigUsageError("SimpleStore." + operation + " was passed format " + formatKey.format().name()
                    + " but only supports " + marshaller.name());
        }
        return descriptor.key();
    }
}
