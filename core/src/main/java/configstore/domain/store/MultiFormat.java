package configstore.domain.store;

import configstore.domain.exceptions.AggregateFailure;
import configstore.domain.exceptions.ConfigNotFound;
import configstore.domain.exceptions.ConfigUsageError;
import configstore.domain.marshal.Marshaller;
import configstore.domain.marshal.Marshallers;
import io.vavr.control.Try;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import static com.google.common.base.Preconditions.checkNotNull;

/**
 * A store that understands several formats at once. The first format in the list is the preferred one.
 * <p>
 * For example:
 * <pre>
 * store.marshal(new Key("config"), config);
 * store.marshal(new FormatKey("config", Marshallers.JSON), config);
 * </pre>
 * creates "config.toml" (the preferred format) and "config.json". {@link #list()} returns both, as two
 * {@link FormatKey} descriptors. Unmarshalling {@code new Key("config")} reads "config.toml" because TOML comes
 * first, even if "config.json" was written more recently. Writing a bare key never touches the other formats, so
 * callers that write several formats explicitly keep them consistent themselves.
 */
public class MultiFormat implements Store {
    private final Loader loader;
    private final List<Marshaller> marshallers;
    private final KeyCodec keyCodec;

    public MultiFormat(final Loader loader) {
        this(loader, Marshallers.KNOWN);
    }

    public MultiFormat(final Loader loader, final List<Marshaller> marshallers) {
        this(loader, marshallers, KeyCodec.percent());
    }

    /**
     * @param marshallers The formats in order of preference. An empty list means {@link Marshallers#KNOWN}
     */
    public MultiFormat(final Loader loader, final List<Marshaller> marshallers, final KeyCodec keyCodec) {
        this.loader = checkNotNull(loader);
        this.marshallers = checkNotNull(marshallers).isEmpty() ? Marshallers.KNOWN : List.copyOf(marshallers);
        this.keyCodec = checkNotNull(keyCodec);
    }

    public List<Marshaller> getMarshallers() {
        return marshallers;
    }

    /**
     * Returns one descriptor per stored name. A key stored in three formats is listed three times, once per format.
     * Names with an unrecognized extension are returned as a {@link Key} of the whole decoded name, which
     * {@link #unmarshal(Descriptor, Class)} and {@link #delete(Descriptor)} resolve back to that stored name.
     */
    @Override
    public List<Descriptor> list() {
        return loader.list().stream()
                .map(this::descriptorForPath)
                .toList();
    }

    @Override
    public void marshal(final Descriptor descriptor, final Object value) {
        final Marshaller pinned = formatOf(descriptor, "marshal");
        final Marshaller marshaller = pinned == null ? marshallers.get(0) : pinned;
        final String name = pathForKey(descriptor.key(), marshaller);
        loader.write(name, Payloads.encode(marshaller, value, name, loader));
    }

    /**
     * A {@link Key} is looked up in every format, in order of preference, and the first one that can be read wins.
     * If no format exists, an entry stored under the bare encoded key, without an extension, is read instead, decoded
     * by the first format that accepts it. Otherwise the failure of the last attempt is thrown: {@link ConfigNotFound}
     * when the key does not exist at all.
     */
    @Override
    public <T> Loaded<T> unmarshal(final Descriptor descriptor, final Class<T> type) {
        final Marshaller marshaller = formatOf(descriptor, "unmarshal");
        if (marshaller != null) {
            return load(descriptor.key(), marshaller, type);
        }

        Try<Loaded<T>> result = Try.failure(new ConfigNotFound("No format of " + descriptor.key() + " in " + loader.describe()));
        for (final Marshaller candidate : marshallers) {
            result = Try.of(() -> load(descriptor.key(), candidate, type));
            if (result.isSuccess()) {
                break;
            }
        }

        if (result.isFailure() && result.getCause() instanceof ConfigNotFound) {
            final Optional<String> unformatted = unformattedName(descriptor.key());
            if (unformatted.isPresent()) {
                final Try<Loaded<T>> stored = Try.of(() -> loadUnformatted(descriptor.key(), unformatted.get(), type));
                if (!(stored.isFailure() && stored.getCause() instanceof ConfigNotFound)) {
                    result = stored;
                }
            }
        }
        return result.get();
    }

    /**
     * A {@link FormatKey} deletes that one format. A {@link Key} deletes the key in every known format: it succeeds
     * if at least one format existed, and fails with {@link ConfigNotFound} only if none did. An entry stored under the
     * bare encoded key, without an extension, counts as one more format. Other failures are
     * rethrown, combined in an {@link AggregateFailure} when there are several.
     */
    @Override
    public void delete(final Descriptor descriptor) {
        final Marshaller marshaller = formatOf(descriptor, "delete");
        if (marshaller != null) {
            loader.delete(pathForKey(descriptor.key(), marshaller));
            return;
        }

        final List<String> names = new ArrayList<>();
        marshallers.forEach(candidate -> names.add(pathForKey(descriptor.key(), candidate)));
        unformattedName(descriptor.key()).ifPresent(names::add);

        int missing = 0;
        final List<Throwable> failures = new ArrayList<>();
        for (final String name : names) {
            final Try<Void> result = Try.run(() -> loader.delete(name));
            if (result.isFailure() && result.getCause() instanceof ConfigNotFound) {
                missing++;
            } else if (result.isFailure()) {
                failures.add(result.getCause());
            }
        }

        if (missing == names.size()) {
            throw new ConfigNotFound("No format of " + descriptor.key() + " in " + loader.describe());
        }
        if (failures.size() == 1) {
            Try.failure(failures.get(0)).get();
        }
        if (failures.size() > 1) {
            throw new AggregateFailure(failures);
        }
    }

    @Override
    public String toString() {
        return "MultiFormat(" + marshallers + ", " + loader.describe() + ")";
    }

    String pathForKey(final String key, final Marshaller marshaller) {
        return keyCodec.encode(key) + "." + marshaller.extension();
    }

    private <T> Loaded<T> load(final String key, final Marshaller marshaller, final Class<T> type) {
        final String name = pathForKey(key, marshaller);
        final byte[] data = loader.read(name);
        return new Loaded<>(new FormatKey(key, marshaller), Payloads.decode(marshaller, data, type, name, loader));
    }

    /**
     * The stored name of a key written without an extension. Names ending in a known extension belong to that format
     * and have none.
     */
    private Optional<String> unformattedName(final String key) {
        final String encoded = keyCodec.encode(key);
        return Marshallers.byExtension(marshallers, encoded).isPresent()
                ? Optional.empty()
                : Optional.of(encoded);
    }

    private <T> Loaded<T> loadUnformatted(final String key, final String name, final Class<T> type) {
        final byte[] data = loader.read(name);
        Try<T> decoded = Try.failure(new ConfigUsageError("MultiFormat has no formats to decode " + name));
        for (final Marshaller candidate : marshallers) {
            decoded = Try.of(() -> Payloads.decode(candidate, data, type, name, loader));
            if (decoded.isSuccess()) {
                break;
            }
        }
        return new Loaded<>(new Key(key), decoded.get());
    }

    private Descriptor descriptorForPath(final String name) {
        return Marshallers.byExtension(marshallers, name)
                .<Descriptor>map(marshaller -> new FormatKey(
                        keyCodec.decode(name.substring(0, name.length() - marshaller.extension().length() - 1)),
                        marshaller))
                .orElseGet(() -> new Key(keyCodec.decode(name)));
    }

    /**
     * Returns the pinned format of a {@link FormatKey}, or null for a {@link Key}.
     */
    private Marshaller formatOf(final Descriptor descriptor, final String operation) {
        if (descriptor == null) {
            throw new ConfigUsageError("MultiFormat." + operation + " must be passed a non-null descriptor");
        }
        if (descriptor instanceof FormatKey formatKey) {
            return formatKey.format();
        }
        if (descriptor instanceof Key) {
            return null;
        }
        throw new ConfigUsageError("MultiFormat." + operation + " passed an unknown descriptor type - " + descriptor.getClass().getName());
    }
}
