package configstore.infrastructure.embedded;

import configstore.domain.exceptionhandling.LoaderExceptionMapping;
import configstore.domain.exceptions.ConfigNotFound;
import configstore.domain.store.Loader;
import io.vavr.control.Try;
import org.h2.mvstore.MVMap;
import org.h2.mvstore.MVStore;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static com.google.common.base.Preconditions.checkNotNull;

/**
 * The entries of one scope, held in a map named after the scope. The map is created the first time the scope
 * is opened. Every change is committed before the call returns.
 */
public class EmbeddedLoader implements Loader {
    private final MVStore store;
    private final Path path;
    private final String scope;
    private final MVMap<String, byte[]> entries;
    private final LoaderExceptionMapping exceptionMapping;

    public EmbeddedLoader(final MVStore store, final Path path, final String scope) {
        this.store = checkNotNull(store);
        this.path = checkNotNull(path);
        this.scope = checkNotNull(scope);
        this.exceptionMapping = new LoaderExceptionMapping(describe(), ex -> false, ex -> false);
        this.entries = exceptionMapping.get(Try.of(() -> store.<String, byte[]>openMap(scope)), "open", scope);
    }

    /**
     * Entries without a value are skipped.
     */
    @Override
    public List<String> list() {
        return exceptionMapping.get(
                Try.of(() -> entries.entrySet().stream()
                        .filter(entry -> entry.getValue() != null)
                        .map(Map.Entry::getKey)
                        .toList()),
                "list",
                scope);
    }

    @Override
    public byte[] read(final String name) {
        final byte[] data = exceptionMapping.get(Try.of(() -> entries.get(name)), "read", name);
        if (data == null) {
            throw new ConfigNotFound(name + " not found in " + describe());
        }
        return data.clone();
    }

    @Override
    public void write(final String name, final byte[] data) {
        exceptionMapping.get(
                Try.run(() -> {
                    entries.put(name, data.clone());
                    store.commit();
                }),
                "write",
                name);
    }

    @Override
    public void delete(final String name) {
        final byte[] previous = exceptionMapping.get(
                Try.of(() -> {
                    final byte[] removed = entries.remove(name);
                    if (removed != null) {
                        store.commit();
                    }
                    return removed;
                }),
                "delete",
                name);

        if (previous == null) {
            throw new ConfigNotFound(name + " not found in " + describe());
        }
    }

    @Override
    public String describe() {
        return "embedded " + path + " scope " + scope;
    }
}
