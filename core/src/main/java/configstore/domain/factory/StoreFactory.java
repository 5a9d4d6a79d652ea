package configstore.domain.factory;

import configstore.domain.exceptions.AggregateFailure;
import configstore.domain.exceptions.ConfigUsageError;
import configstore.domain.marshal.Marshaller;
import configstore.domain.marshal.Marshallers;
import configstore.domain.store.Backend;
import configstore.domain.store.Loader;
import configstore.domain.store.MultiFormat;
import configstore.domain.store.Opener;
import configstore.domain.store.Scope;
import configstore.domain.store.SimpleStore;
import configstore.domain.store.Store;
import configstore.infrastructure.datastore.DatastoreDatabase;
import configstore.infrastructure.directory.ConfigDirectories;
import configstore.infrastructure.directory.DirectoryBackend;
import configstore.infrastructure.embedded.EmbeddedDatabase;
import configstore.infrastructure.embedded.EmbeddedSettings;
import configstore.infrastructure.sqlite.SqliteDatabase;
import configstore.infrastructure.sqlite.SqliteSettings;
import io.vavr.control.Try;
import org.jspecify.annotations.Nullable;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Function;
import java.util.logging.Logger;

import static com.google.common.base.Preconditions.checkNotNull;

/**
 * Turns {@link FactorySettings} into an {@link Opener}. The settings are fully validated by the time the factory
 * exists, so a bad backend, mode or format never surfaces on the first open.
 * <p>
 * SQLite and embedded databases are opened on first use and shared by every store that maps to the same file.
 * Closing the factory closes them.
 */
public class StoreFactory implements AutoCloseable {
    private static final Logger logger = Logger.getLogger(StoreFactory.class.getName());

    private final FactorySettings settings;
    private final Map<Path, Backend> databases = new HashMap<>();
    private final AtomicBoolean closed = new AtomicBoolean(false);
    @Nullable
    private final DirectoryBackend directory;
    @Nullable
    private final DatastoreDatabase datastore;

    public StoreFactory(final FactorySettings settings) {
        this.settings = checkNotNull(settings);

        this.directory = settings.backend() == StoreBackend.DIRECTORY
                ? new DirectoryBackend(settings.directory().path() == null
                ? settings.configRoot()
                : Paths.get(settings.directory().path()))
                : null;

        this.datastore = settings.backend() == StoreBackend.DATASTORE
                ? DatastoreDatabase.connect(settings.datastore())
                : null;

        logger.fine("Config stores use the " + settings.backend() + " backend");
    }

    public FactorySettings getSettings() {
        return settings;
    }

    public Opener opener() {
        return this::open;
    }

    public Store open(final String app, final String... namespace) {
        checkOpen();

        final Scope scope = Scope.of(app, namespace);
        final StoreBackend backend = settings.backend();

        if (backend == StoreBackend.DIRECTORY) {
            final Loader loader = checkNotNull(directory).loader(scope);
            final Marshaller format = settings.directory().formatOrDefault();
            if (settings.directory().mode() == DirectoryMode.MULTI) {
                return new MultiFormat(loader, Marshallers.preferring(format, Marshallers.KNOWN));
            }
            return new SimpleStore(loader, format);
        }

        if (backend == StoreBackend.SQLITE) {
            return SimpleStore.unencoded(sqlite(scope).loader(scope), Marshallers.JSON);
        }

        if (backend == StoreBackend.SQLITE_MULTI) {
            return new MultiFormat(sqlite(scope).loader(scope));
        }

        if (backend == StoreBackend.EMBEDDED) {
            return new SimpleStore(embedded(scope).loader(scope), Marshallers.JSON);
        }

        return new SimpleStore(checkNotNull(datastore).loader(scope), Marshallers.JSON);
    }

    /**
     * Closes every database opened so far. All of them are closed even when some fail.
     */
    @Override
    public void close() {
        final List<Throwable> failures = new ArrayList<>();
        synchronized (databases) {
            if (!closed.compareAndSet(false, true)) {
                return;
            }

            databases.forEach((path, database) -> Try.run(database::close)
                    .onFailure(ex -> logger.warning("Failed to close " + path + ": " + ex.getMessage()))
                    .onFailure(failures::add));
            databases.clear();
        }

        if (datastore != null) {
            Try.run(datastore::close).onFailure(failures::add);
        }

        if (failures.size() == 1) {
            Try.failure(failures.get(0)).get();
        }
        if (failures.size() > 1) {
            throw new AggregateFailure(failures);
        }
    }

    private Backend sqlite(final Scope scope) {
        final SqliteSettings sqlite = settings.sqlite();
        final Path path = databasePath(sqlite.path(), scope, SqliteSettings.DEFAULT_FILE_NAME);
        return database(path, key -> SqliteDatabase.open(key, sqlite));
    }

    private Backend embedded(final Scope scope) {
        final EmbeddedSettings embedded = settings.embedded();
        final Path path = databasePath(embedded.path(), scope, EmbeddedSettings.DEFAULT_FILE_NAME);
        return database(path, key -> EmbeddedDatabase.open(key, embedded));
    }

    /**
     * Opens and registers databases under the same lock that {@link #close()} holds, so a database is never opened
     * after the factory was closed.
     */
    private Backend database(final Path path, final Function<Path, Backend> open) {
        synchronized (databases) {
            checkOpen();
            return databases.computeIfAbsent(path, open);
        }
    }

    private void checkOpen() {
        if (closed.get()) {
            throw new ConfigUsageError("The config store factory has been closed");
        }
    }

    int openDatabases() {
        synchronized (databases) {
            return databases.size();
        }
    }

    /**
     * An explicit path is shared by every scope. Without one each scope gets its own file in its directory.
     */
    private Path databasePath(@Nullable final String configured, final Scope scope, final String fileName) {
        final Path path = configured == null
                ? ConfigDirectories.forScope(settings.configRoot(), scope).resolve(fileName)
                : Paths.get(configured);
        return path.toAbsolutePath().normalize();
    }
}
