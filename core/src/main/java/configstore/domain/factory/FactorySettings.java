package configstore.domain.factory;

import configstore.infrastructure.datastore.DatastoreSettings;
import configstore.infrastructure.directory.ConfigDirectories;
import configstore.infrastructure.embedded.EmbeddedSettings;
import configstore.infrastructure.sqlite.SqliteSettings;

import java.nio.file.Path;

import static com.google.common.base.Preconditions.checkNotNull;

/**
 * Everything a {@link StoreFactory} needs. Only the settings of the selected backend are used.
 *
 * @param configRoot Where files go when a backend has no explicit path
 */
public record FactorySettings(
        StoreBackend backend,
        Path configRoot,
        DirectorySettings directory,
        SqliteSettings sqlite,
        EmbeddedSettings embedded,
        DatastoreSettings datastore) {

    public FactorySettings {
        checkNotNull(backend);
        checkNotNull(configRoot);
        checkNotNull(directory);
        checkNotNull(sqlite);
        checkNotNull(embedded);
        checkNotNull(datastore);
    }

    public static FactorySettings defaults() {
        return defaults(ConfigDirectories.userConfigDirectory());
    }

    public static FactorySettings defaults(final Path configRoot) {
        return new FactorySettings(
                StoreBackend.DIRECTORY,
                configRoot,
                DirectorySettings.defaults(),
                SqliteSettings.defaults(),
                EmbeddedSettings.defaults(),
                DatastoreSettings.defaults());
    }

    public FactorySettings withBackend(final StoreBackend newBackend) {
        return new FactorySettings(newBackend, configRoot, directory, sqlite, embedded, datastore);
    }

    public FactorySettings withDirectory(final DirectorySettings newDirectory) {
        return new FactorySettings(backend, configRoot, newDirectory, sqlite, embedded, datastore);
    }

    public FactorySettings withSqlite(final SqliteSettings newSqlite) {
        return new FactorySettings(backend, configRoot, directory, newSqlite, embedded, datastore);
    }

    public FactorySettings withEmbedded(final EmbeddedSettings newEmbedded) {
        return new FactorySettings(backend, configRoot, directory, sqlite, newEmbedded, datastore);
    }

    public FactorySettings withDatastore(final DatastoreSettings newDatastore) {
        return new FactorySettings(backend, configRoot, directory, sqlite, embedded, newDatastore);
    }
}
