package configstore.domain.factory.config;

import configstore.domain.factory.FactorySettings;
import configstore.domain.factory.StoreBackend;
import configstore.infrastructure.directory.ConfigDirectories;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.eclipse.microprofile.config.inject.ConfigProperty;

/**
 * Collects the settings of every backend. Unknown selector, mode, format and pragma values fail here.
 */
@ApplicationScoped
public class FactoryConfig {
    @Inject
    @ConfigProperty(name = "cs.store.backend", defaultValue = "directory")
    private String backend;

    @Inject
    private DirectoryStoreConfig directoryStoreConfig;

    @Inject
    private SqliteStoreConfig sqliteStoreConfig;

    @Inject
    private EmbeddedStoreConfig embeddedStoreConfig;

    @Inject
    private DatastoreStoreConfig datastoreStoreConfig;

    public FactorySettings getSettings() {
        return new FactorySettings(
                StoreBackend.fromSelector(backend),
                ConfigDirectories.userConfigDirectory(),
                directoryStoreConfig.getSettings(),
                sqliteStoreConfig.getSettings(),
                embeddedStoreConfig.getSettings(),
                datastoreStoreConfig.getSettings());
    }
}
