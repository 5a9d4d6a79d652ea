package configstore.domain.factory.config;

import configstore.infrastructure.datastore.DatastoreSettings;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.eclipse.microprofile.config.inject.ConfigProperty;

import java.util.Optional;

@ApplicationScoped
public class DatastoreStoreConfig {
    @Inject
    @ConfigProperty(name = "cs.store.datastore.project")
    private Optional<String> project;

    @Inject
    @ConfigProperty(name = "cs.store.datastore.namespace")
    private Optional<String> namespace;

    @Inject
    @ConfigProperty(name = "cs.store.datastore.emulator-host")
    private Optional<String> emulatorHost;

    public DatastoreSettings getSettings() {
        return new DatastoreSettings(project.orElse(null), namespace.orElse(null), emulatorHost.orElse(null));
    }
}
