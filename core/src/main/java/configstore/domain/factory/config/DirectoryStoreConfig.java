package configstore.domain.factory.config;

import configstore.domain.factory.DirectorySettings;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.eclipse.microprofile.config.inject.ConfigProperty;

import java.util.Optional;

@ApplicationScoped
public class DirectoryStoreConfig {
    @Inject
    @ConfigProperty(name = "cs.store.directory.path")
    private Optional<String> path;

    @Inject
    @ConfigProperty(name = "cs.store.directory.mode", defaultValue = "simple")
    private String mode;

    @Inject
    @ConfigProperty(name = "cs.store.directory.format")
    private Optional<String> format;

    public DirectorySettings getSettings() {
        return DirectorySettings.parse(path.orElse(null), mode, format.orElse(null));
    }
}
