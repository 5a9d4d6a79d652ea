package configstore.domain.factory.config;

import configstore.infrastructure.embedded.EmbeddedSettings;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.eclipse.microprofile.config.inject.ConfigProperty;

import java.util.Optional;

@ApplicationScoped
public class EmbeddedStoreConfig {
    @Inject
    @ConfigProperty(name = "cs.store.embedded.path")
    private Optional<String> path;

    @Inject
    @ConfigProperty(name = "cs.store.embedded.lock-timeout-ms")
    private Optional<String> lockTimeoutMs;

    public EmbeddedSettings getSettings() {
        return new EmbeddedSettings(path.orElse(null), NumberProperty.toLong("cs.store.embedded.lock-timeout-ms", lockTimeoutMs, EmbeddedSettings.defaults().lockTimeoutMs()));
    }
}
