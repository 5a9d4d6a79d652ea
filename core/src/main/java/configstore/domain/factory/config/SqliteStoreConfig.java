package configstore.domain.factory.config;

import configstore.infrastructure.sqlite.SqliteSettings;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.eclipse.microprofile.config.inject.ConfigProperty;

import java.util.Optional;

/**
 * Unset properties keep the values of {@link SqliteSettings#defaults()}.
 */
@ApplicationScoped
public class SqliteStoreConfig {
    private static final SqliteSettings DEFAULTS = SqliteSettings.defaults();

    @Inject
    @ConfigProperty(name = "cs.store.sqlite.path")
    private Optional<String> path;

    @Inject
    @ConfigProperty(name = "cs.store.sqlite.journal-mode")
    private Optional<String> journalMode;

    @Inject
    @ConfigProperty(name = "cs.store.sqlite.synchronous")
    private Optional<String> synchronous;

    @Inject
    @ConfigProperty(name = "cs.store.sqlite.busy-timeout-ms")
    private Optional<String> busyTimeoutMs;

    @Inject
    @ConfigProperty(name = "cs.store.sqlite.max-open-conns")
    private Optional<String> maxOpenConns;

    @Inject
    @ConfigProperty(name = "cs.store.sqlite.max-idle-conns")
    private Optional<String> maxIdleConns;

    @Inject
    @ConfigProperty(name = "cs.store.sqlite.cache-size")
    private Optional<String> cacheSize;

    @Inject
    @ConfigProperty(name = "cs.store.sqlite.mmap-size")
    private Optional<String> mmapSize;

    @Inject
    @ConfigProperty(name = "cs.store.sqlite.temp-store")
    private Optional<String> tempStore;

    public SqliteSettings getSettings() {
        return new SqliteSettings(
                path.orElse(null),
                journalMode.orElse(DEFAULTS.journalMode()),
                synchronous.orElse(DEFAULTS.synchronous()),
                NumberProperty.toInt("cs.store.sqlite.busy-timeout-ms", busyTimeoutMs, DEFAULTS.busyTimeoutMs()),
                NumberProperty.toInt("cs.store.sqlite.max-open-conns", maxOpenConns, DEFAULTS.maxOpenConns()),
                NumberProperty.toInt("cs.store.sqlite.max-idle-conns", maxIdleConns, DEFAULTS.maxIdleConns()),
                NumberProperty.toInt("cs.store.sqlite.cache-size", cacheSize, DEFAULTS.cacheSize()),
                NumberProperty.toLong("cs.store.sqlite.mmap-size", mmapSize, DEFAULTS.mmapSize()),
                tempStore.orElse(DEFAULTS.tempStore()));
    }
}
