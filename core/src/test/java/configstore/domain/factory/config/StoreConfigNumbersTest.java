package configstore.domain.factory.config;

import configstore.domain.exceptions.ConfigUsageError;
import io.smallrye.config.PropertiesConfigSource;
import io.smallrye.config.SmallRyeConfigBuilder;
import io.smallrye.config.inject.ConfigExtension;
import jakarta.inject.Inject;
import org.eclipse.microprofile.config.Config;
import org.eclipse.microprofile.config.spi.ConfigProviderResolver;
import org.jboss.weld.junit5.auto.AddBeanClasses;
import org.jboss.weld.junit5.auto.AddExtensions;
import org.jboss.weld.junit5.auto.EnableAutoWeld;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.Map;
import java.util.Optional;

@EnableAutoWeld
@AddExtensions(ConfigExtension.class)
@AddBeanClasses(SqliteStoreConfig.class)
@AddBeanClasses(EmbeddedStoreConfig.class)
public class StoreConfigNumbersTest {
    @Inject
    SqliteStoreConfig sqliteStoreConfig;

    @Inject
    EmbeddedStoreConfig embeddedStoreConfig;

    @BeforeEach
    void updateConfig() {
        final var configSource = new PropertiesConfigSource(
                Map.of(
                        "cs.store.sqlite.busy-timeout-ms", "abc",
                        "cs.store.embedded.lock-timeout-ms", "soon"
                ),
                "TestConfig",
                Integer.MAX_VALUE
        );
        final Config newConfig = new SmallRyeConfigBuilder()
                .withSources(configSource)
                .build();

        final var configProviderResolver = ConfigProviderResolver.instance();
        final var oldConfig = configProviderResolver.getConfig();

        configProviderResolver.releaseConfig(oldConfig);
        configProviderResolver.registerConfig(
                newConfig,
                Thread.currentThread().getContextClassLoader()
        );
    }

    @Test
    public void testMalformedNumbersFailFast() {
        final ConfigUsageError sqlite = Assertions.assertThrows(ConfigUsageError.class, () -> sqliteStoreConfig.getSettings());
        Assertions.assertTrue(sqlite.getMessage().contains("cs.store.sqlite.busy-timeout-ms"));

        final ConfigUsageError embedded = Assertions.assertThrows(ConfigUsageError.class, () -> embeddedStoreConfig.getSettings());
        Assertions.assertTrue(embedded.getMessage().contains("cs.store.embedded.lock-timeout-ms"));
    }

    @Test
    public void testBlankAndPaddedNumbers() {
        Assertions.assertEquals(5000, NumberProperty.toInt("n", Optional.empty(), 5000));
        Assertions.assertEquals(5000, NumberProperty.toInt("n", Optional.of("  "), 5000));
        Assertions.assertEquals(4, NumberProperty.toInt("n", Optional.of(" 4 "), 5000));
        Assertions.assertEquals(-2000L, NumberProperty.toLong("n", Optional.of("-2000"), 0L));
        Assertions.assertThrows(ConfigUsageError.class, () -> NumberProperty.toLong("n", Optional.of("12ms"), 0L));
    }
}
