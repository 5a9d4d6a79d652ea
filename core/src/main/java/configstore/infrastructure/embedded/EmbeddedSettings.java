package configstore.infrastructure.embedded;

import configstore.domain.exceptions.ConfigUsageError;
import org.jspecify.annotations.Nullable;

/**
 * @param path          The store file, or null for configdir/app/ns/config.mv.db
 * @param lockTimeoutMs How long to wait for another process to release the file. 0 fails at once.
 */
public record EmbeddedSettings(@Nullable String path, long lockTimeoutMs) {
    public static final String DEFAULT_FILE_NAME = "config.mv.db";

    public EmbeddedSettings {
        if (lockTimeoutMs < 0) {
            throw new ConfigUsageError("The embedded store lock timeout can not be negative, got " + lockTimeoutMs);
        }
    }

    public static EmbeddedSettings defaults() {
        return new EmbeddedSettings(null, 0);
    }

    public EmbeddedSettings withPath(@Nullable final String newPath) {
        return new EmbeddedSettings(newPath, lockTimeoutMs);
    }
}
