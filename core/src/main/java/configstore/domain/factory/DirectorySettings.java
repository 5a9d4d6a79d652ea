package configstore.domain.factory;

import configstore.domain.exceptions.ConfigUsageError;
import configstore.domain.marshal.Marshaller;
import configstore.domain.marshal.Marshallers;
import org.apache.commons.lang3.StringUtils;
import org.jspecify.annotations.Nullable;

import static com.google.common.base.Preconditions.checkNotNull;

/**
 * @param path   The root directory, or null for the user's configuration directory
 * @param mode   Single format or multi format
 * @param format The format of a simple store, and the preferred format of a multi format store.
 *               Null means TOML for a simple store and the default order for a multi format store.
 */
public record DirectorySettings(@Nullable String path, DirectoryMode mode, @Nullable Marshaller format) {
    public static final Marshaller DEFAULT_FORMAT = Marshallers.TOML;

    public DirectorySettings {
        checkNotNull(mode);
    }

    public static DirectorySettings defaults() {
        return new DirectorySettings(null, DirectoryMode.SIMPLE, null);
    }

    /**
     * Parses the mode and format names, failing on unknown ones.
     */
    public static DirectorySettings parse(@Nullable final String path, @Nullable final String mode, @Nullable final String format) {
        return new DirectorySettings(
                StringUtils.isBlank(path) ? null : path,
                StringUtils.isBlank(mode) ? DirectoryMode.SIMPLE : DirectoryMode.fromName(mode),
                StringUtils.isBlank(format)
                        ? null
                        : Marshallers.byName(format.trim())
                        .orElseThrow(() -> new ConfigUsageError("unknown directory format: " + format)));
    }

    public Marshaller formatOrDefault() {
        return format == null ? DEFAULT_FORMAT : format;
    }
}
