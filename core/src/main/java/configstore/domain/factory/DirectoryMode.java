package configstore.domain.factory;

import configstore.domain.exceptions.ConfigUsageError;

import java.util.Arrays;
import java.util.Locale;

public enum DirectoryMode {
    /** Entries in a single format. */
    SIMPLE,
    /** Entries in any known format, the configured one preferred. */
    MULTI;

    public static DirectoryMode fromName(final String name) {
        return Arrays.stream(values())
                .filter(mode -> mode.name().equalsIgnoreCase(name == null ? "" : name.trim()))
                .findFirst()
                .orElseThrow(() -> new ConfigUsageError("unknown directory mode: " + name));
    }

    @Override
    public String toString() {
        return name().toLowerCase(Locale.ROOT);
    }
}
