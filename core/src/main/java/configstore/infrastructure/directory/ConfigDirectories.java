package configstore.infrastructure.directory;

import configstore.domain.store.Scope;
import org.apache.commons.lang3.StringUtils;
import org.apache.commons.lang3.SystemUtils;

import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * Locates the per-user configuration directory, following the platform conventions:
 * $XDG_CONFIG_HOME or ~/.config on Linux, ~/Library/Application Support on macOS and %APPDATA% on Windows.
 */
public final class ConfigDirectories {
    private ConfigDirectories() {
    }

    public static Path userConfigDirectory() {
        if (SystemUtils.IS_OS_WINDOWS && StringUtils.isNotBlank(System.getenv("APPDATA"))) {
            return Paths.get(System.getenv("APPDATA"));
        }

        if (SystemUtils.IS_OS_MAC) {
            return SystemUtils.getUserHome().toPath().resolve("Library").resolve("Application Support");
        }

        final String xdg = System.getenv("XDG_CONFIG_HOME");
        if (StringUtils.isNotBlank(xdg)) {
            return Paths.get(xdg);
        }

        return SystemUtils.getUserHome().toPath().resolve(".config");
    }

    /**
     * Returns root/app/ns1/ns2...
     */
    public static Path forScope(final Path root, final Scope scope) {
        Path directory = root;
        for (final String segment : scope.segments()) {
            directory = directory.resolve(segment);
        }
        return directory;
    }

}
