package configstore.infrastructure.directory;

import configstore.domain.store.Backend;
import configstore.domain.store.Loader;
import configstore.domain.store.Scope;

import java.nio.file.Path;

import static com.google.common.base.Preconditions.checkNotNull;

/**
 * Stores every scope in its own directory: root/app/ns1/ns2/encoded-key.ext
 */
public class DirectoryBackend implements Backend {
    private final Path root;

    public DirectoryBackend(final Path root) {
        this.root = checkNotNull(root);
    }

    /**
     * A backend rooted at the per-user configuration directory.
     */
    public static DirectoryBackend inUserConfigDirectory() {
        return new DirectoryBackend(ConfigDirectories.userConfigDirectory());
    }

    public Path getRoot() {
        return root;
    }

    @Override
    public Loader loader(final Scope scope) {
        return new DirectoryLoader(ConfigDirectories.forScope(root, scope));
    }

    @Override
    public void close() {
        // Nothing is held open between operations
    }
}
