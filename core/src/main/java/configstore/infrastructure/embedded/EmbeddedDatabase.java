package configstore.infrastructure.embedded;

import configstore.domain.exceptions.ConfigStoreFailure;
import configstore.domain.exceptions.StoreContention;
import configstore.domain.store.Backend;
import configstore.domain.store.Loader;
import configstore.domain.store.Scope;
import io.vavr.control.Try;
import org.h2.mvstore.DataUtils;
import org.h2.mvstore.MVStore;
import org.h2.mvstore.MVStoreException;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.logging.Logger;

import static com.google.common.base.Preconditions.checkNotNull;

/**
 * A single-file key/value store with one map per scope. Only one process can hold the file open at a time.
 */
public class EmbeddedDatabase implements Backend {
    private static final Logger logger = Logger.getLogger(EmbeddedDatabase.class.getName());
    private static final long LOCK_RETRY_DELAY_MS = 100;

    private final Path path;
    private final MVStore store;

    private EmbeddedDatabase(final Path path, final MVStore store) {
        this.path = path;
        this.store = store;
    }

    public static EmbeddedDatabase open(final Path path, final EmbeddedSettings settings) {
        checkNotNull(path);
        checkNotNull(settings);

        final Path absolute = path.toAbsolutePath();

        Try.of(() -> Files.createDirectories(absolute.getParent()))
                .getOrElseThrow(ex -> new ConfigStoreFailure("Failed to create the directory for " + absolute + ": " + ex.getMessage(), ex));

        return new EmbeddedDatabase(absolute, openWithRetry(absolute, settings.lockTimeoutMs()));
    }

    public Path getPath() {
        return path;
    }

    @Override
    public Loader loader(final Scope scope) {
        return new EmbeddedLoader(store, path, scope.path());
    }

    @Override
    public void close() {
        logger.info("Closing embedded store " + path);
        store.close();
    }

    /**
     * Another process holding the file is retried until the timeout passes.
     */
    private static MVStore openWithRetry(final Path path, final long lockTimeoutMs) {
        final long deadline = System.currentTimeMillis() + lockTimeoutMs;

        while (true) {
            final Try<MVStore> result = Try.of(() -> new MVStore.Builder()
                    .fileName(path.toString())
                    .open());

            if (result.isSuccess()) {
                logger.info("Opened embedded store " + path);
                return result.get();
            }

            if (!isLocked(result.getCause())) {
                throw new ConfigStoreFailure("Failed to open embedded store " + path + ": " + result.getCause().getMessage(), result.getCause());
            }

            if (System.currentTimeMillis() >= deadline) {
                throw new StoreContention("Timed out waiting for the lock on embedded store " + path, result.getCause());
            }

            logger.fine("Embedded store " + path + " is locked, retrying");
            Try.run(() -> Thread.sleep(LOCK_RETRY_DELAY_MS))
                    .getOrElseThrow(ex -> new StoreContention("Interrupted waiting for the lock on embedded store " + path, ex));
        }
    }

    private static boolean isLocked(final Throwable ex) {
        return ex instanceof MVStoreException mvStoreException
                && mvStoreException.getErrorCode() == DataUtils.ERROR_FILE_LOCKED;
    }
}
