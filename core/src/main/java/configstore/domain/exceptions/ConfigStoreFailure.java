package configstore.domain.exceptions;

/**
 * Represents a failure that occurred in a storage backend: file system, database or network errors.
 */
public class ConfigStoreFailure extends RuntimeException {
    public ConfigStoreFailure() {
        super();
    }

    public ConfigStoreFailure(final String message) {
        super(message);
    }

    public ConfigStoreFailure(final String message, final Throwable cause) {
        super(message, cause);
    }

    public ConfigStoreFailure(final Throwable cause) {
        super(cause);
    }
}
