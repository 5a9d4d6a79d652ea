package configstore.domain.exceptions;

/**
 * The API was called incorrectly, for example with a null descriptor, or a factory was configured with an unknown
 * backend, mode or format.
 */
public class ConfigUsageError extends RuntimeException implements InternalException {
    public ConfigUsageError() {
        super();
    }

    public ConfigUsageError(final String message) {
        super(message);
    }

    public ConfigUsageError(final String message, final Throwable cause) {
        super(message, cause);
    }

    public ConfigUsageError(final Throwable cause) {
        super(cause);
    }
}
