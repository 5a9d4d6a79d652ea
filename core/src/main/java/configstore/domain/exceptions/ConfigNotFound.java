package configstore.domain.exceptions;

/**
 * The requested entry does not exist. Every backend reports a missing entry with this exception, so callers can
 * implement "create if missing" logic without knowing which backend is in use.
 */
public class ConfigNotFound extends RuntimeException {
    public ConfigNotFound() {
        super();
    }

    public ConfigNotFound(final String message) {
        super(message);
    }

    public ConfigNotFound(final String message, final Throwable cause) {
        super(message, cause);
    }

    public ConfigNotFound(final Throwable cause) {
        super(cause);
    }
}
