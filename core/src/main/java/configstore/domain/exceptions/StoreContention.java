package configstore.domain.exceptions;

/**
 * The backend could not acquire a lock before its timeout expired. The operation was not applied and may be retried
 * by the caller. The library never retries on its own.
 */
public class StoreContention extends ConfigStoreFailure implements ExternalException {
    public StoreContention() {
        super();
    }

    public StoreContention(final String message) {
        super(message);
    }

    public StoreContention(final String message, final Throwable cause) {
        super(message, cause);
    }

    public StoreContention(final Throwable cause) {
        super(cause);
    }
}
