package configstore.domain.factory;

import configstore.domain.exceptions.ConfigUsageError;

import java.util.Arrays;

/**
 * The backends a {@link StoreFactory} can open, by their selector.
 */
public enum StoreBackend {
    /** One file per entry under configdir/app/ns. */
    DIRECTORY("directory"),
    /** A shared SQLite file holding JSON documents under their plain key. */
    SQLITE("sqlite"),
    /** A shared SQLite file holding every known format. */
    SQLITE_MULTI("sqlite-multi"),
    /** An H2 MVStore file with one map per scope. */
    EMBEDDED("embedded"),
    /** Google Cloud Datastore. */
    DATASTORE("datastore");

    private final String selector;

    StoreBackend(final String selector) {
        this.selector = selector;
    }

    public String getSelector() {
        return selector;
    }

    public static StoreBackend fromSelector(final String selector) {
        return Arrays.stream(values())
                .filter(backend -> backend.selector.equalsIgnoreCase(selector == null ? "" : selector.trim()))
                .findFirst()
                .orElseThrow(() -> new ConfigUsageError("unknown config store type: " + selector));
    }

    @Override
    public String toString() {
        return selector;
    }
}
