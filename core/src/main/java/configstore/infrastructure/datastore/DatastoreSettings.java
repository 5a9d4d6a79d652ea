package configstore.infrastructure.datastore;

import org.jspecify.annotations.Nullable;

/**
 * @param project      The Google Cloud project, or null to detect it from the environment
 * @param namespace    The Datastore namespace, or null for the default one
 * @param emulatorHost host:port of a Datastore emulator. Emulator connections use no credentials.
 */
public record DatastoreSettings(
        @Nullable String project,
        @Nullable String namespace,
        @Nullable String emulatorHost) {

    public static DatastoreSettings defaults() {
        return new DatastoreSettings(null, null, null);
    }
}
