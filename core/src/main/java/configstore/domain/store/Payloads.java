package configstore.domain.store;

import configstore.domain.exceptions.DeserializationFailed;
import configstore.domain.exceptions.SerializationFailed;
import configstore.domain.marshal.Marshaller;
import io.vavr.control.Try;

/**
 * Runs a marshaller and enriches its failures with the stored name and the backend.
 */
final class Payloads {
    private Payloads() {
    }

    static byte[] encode(final Marshaller marshaller, final Object value, final String name, final Loader loader) {
        return Try.of(() -> marshaller.marshal(value))
                .getOrElseThrow(ex -> new SerializationFailed(
                        "Failed to encode " + name + " in " + loader.describe() + ": " + ex.getMessage(), ex));
    }

    /**
     * An empty payload decodes to null rather than failing, so an entry that exists but is empty stays
     * distinguishable from one that does not exist.
     */
    static <T> T decode(final Marshaller marshaller, final byte[] data, final Class<T> type, final String name, final Loader loader) {
        if (data == null || data.length == 0) {
            return null;
        }

        return Try.of(() -> marshaller.unmarshal(data, type))
                .getOrElseThrow(ex -> new DeserializationFailed(
                        "Failed to decode " + name + " in " + loader.describe() + ": " + ex.getMessage(), ex));
    }
}
