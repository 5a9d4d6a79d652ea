package configstore.domain.store;

import java.util.List;

/**
 * Represents the bare minimum byte level operations on one scope of a storage medium. Loaders know nothing about
 * formats or key encoding, they deal in stored names.
 * <p>
 * A missing entry is always reported with {@link configstore.domain.exceptions.ConfigNotFound}. Any other failure
 * is reported with {@link configstore.domain.exceptions.ConfigStoreFailure} or a subclass, carrying the backend,
 * scope and name in its message.
 */
public interface Loader {
    /**
     * Returns the stored names in this scope. Only the SQLite backend guarantees an order (lexical).
     */
    List<String> list();

    byte[] read(String name);

    /**
     * Creates the entry, or fully replaces its previous content.
     */
    void write(String name, byte[] data);

    void delete(String name);

    /**
     * A short human readable identification of the backend and scope, used in error messages.
     */
    String describe();
}
