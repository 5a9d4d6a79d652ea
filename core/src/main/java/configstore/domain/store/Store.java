package configstore.domain.store;

import java.util.List;

/**
 * A flat mapping of keys to documents within one scope. Stores serialize values with a {@link
 * configstore.domain.marshal.Marshaller} and delegate the byte level work to a {@link Loader}.
 */
public interface Store {
    /**
     * Returns one descriptor per stored entry. Every returned descriptor can be passed back to
     * {@link #unmarshal(Descriptor, Class)}.
     */
    List<Descriptor> list();

    /**
     * Writes a value, creating the entry or replacing its content.
     */
    void marshal(Descriptor descriptor, Object value);

    /**
     * Reads and decodes an entry.
     *
     * @throws configstore.domain.exceptions.ConfigNotFound if the entry does not exist
     */
    <T> Loaded<T> unmarshal(Descriptor descriptor, Class<T> type);

    /**
     * @throws configstore.domain.exceptions.ConfigNotFound if the entry does not exist
     */
    void delete(Descriptor descriptor);
}
