package configstore.domain.marshal;

/**
 * A serialization format. Implementations are stateless and safe to share between stores and threads.
 */
public interface Marshaller {
    /**
     * The name used to select this format in configuration, e.g. "toml".
     */
    String name();

    /**
     * The extension, without the leading dot, appended to stored names written in this format.
     */
    String extension();

    byte[] marshal(Object value);

    <T> T unmarshal(byte[] data, Class<T> type);
}
