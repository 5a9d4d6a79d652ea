package configstore.domain.store;

/**
 * Maps logical keys to names that are safe to use as file names or database identifiers, and back.
 * {@code decode(encode(key))} must return the original key for every key.
 */
public interface KeyCodec {
    String encode(String key);

    String decode(String encoded);

    /**
     * The default codec, escaping only "/", "%" and NUL.
     */
    static KeyCodec percent() {
        return PercentKeyCodec.INSTANCE;
    }

    /**
     * Stores names exactly as given. Only suitable for backends that accept any string as a name.
     */
    static KeyCodec verbatim() {
        return VerbatimKeyCodec.INSTANCE;
    }
}
