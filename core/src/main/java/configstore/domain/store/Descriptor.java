package configstore.domain.store;

/**
 * Identifies a stored document within a scope. There are two kinds: a {@link Key} names the document and leaves the
 * format to the store, a {@link FormatKey} names the document and pins its format.
 */
public interface Descriptor {
    /**
     * The logical name, never carrying a format extension.
     */
    String key();
}
