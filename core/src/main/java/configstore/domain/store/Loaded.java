package configstore.domain.store;

import org.jspecify.annotations.Nullable;

/**
 * Represents the result of an unmarshal operation.
 *
 * @param descriptor The descriptor that was actually read. For multi-format stores this carries the resolved format
 * @param value      The decoded value, or null if the entry exists but holds an empty payload
 * @param <T>        The value type
 */
public record Loaded<T>(Descriptor descriptor, @Nullable T value) {
    public boolean isEmpty() {
        return value == null;
    }

    /**
     * Returns the decoded value, or the supplied value untouched when the entry was empty.
     */
    public T valueOr(final T defaultValue) {
        return value == null ? defaultValue : value;
    }
}
