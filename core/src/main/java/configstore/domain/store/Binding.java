package configstore.domain.store;

/**
 * Ties a store to one key, for code that owns exactly one document.
 */
public record Binding(Store store, String key) {
    public static Binding of(final Store store, final String key) {
        return new Binding(store, key);
    }

    public void marshal(final Object value) {
        store.marshal(new Key(key), value);
    }

    public <T> Loaded<T> unmarshal(final Class<T> type) {
        return store.unmarshal(new Key(key), type);
    }
}
