package configstore.domain.store;

/**
 * A physical storage medium, such as an open database, that can serve any number of scopes. Loaders returned for
 * different scopes share the backend handle but nothing else.
 */
public interface Backend extends AutoCloseable {
    Loader loader(Scope scope);

    @Override
    void close();
}
