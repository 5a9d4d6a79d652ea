package configstore.domain.store;

/**
 * Opens the store of an application, optionally confined to nested namespaces.
 */
@FunctionalInterface
public interface Opener {
    Store open(String app, String... namespace);
}
