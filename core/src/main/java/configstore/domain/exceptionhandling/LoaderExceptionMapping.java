package configstore.domain.exceptionhandling;

import configstore.domain.exceptions.ConfigNotFound;
import configstore.domain.exceptions.ConfigStoreFailure;
import configstore.domain.exceptions.InternalException;
import configstore.domain.exceptions.StoreContention;
import io.vavr.API;
import io.vavr.control.Try;

import java.util.function.Predicate;

import static com.google.common.base.Preconditions.checkNotNull;
import static com.google.common.base.Predicates.instanceOf;

/**
 * Maps the failures of a backend into the store exceptions.
 * Failures that are already classified pass through.
 * The backend's own "missing" signal becomes {@link ConfigNotFound}, its lock timeouts become
 * {@link StoreContention}, and everything else becomes a {@link ConfigStoreFailure} naming the operation,
 * the entry and the backend.
 */
public class LoaderExceptionMapping {
    private final String backend;
    private final Predicate<Throwable> notFound;
    private final Predicate<Throwable> contention;

    public LoaderExceptionMapping(final String backend, final Predicate<Throwable> notFound, final Predicate<Throwable> contention) {
        this.backend = checkNotNull(backend);
        this.notFound = checkNotNull(notFound);
        this.contention = checkNotNull(contention);
    }

    public <T> Try<T> map(final Try<T> tryObject, final String operation, final String name) {
        checkNotNull(tryObject);

        return tryObject.mapFailure(
                API.Case(API.$(instanceOf(ConfigNotFound.class)), throwable -> throwable),
                API.Case(API.$(instanceOf(ConfigStoreFailure.class)), throwable -> throwable),
                API.Case(API.$(instanceOf(InternalException.class)), throwable -> throwable),
                API.Case(API.$(notFound), throwable -> new ConfigNotFound(name + " not found in " + backend, throwable)),
                API.Case(API.$(contention), throwable -> new StoreContention(
                        "Timed out waiting for a lock to " + operation + " " + name + " in " + backend + ": " + throwable.getMessage(), throwable)),
                API.Case(API.$(), throwable -> new ConfigStoreFailure(
                        "Failed to " + operation + " " + name + " in " + backend + ": " + throwable.getMessage(), throwable)));
    }

    /**
     * Maps the failure and returns the value, throwing the mapped exception on failure.
     */
    public <T> T get(final Try<T> tryObject, final String operation, final String name) {
        return map(tryObject, operation, name).get();
    }
}
