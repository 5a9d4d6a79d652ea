package configstore.domain.trace;

import configstore.domain.exceptionhandling.ExceptionHandler;
import configstore.domain.store.Descriptor;
import configstore.domain.store.Loaded;
import configstore.domain.store.Store;
import io.vavr.control.Try;
import org.jspecify.annotations.Nullable;

import java.util.List;
import java.util.function.Function;
import java.util.function.Supplier;
import java.util.logging.Logger;

/**
 * Logs each call before passing it on, then logs how it ended. Results and exceptions are returned unchanged.
 */
class TracedStore implements Store {
    private final String name;
    private final Store store;
    private final Logger logger;
    private final ExceptionHandler exceptionHandler;
    private final boolean logResponses;

    TracedStore(final String name, final Store store, final Logger logger, final ExceptionHandler exceptionHandler, final boolean logResponses) {
        this.name = name;
        this.store = store;
        this.logger = logger;
        this.exceptionHandler = exceptionHandler;
        this.logResponses = logResponses;
    }

    @Override
    public List<Descriptor> list() {
        return trace("List()", null, store::list, String::valueOf);
    }

    @Override
    public void marshal(final Descriptor descriptor, final Object value) {
        trace("Marshal(" + descriptor + ")", value, () -> {
            store.marshal(descriptor, value);
            return null;
        }, result -> null);
    }

    @Override
    public <T> Loaded<T> unmarshal(final Descriptor descriptor, final Class<T> type) {
        return trace(
                "Unmarshal(" + descriptor + ")",
                null,
                () -> store.unmarshal(descriptor, type),
                loaded -> loaded.descriptor() + " = " + loaded.value());
    }

    @Override
    public void delete(final Descriptor descriptor) {
        trace("Delete(" + descriptor + ")", null, () -> {
            store.delete(descriptor);
            return null;
        }, result -> null);
    }

    @Override
    public String toString() {
        return "Traced(" + name + ", " + store + ")";
    }

    /**
     * @param value The value being written, logged after the start line when responses are logged
     */
    private <T> T trace(final String call, @Nullable final Object value, final Supplier<T> operation, final Function<T, String> response) {
        logger.info("config store " + name + ": " + call);
        if (logResponses && value != null) {
            logger.info("config store " + name + ": " + call + " value=" + value);
        }

        final long start = System.nanoTime();
        final Try<T> result = Try.ofSupplier(operation);
        final long elapsed = (System.nanoTime() - start) / 1_000_000;

        if (result.isFailure()) {
            logger.info("config store " + name + ": " + call + " error after " + elapsed + " ms: "
                    + exceptionHandler.getExceptionMessage(result.getCause()));
            return result.get();
        }

        final String shown = logResponses ? response.apply(result.get()) : null;
        logger.info("config store " + name + ": " + call + " ok after " + elapsed + " ms"
                + (shown == null ? "" : " -> " + shown));
        return result.get();
    }
}
