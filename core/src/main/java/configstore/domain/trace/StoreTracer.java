package configstore.domain.trace;

import configstore.domain.exceptionhandling.ExceptionHandler;
import configstore.domain.store.Opener;
import configstore.domain.store.Scope;
import configstore.domain.store.Store;

import java.util.logging.Logger;

import static com.google.common.base.Preconditions.checkNotNull;

/**
 * Wraps stores, and the stores returned by openers, with logging. Stores that are not selected by the
 * settings are returned unchanged.
 * <p>
 * For example, with "cs.trace.enabled=true" and "cs.trace.include=myapp":
 * <pre>
 * final Opener traced = tracer.wrapOpener(factory.opener());
 * traced.open("myapp", "prefs");  // traced, named "myapp/prefs"
 * traced.open("other");           // returned as is
 * </pre>
 */
public class StoreTracer {
    private final TraceSettings settings;
    private final Logger logger;
    private final ExceptionHandler exceptionHandler;

    public StoreTracer(final TraceSettings settings, final Logger logger, final ExceptionHandler exceptionHandler) {
        this.settings = checkNotNull(settings);
        this.logger = checkNotNull(logger);
        this.exceptionHandler = checkNotNull(exceptionHandler);
    }

    public TraceSettings getSettings() {
        return settings;
    }

    public Opener wrapOpener(final Opener opener) {
        checkNotNull(opener);
        return (app, namespace) -> wrapStore(Scope.of(app, namespace).path(), opener.open(app, namespace));
    }

    public Store wrapStore(final String name, final Store store) {
        if (store == null || !settings.enabledFor(name)) {
            return store;
        }
        return new TracedStore(name, store, logger, exceptionHandler, settings.logResponses());
    }
}
