package configstore.domain.factory;

import configstore.domain.exceptionhandling.ExceptionHandler;
import configstore.domain.factory.config.FactoryConfig;
import configstore.domain.factory.config.TraceConfig;
import configstore.domain.injection.Preferred;
import configstore.domain.store.Opener;
import configstore.domain.trace.StoreTracer;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Inject;

import java.util.logging.Logger;

/**
 * Produces the application's {@link Opener} from the configuration, traced as configured.
 */
@ApplicationScoped
public class ConfigStoreProducer {
    @Inject
    private FactoryConfig factoryConfig;

    @Inject
    private TraceConfig traceConfig;

    @Inject
    private ExceptionHandler exceptionHandler;

    @Inject
    private Logger logger;

    private StoreFactory storeFactory;
    private StoreTracer storeTracer;

    @PostConstruct
    public void open() {
        storeFactory = new StoreFactory(factoryConfig.getSettings());
        storeTracer = new StoreTracer(traceConfig.getSettings(), logger, exceptionHandler);
    }

    @PreDestroy
    public void close() {
        if (storeFactory != null) {
            storeFactory.close();
        }
    }

    public StoreFactory getStoreFactory() {
        return storeFactory;
    }

    @Produces
    @Preferred
    public Opener produceOpener() {
        return storeTracer.wrapOpener(storeFactory.opener());
    }
}
