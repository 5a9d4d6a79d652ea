package configstore.infrastructure.datastore;

import com.google.cloud.NoCredentials;
import com.google.cloud.datastore.Datastore;
import com.google.cloud.datastore.DatastoreOptions;
import configstore.domain.exceptions.ConfigStoreFailure;
import configstore.domain.store.Backend;
import configstore.domain.store.Loader;
import configstore.domain.store.Scope;
import io.vavr.control.Try;
import org.apache.commons.lang3.StringUtils;

import java.util.logging.Logger;

import static com.google.common.base.Preconditions.checkNotNull;

/**
 * Keeps entries in Google Cloud Datastore. Each scope is the ancestor of its entries, so listing a scope is a
 * strongly consistent ancestor query.
 */
public class DatastoreDatabase implements Backend {
    private static final Logger logger = Logger.getLogger(DatastoreDatabase.class.getName());

    private final Datastore datastore;

    public DatastoreDatabase(final Datastore datastore) {
        this.datastore = checkNotNull(datastore);
    }

    public static DatastoreDatabase connect(final DatastoreSettings settings) {
        checkNotNull(settings);

        return Try.of(() -> options(settings).getService())
                .map(DatastoreDatabase::new)
                .onSuccess(database -> logger.info("Connected to Datastore project " + database.datastore.getOptions().getProjectId()))
                .getOrElseThrow(ex -> new ConfigStoreFailure("Failed to connect to Datastore: " + ex.getMessage(), ex));
    }

    @Override
    public Loader loader(final Scope scope) {
        return new DatastoreLoader(datastore, scope.path());
    }

    @Override
    public void close() {
        // The client opens connections per request
    }

    private static DatastoreOptions options(final DatastoreSettings settings) {
        final DatastoreOptions.Builder builder = DatastoreOptions.newBuilder();

        if (StringUtils.isNotBlank(settings.project())) {
            builder.setProjectId(settings.project());
        }

        if (StringUtils.isNotBlank(settings.namespace())) {
            builder.setNamespace(settings.namespace());
        }

        if (StringUtils.isNotBlank(settings.emulatorHost())) {
            builder.setHost(settings.emulatorHost())
                    .setCredentials(NoCredentials.getInstance());
        }

        return builder.build();
    }
}
