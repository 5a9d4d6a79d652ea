package configstore.infrastructure.datastore;

import com.google.cloud.datastore.Blob;
import com.google.cloud.datastore.BlobValue;
import com.google.cloud.datastore.Datastore;
import com.google.cloud.datastore.DatastoreException;
import com.google.cloud.datastore.Entity;
import com.google.cloud.datastore.Key;
import com.google.cloud.datastore.PathElement;
import com.google.cloud.datastore.Query;
import com.google.cloud.datastore.QueryResults;
import com.google.cloud.datastore.StructuredQuery;
import com.google.cloud.datastore.Transaction;
import configstore.domain.exceptionhandling.LoaderExceptionMapping;
import configstore.domain.exceptions.ConfigNotFound;
import configstore.domain.store.Loader;
import io.vavr.control.Try;

import java.util.ArrayList;
import java.util.List;

import static com.google.common.base.Preconditions.checkNotNull;

/**
 * The entries of one scope: entities of kind {@value #KIND} whose parent is a {@value #SCOPE_KIND} key named
 * after the scope. The parent entity itself is never written.
 */
public class DatastoreLoader implements Loader {
    public static final String KIND = "Config";
    public static final String SCOPE_KIND = "Scope";
    public static final String DATA = "data";

    private final Datastore datastore;
    private final String scope;
    private final Key scopeKey;
    private final LoaderExceptionMapping exceptionMapping;

    public DatastoreLoader(final Datastore datastore, final String scope) {
        this.datastore = checkNotNull(datastore);
        this.scope = checkNotNull(scope);
        this.scopeKey = datastore.newKeyFactory().setKind(SCOPE_KIND).newKey(scope);
        this.exceptionMapping = new LoaderExceptionMapping(describe(), ex -> false, DatastoreLoader::isContention);
    }

    @Override
    public List<String> list() {
        final Query<Key> query = Query.newKeyQueryBuilder()
                .setKind(KIND)
                .setFilter(StructuredQuery.PropertyFilter.hasAncestor(scopeKey))
                .build();

        return exceptionMapping.get(
                Try.of(() -> {
                    final QueryResults<Key> results = datastore.run(query);
                    final List<String> names = new ArrayList<>();
                    while (results.hasNext()) {
                        names.add(results.next().getName());
                    }
                    return List.copyOf(names);
                }),
                "list",
                scope);
    }

    @Override
    public byte[] read(final String name) {
        final Entity entity = exceptionMapping.get(Try.of(() -> datastore.get(keyFor(name))), "read", name);
        if (entity == null || !entity.contains(DATA)) {
            throw new ConfigNotFound(name + " not found in " + describe());
        }
        return entity.getBlob(DATA).toByteArray();
    }

    @Override
    public void write(final String name, final byte[] data) {
        final Entity entity = Entity.newBuilder(keyFor(name))
                .set(DATA, BlobValue.newBuilder(Blob.copyFrom(data)).setExcludeFromIndexes(true).build())
                .build();

        exceptionMapping.get(Try.of(() -> datastore.put(entity)), "write", name);
    }

    /**
     * Checks for the entity and deletes it in one transaction, so a concurrent delete is reported as not found.
     */
    @Override
    public void delete(final String name) {
        final Key key = keyFor(name);

        exceptionMapping.get(
                Try.run(() -> {
                    final Transaction transaction = datastore.newTransaction();
                    try {
                        if (transaction.get(key) == null) {
                            throw new ConfigNotFound(name + " not found in " + describe());
                        }
                        transaction.delete(key);
                        transaction.commit();
                    } finally {
                        if (transaction.isActive()) {
                            transaction.rollback();
                        }
                    }
                }),
                "delete",
                name);
    }

    @Override
    public String describe() {
        return "datastore scope " + scope;
    }

    private Key keyFor(final String name) {
        return datastore.newKeyFactory()
                .addAncestor(PathElement.of(SCOPE_KIND, scope))
                .setKind(KIND)
                .newKey(name);
    }

    /**
     * Aborted transactions and other failures the client marks as retryable.
     */
    private static boolean isContention(final Throwable ex) {
        return ex instanceof DatastoreException datastoreException && datastoreException.isRetryable();
    }
}
