package configstore.infrastructure.sqlite;

import configstore.domain.exceptionhandling.LoaderExceptionMapping;
import configstore.domain.exceptions.ConfigNotFound;
import configstore.domain.store.Loader;
import io.vavr.control.Try;
import org.sqlite.SQLiteErrorCode;
import org.sqlite.SQLiteException;

import javax.sql.DataSource;
import java.nio.file.Path;
import java.sql.SQLTransientConnectionException;
import java.util.ArrayList;
import java.util.List;

import static com.google.common.base.Preconditions.checkNotNull;

/**
 * The entries of one scope in a {@link SqliteDatabase}.
 */
public class SqliteLoader implements Loader {
    private static final String LIST = "SELECT name FROM configs WHERE scope = ? ORDER BY name";
    private static final String READ = "SELECT data FROM configs WHERE scope = ? AND name = ?";
    private static final String WRITE = "INSERT INTO configs (scope, name, data) VALUES (?, ?, ?) "
            + "ON CONFLICT (scope, name) DO UPDATE SET data = excluded.data";
    private static final String DELETE = "DELETE FROM configs WHERE scope = ? AND name = ?";

    private final DataSource dataSource;
    private final Path path;
    private final String scope;
    private final LoaderExceptionMapping exceptionMapping;

    public SqliteLoader(final DataSource dataSource, final Path path, final String scope) {
        this.dataSource = checkNotNull(dataSource);
        this.path = checkNotNull(path);
        this.scope = checkNotNull(scope);
        this.exceptionMapping = new LoaderExceptionMapping(describe(), ex -> false, SqliteLoader::isContention);
    }

    @Override
    public List<String> list() {
        return exceptionMapping.get(
                Try.withResources(dataSource::getConnection)
                        .of(connection -> Try.withResources(() -> connection.prepareStatement(LIST))
                                .of(statement -> {
                                    statement.setString(1, scope);
                                    return Try.withResources(statement::executeQuery)
                                            .of(resultSet -> {
                                                final List<String> names = new ArrayList<>();
                                                while (resultSet.next()) {
                                                    names.add(resultSet.getString(1));
                                                }
                                                return List.copyOf(names);
                                            })
                                            .get();
                                })
                                .get()),
                "list",
                scope);
    }

    @Override
    public byte[] read(final String name) {
        return exceptionMapping.get(
                Try.withResources(dataSource::getConnection)
                        .of(connection -> Try.withResources(() -> connection.prepareStatement(READ))
                                .of(statement -> {
                                    statement.setString(1, scope);
                                    statement.setString(2, name);
                                    return Try.withResources(statement::executeQuery)
                                            .of(resultSet -> {
                                                if (!resultSet.next()) {
                                                    throw new ConfigNotFound(name + " not found in " + describe());
                                                }
                                                final byte[] data = resultSet.getBytes(1);
                                                // Zero length blobs come back as null
                                                return data == null ? new byte[0] : data;
                                            })
                                            .get();
                                })
                                .get()),
                "read",
                name);
    }

    @Override
    public void write(final String name, final byte[] data) {
        exceptionMapping.get(
                Try.withResources(dataSource::getConnection)
                        .of(connection -> Try.withResources(() -> connection.prepareStatement(WRITE))
                                .of(statement -> {
                                    statement.setString(1, scope);
                                    statement.setString(2, name);
                                    statement.setBytes(3, data);
                                    return statement.executeUpdate();
                                })
                                .get()),
                "write",
                name);
    }

    @Override
    public void delete(final String name) {
        final int deleted = exceptionMapping.get(
                Try.withResources(dataSource::getConnection)
                        .of(connection -> Try.withResources(() -> connection.prepareStatement(DELETE))
                                .of(statement -> {
                                    statement.setString(1, scope);
                                    statement.setString(2, name);
                                    return statement.executeUpdate();
                                })
                                .get()),
                "delete",
                name);

        if (deleted == 0) {
            throw new ConfigNotFound(name + " not found in " + describe());
        }
    }

    @Override
    public String describe() {
        return "sqlite " + path + " scope " + scope;
    }

    /**
     * SQLITE_BUSY and SQLITE_LOCKED, including their extended codes, and an exhausted pool.
     */
    private static boolean isContention(final Throwable ex) {
        if (ex instanceof SQLTransientConnectionException) {
            return true;
        }
        if (ex instanceof SQLiteException sqliteException && sqliteException.getResultCode() != null) {
            final int primary = sqliteException.getResultCode().code & 0xff;
            return primary == SQLiteErrorCode.SQLITE_BUSY.code || primary == SQLiteErrorCode.SQLITE_LOCKED.code;
        }
        return false;
    }
}
