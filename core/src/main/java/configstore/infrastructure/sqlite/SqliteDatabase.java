package configstore.infrastructure.sqlite;

import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import configstore.domain.exceptions.ConfigStoreFailure;
import configstore.domain.store.Backend;
import configstore.domain.store.Loader;
import configstore.domain.store.Scope;
import io.vavr.control.Try;
import org.sqlite.SQLiteDataSource;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.logging.Logger;

import static com.google.common.base.Preconditions.checkNotNull;

/**
 * One SQLite file shared by every scope. Entries live in a single table keyed by (scope, name), and
 * connections come from a pool so that several loaders can use the database at once.
 */
public class SqliteDatabase implements Backend {
    private static final Logger logger = Logger.getLogger(SqliteDatabase.class.getName());

    private static final String SCHEMA = """
            CREATE TABLE IF NOT EXISTS configs (
                scope TEXT NOT NULL,
                name TEXT NOT NULL,
                data BLOB NOT NULL,
                PRIMARY KEY (scope, name)
            )""";

    private final Path path;
    private final HikariDataSource dataSource;

    private SqliteDatabase(final Path path, final HikariDataSource dataSource) {
        this.path = path;
        this.dataSource = dataSource;
    }

    /**
     * Opens (creating if needed) the database file and its schema.
     */
    public static SqliteDatabase open(final Path path, final SqliteSettings settings) {
        checkNotNull(path);
        checkNotNull(settings);

        final Path absolute = path.toAbsolutePath();

        Try.of(() -> Files.createDirectories(absolute.getParent()))
                .getOrElseThrow(ex -> new ConfigStoreFailure("Failed to create the directory for " + absolute + ": " + ex.getMessage(), ex));

        final HikariDataSource dataSource = Try.of(() -> new HikariDataSource(poolConfig(absolute, settings)))
                .getOrElseThrow(ex -> new ConfigStoreFailure("Failed to open SQLite database " + absolute + ": " + ex.getMessage(), ex));

        final SqliteDatabase database = new SqliteDatabase(absolute, dataSource);
        Try.run(database::createSchema)
                .onFailure(ex -> dataSource.close())
                .getOrElseThrow(ex -> new ConfigStoreFailure("Failed to create the schema in SQLite database " + absolute + ": " + ex.getMessage(), ex));

        logger.info("Opened SQLite database " + absolute);
        return database;
    }

    public Path getPath() {
        return path;
    }

    @Override
    public Loader loader(final Scope scope) {
        return new SqliteLoader(dataSource, path, scope.path());
    }

    @Override
    public void close() {
        logger.info("Closing SQLite database " + path);
        dataSource.close();
    }

    private void createSchema() {
        Try.withResources(dataSource::getConnection)
                .of(connection -> Try.withResources(connection::createStatement)
                        .of(statement -> statement.execute(SCHEMA))
                        .get())
                .get();
    }

    private static HikariConfig poolConfig(final Path path, final SqliteSettings settings) {
        final SQLiteDataSource sqlite = new SQLiteDataSource(settings.toSqliteConfig());
        sqlite.setUrl("jdbc:sqlite:" + path);

        final HikariConfig config = new HikariConfig();
        config.setPoolName("configstore-sqlite");
        config.setDataSource(sqlite);
        config.setMaximumPoolSize(settings.maxOpenConns());
        config.setMinimumIdle(Math.min(settings.maxIdleConns(), settings.maxOpenConns()));
        config.setConnectionTimeout(Math.max(250L, settings.busyTimeoutMs()));
        if (settings.mmapSize() > 0) {
            config.setConnectionInitSql("PRAGMA mmap_size = " + settings.mmapSize());
        }
        return config;
    }
}
