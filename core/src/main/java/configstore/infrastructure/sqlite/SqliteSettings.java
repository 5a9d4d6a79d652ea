package configstore.infrastructure.sqlite;

import configstore.domain.exceptions.ConfigUsageError;
import io.vavr.control.Try;
import org.jspecify.annotations.Nullable;
import org.sqlite.SQLiteConfig;

import java.util.Locale;

/**
 * Connection pool and pragma settings for a SQLite database.
 *
 * @param path           The database file, or null for configdir/app/ns/config.db
 * @param journalMode    One of DELETE, TRUNCATE, PERSIST, MEMORY, WAL, OFF
 * @param synchronous    One of OFF, NORMAL, FULL
 * @param busyTimeoutMs  How long a connection waits on a locked database
 * @param maxOpenConns   The pool size
 * @param maxIdleConns   The idle connections kept open, capped at the pool size
 * @param cacheSize      Pages when positive, KiB when negative
 * @param mmapSize       Bytes of memory mapped I/O, 0 to disable
 * @param tempStore      One of DEFAULT, FILE, MEMORY
 */
public record SqliteSettings(
        @Nullable String path,
        String journalMode,
        String synchronous,
        int busyTimeoutMs,
        int maxOpenConns,
        int maxIdleConns,
        int cacheSize,
        long mmapSize,
        String tempStore) {

    public static final String DEFAULT_FILE_NAME = "config.db";

    public SqliteSettings {
        if (maxOpenConns < 1) {
            throw new ConfigUsageError("The SQLite pool needs at least one connection, got " + maxOpenConns);
        }
        if (maxIdleConns < 0 || busyTimeoutMs < 0 || mmapSize < 0) {
            throw new ConfigUsageError("SQLite idle connections, busy timeout and mmap size can not be negative");
        }
        // Fail on unknown pragma values now rather than on the first connection
        toSqliteConfig(journalMode, synchronous, busyTimeoutMs, cacheSize, tempStore);
    }

    public static SqliteSettings defaults() {
        return new SqliteSettings(null, "WAL", "NORMAL", 5000, 8, 8, -2000, 64L * 1024 * 1024, "MEMORY");
    }

    public SqliteSettings withPath(@Nullable final String newPath) {
        return new SqliteSettings(newPath, journalMode, synchronous, busyTimeoutMs, maxOpenConns, maxIdleConns, cacheSize, mmapSize, tempStore);
    }

    /**
     * The pragmas applied to every new connection. mmap_size has no setter and is applied by the pool.
     */
    public SQLiteConfig toSqliteConfig() {
        return toSqliteConfig(journalMode, synchronous, busyTimeoutMs, cacheSize, tempStore);
    }

    private static SQLiteConfig toSqliteConfig(
            final String journalMode,
            final String synchronous,
            final int busyTimeoutMs,
            final int cacheSize,
            final String tempStore) {
        final SQLiteConfig config = new SQLiteConfig();
        config.setJournalMode(parse(SQLiteConfig.JournalMode.class, "journal mode", journalMode));
        config.setSynchronous(parse(SQLiteConfig.SynchronousMode.class, "synchronous mode", synchronous));
        config.setTempStore(parse(SQLiteConfig.TempStore.class, "temp store", tempStore));
        config.setBusyTimeout(busyTimeoutMs);
        config.setCacheSize(cacheSize);
        return config;
    }

    private static <T extends Enum<T>> T parse(final Class<T> type, final String description, final String value) {
        return Try.of(() -> Enum.valueOf(type, value.trim().toUpperCase(Locale.ROOT)))
                .getOrElseThrow(ex -> new ConfigUsageError("Unknown SQLite " + description + ": " + value, ex));
    }
}
