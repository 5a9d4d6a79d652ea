package configstore.infrastructure.directory;

import configstore.domain.exceptionhandling.LoaderExceptionMapping;
import configstore.domain.exceptions.ConfigStoreFailure;
import configstore.domain.exceptions.ConfigUsageError;
import configstore.domain.store.Loader;
import io.vavr.control.Try;

import java.nio.file.FileSystemException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.List;
import java.util.logging.Logger;

import static com.google.common.base.Preconditions.checkNotNull;

/**
 * Keeps each entry in its own file. Every operation is a single read, write or delete of one file, so two writers
 * of the same entry race and the last one wins. There is no locking.
 */
public class DirectoryLoader implements Loader {
    private static final Logger logger = Logger.getLogger(DirectoryLoader.class.getName());

    private final Path directory;
    private final LoaderExceptionMapping exceptionMapping;

    public DirectoryLoader(final Path directory) {
        this.directory = checkNotNull(directory).toAbsolutePath().normalize();
        this.exceptionMapping = new LoaderExceptionMapping(
                describe(),
                NoSuchFileException.class::isInstance,
                DirectoryLoader::isLocked);

        Try.of(() -> Files.createDirectories(this.directory))
                .getOrElseThrow(ex -> new ConfigStoreFailure("Failed to create config directory " + this.directory + ": " + ex.getMessage(), ex));
    }

    public Path getDirectory() {
        return directory;
    }

    @Override
    public List<String> list() {
        return exceptionMapping.get(
                Try.withResources(() -> Files.list(directory))
                        .of(files -> files
                                .filter(Files::isRegularFile)
                                .map(file -> file.getFileName().toString())
                                .toList())
                        // A directory removed behind our back holds no entries
                        .recover(NoSuchFileException.class, ex -> List.of()),
                "list",
                directory.toString());
    }

    @Override
    public byte[] read(final String name) {
        final Path path = pathFor(name);
        logger.fine("Reading " + path);
        return exceptionMapping.get(Try.of(() -> Files.readAllBytes(path)), "read", name);
    }

    @Override
    public void write(final String name, final byte[] data) {
        final Path path = pathFor(name);
        logger.fine("Writing " + data.length + " bytes to " + path);
        exceptionMapping.get(Try.of(() -> Files.write(path, data)), "write", name);
    }

    @Override
    public void delete(final String name) {
        final Path path = pathFor(name);
        logger.fine("Deleting " + path);
        exceptionMapping.get(Try.run(() -> Files.delete(path)), "delete", name);
    }

    @Override
    public String describe() {
        return "directory " + directory;
    }

    /**
     * Stored names must stay inside the scope directory.
     */
    private Path pathFor(final String name) {
        final Path path = directory.resolve(name).normalize();
        if (name.isEmpty() || !directory.equals(path.getParent())) {
            throw new ConfigUsageError("Invalid stored name for " + describe() + ": " + name);
        }
        return path;
    }

    /**
     * Windows reports files held open by another process as a sharing violation.
     */
    private static boolean isLocked(final Throwable ex) {
        return ex instanceof FileSystemException fileSystemException
                && fileSystemException.getReason() != null
                && fileSystemException.getReason().contains("being used by another process");
    }
}
