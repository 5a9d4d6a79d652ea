package configstore.application.cli;

import configstore.Marker;
import configstore.domain.exceptionhandling.ExceptionHandler;
import configstore.domain.exceptions.ConfigUsageError;
import configstore.domain.injection.Preferred;
import configstore.domain.marshal.Marshallers;
import configstore.domain.store.Descriptor;
import configstore.domain.store.FormatKey;
import configstore.domain.store.Key;
import configstore.domain.store.Loaded;
import configstore.domain.store.Opener;
import configstore.domain.store.Store;
import io.vavr.control.Try;
import jakarta.enterprise.context.Dependent;
import jakarta.inject.Inject;
import org.apache.commons.lang3.StringUtils;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.weld.environment.se.Weld;
import org.jboss.weld.environment.se.WeldContainer;

import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.Optional;

/**
 * Reads and writes the entries of one scope:
 * <pre>
 * list
 * get &lt;key&gt; [format]
 * set &lt;key&gt; &lt;json&gt; [format]
 * delete &lt;key&gt; [format]
 * </pre>
 * Values are shown and accepted as JSON whatever format they are stored in.
 */
@Dependent
public class Main {
    private static final String USAGE = "Usage: list | get <key> [format] | set <key> <json> [format] | delete <key> [format]";

    @Inject
    @Preferred
    private Opener opener;

    @Inject
    private ExceptionHandler exceptionHandler;

    @Inject
    @ConfigProperty(name = "cs.cli.app", defaultValue = "configstore")
    private String app;

    @Inject
    @ConfigProperty(name = "cs.cli.namespace")
    private Optional<String> namespace;

    @Inject
    @ConfigProperty(name = "cs.cli.verbose", defaultValue = "false")
    private Boolean verbose;

    public static void main(final String[] args) {
        final Weld weld = new Weld();
        final int status;
        try (WeldContainer weldContainer = weld.addBeanClass(Main.class).addPackages(true, Marker.class).initialize()) {
            status = weldContainer.select(Main.class).get().entry(args, System.out, System.err);
        }
        if (status != 0) {
            System.exit(status);
        }
    }

    /**
     * @return The process exit status
     */
    public int entry(final String[] args, final PrintStream out, final PrintStream err) {
        LogConfig.init(verbose);

        if (args.length == 0) {
            err.println(USAGE);
            return 2;
        }

        return Try.of(() -> opener.open(app, namespaceSegments()))
                .andThen(store -> run(store, args, out))
                .map(store -> 0)
                .recover(ConfigUsageError.class, e -> {
                    err.println(e.getMessage());
                    err.println(USAGE);
                    return 2;
                })
                .recover(e -> {
                    err.println("Failed to " + args[0] + ": " + exceptionHandler.getExceptionMessage(e));
                    return 1;
                })
                .get();
    }

    private void run(final Store store, final String[] args, final PrintStream out) {
        final String command = args[0];

        if ("list".equals(command)) {
            store.list().forEach(out::println);
        } else if ("get".equals(command)) {
            final Loaded<Object> loaded = store.unmarshal(descriptor(args, 2), Object.class);
            out.println(loaded.isEmpty() ? "" : new String(Marshallers.JSON.marshal(loaded.value()), StandardCharsets.UTF_8));
        } else if ("set".equals(command)) {
            final String json = argument(args, 2, "value");
            store.marshal(descriptor(args, 3), Marshallers.JSON.unmarshal(json.getBytes(StandardCharsets.UTF_8), Object.class));
        } else if ("delete".equals(command)) {
            store.delete(descriptor(args, 2));
        } else {
            throw new ConfigUsageError("Unknown command: " + command);
        }
    }

    /**
     * The key in args[1], pinned to the format named in args[formatIndex] when there is one.
     */
    private Descriptor descriptor(final String[] args, final int formatIndex) {
        final String key = argument(args, 1, "key");

        if (args.length <= formatIndex || StringUtils.isBlank(args[formatIndex])) {
            return new Key(key);
        }

        return Marshallers.byName(args[formatIndex])
                .<Descriptor>map(format -> new FormatKey(key, format))
                .orElseThrow(() -> new ConfigUsageError("Unknown format: " + args[formatIndex]));
    }

    private String argument(final String[] args, final int index, final String name) {
        if (args.length <= index) {
            throw new ConfigUsageError("Missing " + name);
        }
        return args[index];
    }

    private String[] namespaceSegments() {
        return namespace
                .map(value -> Arrays.stream(value.split("/"))
                        .filter(StringUtils::isNotBlank)
                        .toArray(String[]::new))
                .orElse(new String[0]);
    }
}
